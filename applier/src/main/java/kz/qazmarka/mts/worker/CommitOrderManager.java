package kz.qazmarka.mts.worker;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import kz.qazmarka.mts.coordinator.CoordinatorContext;

/**
 * Упорядочивает фазу фиксации групп по номеру, даже если их выполнение перекрывалось.
 *
 * Координатор регистрирует номера параллельно назначаемых групп в порядке назначения.
 * Исполнитель, закончивший применение группы G, ждёт, пока G не окажется в голове очереди,
 * то есть пока все ранее зарегистрированные группы не зафиксируются или не будут сняты.
 * Группы, выполняемые изолированно, не регистрируются и проходят без ожидания.
 */
public final class CommitOrderManager {

    private final boolean enabled;
    private final CoordinatorContext ctx;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition turn = lock.newCondition();
    private final ArrayDeque<Long> order = new ArrayDeque<>();
    private long lastCommitted = -1L;
    private boolean aborted;

    public CommitOrderManager(boolean enabled, CoordinatorContext ctx) {
        this.enabled = enabled;
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Регистрирует группу; номера обязаны возрастать. */
    public void register(long groupId) {
        if (!enabled) {
            return;
        }
        lock.lock();
        try {
            Long last = order.peekLast();
            if (last != null && last >= groupId) {
                throw new IllegalStateException("Нарушен порядок регистрации: " + groupId + " после " + last);
            }
            order.addLast(groupId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ждёт очереди на фиксацию.
     *
     * @return {@code true}, когда группа может фиксироваться; {@code false}, если менеджер прерван
     * @throws InterruptedException ожидание прервано
     */
    public boolean awaitTurn(long groupId) throws InterruptedException {
        if (!enabled) {
            return true;
        }
        lock.lock();
        try {
            if (!order.contains(groupId)) {
                return !aborted;
            }
            boolean counted = false;
            while (!aborted) {
                Long head = order.peekFirst();
                if (head == null || head == groupId) {
                    return true;
                }
                if (!counted) {
                    ctx.onCommitOrderWait();
                    counted = true;
                }
                turn.await();
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Группа зафиксирована. */
    public void finish(long groupId) {
        if (!enabled) {
            return;
        }
        lock.lock();
        try {
            if (order.remove(groupId)) {
                lastCommitted = groupId;
            }
            turn.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Снимает группу, которая не будет зафиксирована (отказ, отказ от выполнения, очистка очередей). */
    public void withdraw(long groupId) {
        if (!enabled) {
            return;
        }
        lock.lock();
        try {
            order.remove(groupId);
            turn.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Будит всех ожидающих с отказом. */
    public void abort() {
        lock.lock();
        try {
            aborted = true;
            turn.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int pending() {
        lock.lock();
        try {
            return order.size();
        } finally {
            lock.unlock();
        }
    }

    /** Номер последней группы, зафиксированной через менеджер, или {@code -1}. */
    long lastCommitted() {
        lock.lock();
        try {
            return lastCommitted;
        } finally {
            lock.unlock();
        }
    }
}
