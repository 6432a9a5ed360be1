package kz.qazmarka.mts.worker;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Исполнитель: применяет по одной группе за раз и асинхронно сообщает о завершении.
 * Локальная очередь исполнителя хранится в {@link DependencyResolver} под его блокировкой.
 */
public final class Worker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Worker.class);

    private final int id;
    private final DependencyResolver resolver;
    private final GroupRunner runner;
    private final CompletionListener listener;
    private final AtomicLong groupsApplied = new AtomicLong();

    private volatile TransactionGroup current;
    private volatile Thread thread;
    private volatile LogPosition appliedSource = LogPosition.NONE;
    private volatile LogPosition appliedTarget = LogPosition.NONE;

    Worker(int id, DependencyResolver resolver, GroupRunner runner, CompletionListener listener) {
        this.id = id;
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public int id() {
        return id;
    }

    /**
     * Назначает группу этому исполнителю.
     *
     * @throws IllegalStateException если у исполнителя уже есть назначение (локальная очередь полна)
     */
    public void assign(TransactionGroup group) {
        resolver.assignTo(id, group);
    }

    /** Неблокирующая проверка: нет выполняемой группы и локальная очередь пуста. */
    public boolean isIdle() {
        return current == null && resolver.localDepth(id) == 0;
    }

    public TransactionGroup current() {
        return current;
    }

    public LogPosition appliedSourcePosition() {
        return appliedSource;
    }

    public LogPosition appliedTargetPosition() {
        return appliedTarget;
    }

    public long groupsApplied() {
        return groupsApplied.get();
    }

    @Override
    public void run() {
        thread = Thread.currentThread();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Исполнитель {} запущен", id);
        }
        try {
            while (!Thread.currentThread().isInterrupted()) {
                TransactionGroup g = resolver.next(id);
                if (g == null) {
                    break;
                }
                current = g;
                CompletionReport report = runner.run(g, id);
                if (report.outcome() == ApplyOutcome.SUCCESS) {
                    appliedSource = LogPosition.max(appliedSource, g.sourcePosition());
                    appliedTarget = LogPosition.max(appliedTarget, g.targetPosition());
                    groupsApplied.incrementAndGet();
                }
                try {
                    listener.onCompletion(report);
                } finally {
                    current = null;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.error("Исполнитель {} аварийно завершён", id, e);
            throw e;
        } finally {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Исполнитель {} остановлен, применено групп: {}", id, groupsApplied.get());
            }
        }
    }

    /**
     * Просит исполнителя бросить текущую группу при остановке.
     *
     * @return {@code false}, если группа уже выполнила нетранзакционный эффект и обязана завершиться
     */
    boolean requestAbandon() {
        TransactionGroup g = current;
        if (g != null && !g.tryAbandon()) {
            return false;
        }
        Thread t = thread;
        if (t != null && g != null) {
            t.interrupt();
        }
        return true;
    }
}
