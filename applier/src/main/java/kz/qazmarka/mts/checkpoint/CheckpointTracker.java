package kz.qazmarka.mts.checkpoint;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.config.CheckpointSettings;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.TransactionGroup;
import kz.qazmarka.mts.worker.ApplyOutcome;

/**
 * Ограниченная упорядоченная очередь групп в работе (GAQ) и вычисление низшей отметки.
 *
 * Записи добавляются в порядке назначения ({@link #record}), завершаются в любом порядке
 * ({@link #markDone}), а выбывают только непрерывным завершённым префиксом с головы очереди.
 * Низшая отметка: позиции последней выбывшей записи; она не убывает. Длина очереди не
 * превышает {@code checkpoint_group}: координатор ждёт в {@link #record}, пока голова не выбудет.
 *
 * Сброс ({@link #flush}) передаёт внешнему хранилищу низшую отметку, наибольший назначенный
 * номер и битовую карту завершённых записей за отметкой. Без {@code force} сбросы
 * объединяются по периоду, если это не фиксация при включённой синхронизации на каждой фиксации.
 * Сбрасывать могут и координатор, и исполнители; записи в хранилище не перекрываются.
 */
public final class CheckpointTracker {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointTracker.class);
    /** Период проверки признака отмены при ожидании места в очереди. */
    static final long CANCEL_CHECK_MS = 50L;
    private static final long CANCEL_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(CANCEL_CHECK_MS);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition advanced = lock.newCondition();
    /** Упорядочивает записи в хранилище; запись идёт вне {@link #lock}. */
    private final ReentrantLock flushLock = new ReentrantLock();

    private final int capacity;
    private final long periodNanos;
    private final boolean syncOnCommit;
    private final PositionStore store;
    private final CoordinatorContext ctx;

    private final ArrayDeque<CheckpointEntry> queue = new ArrayDeque<>();
    private final Map<Long, CheckpointEntry> byId = new HashMap<>();
    private Checkpoint lowWater;
    private long highestRecorded;
    /** Состояние, с которого начат запуск: разрыв восстановления до его повторного прохода. */
    private final DurableState recovered;
    private Checkpoint lastFlushed;
    private long lastFlushNanos;
    private boolean closed;

    public CheckpointTracker(CheckpointSettings settings,
                             PositionStore store,
                             Checkpoint start,
                             CoordinatorContext ctx) {
        this(settings, store, new DurableState(start, start.groupId(), new BitSet()), ctx);
    }

    /**
     * Трекер, продолжающий сохранённое состояние. Пока группы разрыва не записаны заново,
     * сбросы сохраняют прежний наибольший номер и отметки завершённых групп разрыва.
     */
    public CheckpointTracker(CheckpointSettings settings,
                             PositionStore store,
                             DurableState recovered,
                             CoordinatorContext ctx) {
        this.capacity = settings.getGroup();
        this.periodNanos = TimeUnit.MILLISECONDS.toNanos(settings.getPeriodMs());
        this.syncOnCommit = settings.isSyncOnCommit();
        this.store = Objects.requireNonNull(store, "store");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.recovered = Objects.requireNonNull(recovered, "recovered");
        Checkpoint start = recovered.checkpoint();
        this.lowWater = start;
        this.lastFlushed = start;
        this.highestRecorded = start.groupId();
        this.lastFlushNanos = System.nanoTime();
    }

    /**
     * Добавляет запись для назначенной группы, ожидая места в очереди.
     *
     * @return {@code false}, если трекер закрыт
     * @throws InterruptedException ожидание прервано
     */
    public boolean record(TransactionGroup group) throws InterruptedException {
        return record(group, () -> false);
    }

    /**
     * Как {@link #record(TransactionGroup)}, но ожидание места прекращается, как только
     * {@code cancelled} вернёт {@code true}. Признак проверяется не реже {@link #CANCEL_CHECK_MS}:
     * неуспешная запись не выбывает, и после отказа место в очереди может не освободиться.
     *
     * @param cancelled признак отмены ожидания (отказ или остановка)
     * @return {@code false}, если трекер закрыт или ожидание отменено
     * @throws InterruptedException ожидание прервано
     */
    public boolean record(TransactionGroup group, BooleanSupplier cancelled) throws InterruptedException {
        Objects.requireNonNull(cancelled, "cancelled");
        lock.lock();
        try {
            if (group.id() <= highestRecorded) {
                throw new IllegalStateException("Номер группы " + group.id()
                        + " не больше последнего записанного " + highestRecorded);
            }
            boolean counted = false;
            while (!closed && queue.size() >= capacity) {
                if (cancelled.getAsBoolean()) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Контрольные точки: ожидание места для группы {} отменено", group.id());
                    }
                    return false;
                }
                if (!counted) {
                    ctx.onCheckpointFullWait();
                    counted = true;
                }
                notFull.awaitNanos(CANCEL_CHECK_NANOS);
            }
            if (closed) {
                return false;
            }
            CheckpointEntry e = new CheckpointEntry(group);
            queue.addLast(e);
            byId.put(e.groupId(), e);
            highestRecorded = group.id();
            ctx.onCheckpointRecorded();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Отмечает завершение группы. Успешные записи выбывают непрерывным префиксом;
     * неуспешная запись остаётся и задерживает низшую отметку.
     *
     * @return число выбывших записей
     */
    public int markDone(long groupId, ApplyOutcome outcome) {
        lock.lock();
        try {
            CheckpointEntry e = byId.get(groupId);
            if (e == null) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Контрольные точки: группа {} отсутствует в очереди", groupId);
                }
                return 0;
            }
            if (outcome != ApplyOutcome.SUCCESS) {
                return 0;
            }
            e.markDone();
            int retired = 0;
            CheckpointEntry head;
            while ((head = queue.peekFirst()) != null && head.isDone()) {
                queue.pollFirst();
                byId.remove(head.groupId());
                lowWater = new Checkpoint(head.groupId(), head.sourcePosition(), head.targetPosition());
                head.retire();
                retired++;
            }
            if (retired > 0) {
                notFull.signalAll();
                advanced.signalAll();
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Сбрасывает текущее состояние во внешнее хранилище.
     *
     * @param force         немедленный сброс без объединения
     * @param isCommitEvent сброс вызван фиксацией группы
     * @return {@code true}, если состояние записано
     * @throws IOException ошибка хранилища
     */
    public boolean flush(boolean force, boolean isCommitEvent) throws IOException {
        flushLock.lock();
        try {
            DurableState state;
            lock.lock();
            try {
                if (!force && !(isCommitEvent && syncOnCommit)
                        && System.nanoTime() - lastFlushNanos < periodNanos) {
                    return false;
                }
                state = snapshotLocked();
            } finally {
                lock.unlock();
            }
            store.flush(state, force);
            lock.lock();
            try {
                lastFlushed = state.checkpoint();
                lastFlushNanos = System.nanoTime();
            } finally {
                lock.unlock();
            }
            ctx.onFlushed();
            if (LOG.isDebugEnabled()) {
                LOG.debug("Контрольные точки: сброшено {}", state);
            }
            return true;
        } finally {
            flushLock.unlock();
        }
    }

    /** Текущее состояние для сохранения. */
    public DurableState snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private DurableState snapshotLocked() {
        BitSet bits = new BitSet();
        long base = lowWater.groupId() + 1L;
        for (CheckpointEntry e : queue) {
            if (e.isDone()) {
                bits.set((int) (e.groupId() - base));
            }
        }
        long highest = highestRecorded;
        for (long id = highestRecorded + 1L; id <= recovered.highestAssignedGroupId(); id++) {
            if (recovered.isCompleted(id)) {
                bits.set((int) (id - base));
            }
            highest = id;
        }
        return new DurableState(lowWater, highest, bits);
    }

    /**
     * Ждёт, пока низшая отметка не достигнет позиции первичного сервера.
     *
     * @return {@code true}, если позиция достигнута до истечения таймаута
     */
    public boolean awaitDurable(LogPosition target, long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!lowWater.targetPosition().reached(target)) {
                if (closed || nanos <= 0L) {
                    return false;
                }
                nanos = advanced.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Низшая отметка: всё до неё включительно применено. */
    public Checkpoint durable() {
        lock.lock();
        try {
            return lowWater;
        } finally {
            lock.unlock();
        }
    }

    /** Последняя отметка, записанная во внешнее хранилище. */
    public Checkpoint lastFlushed() {
        lock.lock();
        try {
            return lastFlushed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Будит ожидающих; дальнейшие {@link #record} возвращают {@code false}. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
            advanced.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
