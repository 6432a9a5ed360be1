package kz.qazmarka.mts.coordinator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Явный контекст координатора: счётчики, флаг отказа и счётчик пропуска групп.
 * Передаётся всем участникам конвейера вместо глобальных переменных.
 *
 * Владение полями: счётчики блока «координатор» пишет только поток координатора
 * ({@link AtomicLong} ради публикации читателям), блок «исполнители» пишут потоки
 * исполнителей ({@link LongAdder}). Флаг отказа устанавливается первым сообщившим.
 */
public final class CoordinatorContext {

    // ==== пишет координатор ====
    private final AtomicLong groupsAssigned = new AtomicLong();
    private final AtomicLong eventsAssigned = new AtomicLong();
    private final AtomicLong isolatedGroups = new AtomicLong();
    private final AtomicLong skippedGroups = new AtomicLong();
    private final AtomicLong discardedPartialGroups = new AtomicLong();
    private final AtomicLong oversizeWaits = new AtomicLong();
    private final AtomicLong overrunCount = new AtomicLong();
    private final AtomicLong hungryWorkerCount = new AtomicLong();
    private final AtomicLong overfillCount = new AtomicLong();
    private final AtomicLong queueFullWaits = new AtomicLong();
    private final AtomicLong checkpointFullWaits = new AtomicLong();
    private final AtomicLong checkpointSeqno = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong recoveryGroupCount = new AtomicLong();
    private final AtomicLong recoveryIndex = new AtomicLong();
    private volatile boolean oversize;

    // ==== пишут исполнители ====
    private final LongAdder groupsCompleted = new LongAdder();
    private final LongAdder transactionRetries = new LongAdder();
    private final LongAdder retriedGroups = new LongAdder();
    private final LongAdder predecessorWaits = new LongAdder();
    private final LongAdder commitOrderWaits = new LongAdder();
    private final LongAdder dependencyViolations = new LongAdder();
    private final LongAdder abandonedGroups = new LongAdder();
    private final AtomicInteger workersWaiting = new AtomicInteger();

    // ==== пишет поверхность управления, уменьшает координатор ====
    private final AtomicLong skipCounter = new AtomicLong();

    private final AtomicReference<ApplierFailureException> failure = new AtomicReference<>();

    /**
     * Устанавливает флаг отказа. Сохраняется только первый отказ.
     *
     * @return {@code true}, если этот отказ стал первым
     */
    public boolean fail(ApplierFailureException ex) {
        return failure.compareAndSet(null, ex);
    }

    public boolean hasFailure() {
        return failure.get() != null;
    }

    /** Первый зарегистрированный отказ или {@code null}. */
    public ApplierFailureException failure() {
        return failure.get();
    }

    public void onGroupAssigned(int events) {
        groupsAssigned.incrementAndGet();
        eventsAssigned.addAndGet(events);
    }

    public void onIsolated() {
        isolatedGroups.incrementAndGet();
    }

    public void onSkipped() {
        skippedGroups.incrementAndGet();
    }

    public void onPartialGroupDiscarded() {
        discardedPartialGroups.incrementAndGet();
    }

    public void onOversizeWait() {
        oversizeWaits.incrementAndGet();
    }

    public void onOverrun() {
        overrunCount.incrementAndGet();
    }

    public void onHungryWorkers(int count) {
        if (count > 0) {
            hungryWorkerCount.addAndGet(count);
        }
    }

    public void onOverfill() {
        overfillCount.incrementAndGet();
    }

    public void onQueueFullWait() {
        queueFullWaits.incrementAndGet();
    }

    public void onCheckpointFullWait() {
        checkpointFullWaits.incrementAndGet();
    }

    public void onCheckpointRecorded() {
        checkpointSeqno.incrementAndGet();
    }

    public void onFlushed() {
        flushes.incrementAndGet();
        checkpointSeqno.set(0L);
    }

    public void onRecoveryPlanned(long gapGroups) {
        recoveryGroupCount.set(gapGroups);
        recoveryIndex.set(0L);
    }

    public void onRecoveryStep() {
        recoveryIndex.incrementAndGet();
    }

    public void setOversize(boolean value) {
        this.oversize = value;
    }

    public boolean isOversize() {
        return oversize;
    }

    public void onGroupCompleted() {
        groupsCompleted.increment();
    }

    public void onTransactionRetry(boolean firstRetryOfGroup) {
        transactionRetries.increment();
        if (firstRetryOfGroup) {
            retriedGroups.increment();
        }
    }

    public void onPredecessorWait() {
        predecessorWaits.increment();
    }

    public void onCommitOrderWait() {
        commitOrderWaits.increment();
    }

    public void onDependencyViolation() {
        dependencyViolations.increment();
    }

    public void onAbandoned() {
        abandonedGroups.increment();
    }

    public void workerWaitStarted() {
        workersWaiting.incrementAndGet();
    }

    public void workerWaitFinished() {
        workersWaiting.decrementAndGet();
    }

    public void setSkipCounter(long groups) {
        skipCounter.set(Math.max(0L, groups));
    }

    /**
     * Списывает одну группу со счётчика пропуска.
     *
     * @return {@code true}, если очередную группу нужно пропустить
     */
    public boolean consumeSkip() {
        long cur;
        do {
            cur = skipCounter.get();
            if (cur <= 0L) {
                return false;
            }
        } while (!skipCounter.compareAndSet(cur, cur - 1));
        return true;
    }

    public long groupsAssigned() {
        return groupsAssigned.get();
    }

    public long eventsAssigned() {
        return eventsAssigned.get();
    }

    public long isolatedGroups() {
        return isolatedGroups.get();
    }

    public long skippedGroups() {
        return skippedGroups.get();
    }

    public long oversizeWaits() {
        return oversizeWaits.get();
    }

    public long overrunCount() {
        return overrunCount.get();
    }

    public long hungryWorkerCount() {
        return hungryWorkerCount.get();
    }

    public long overfillCount() {
        return overfillCount.get();
    }

    public long queueFullWaits() {
        return queueFullWaits.get();
    }

    public long checkpointSeqno() {
        return checkpointSeqno.get();
    }

    public long flushes() {
        return flushes.get();
    }

    public long recoveryGroupCount() {
        return recoveryGroupCount.get();
    }

    public long recoveryIndex() {
        return recoveryIndex.get();
    }

    public long groupsCompleted() {
        return groupsCompleted.sum();
    }

    public long transactionRetries() {
        return transactionRetries.sum();
    }

    public long retriedGroups() {
        return retriedGroups.sum();
    }

    public long predecessorWaits() {
        return predecessorWaits.sum();
    }

    public long commitOrderWaits() {
        return commitOrderWaits.sum();
    }

    public long dependencyViolations() {
        return dependencyViolations.sum();
    }

    public long abandonedGroups() {
        return abandonedGroups.sum();
    }

    public int workersWaiting() {
        return workersWaiting.get();
    }

    public long skipCounter() {
        return skipCounter.get();
    }

    /**
     * Снимок счётчиков для JMX и статуса. Порядок ключей стабилен.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>(32);
        m.put("groups.assigned", groupsAssigned());
        m.put("events.assigned", eventsAssigned());
        m.put("groups.completed", groupsCompleted());
        m.put("groups.isolated", isolatedGroups());
        m.put("groups.skipped", skippedGroups());
        m.put("groups.partial.discarded", discardedPartialGroups.get());
        m.put("groups.abandoned", abandonedGroups());
        m.put("backpressure.oversize.waits", oversizeWaits());
        m.put("backpressure.overrun", overrunCount());
        m.put("backpressure.hungry.workers", hungryWorkerCount());
        m.put("backpressure.oversize.now", oversize ? 1L : 0L);
        m.put("queue.overfill", overfillCount());
        m.put("queue.full.waits", queueFullWaits());
        m.put("checkpoint.full.waits", checkpointFullWaits.get());
        m.put("checkpoint.seqno", checkpointSeqno());
        m.put("checkpoint.flushes", flushes());
        m.put("retry.transactions", transactionRetries());
        m.put("retry.groups", retriedGroups());
        m.put("wait.predecessor", predecessorWaits());
        m.put("wait.commit.order", commitOrderWaits());
        m.put("workers.waiting", (long) workersWaiting());
        m.put("dependency.violations", dependencyViolations());
        m.put("recovery.groups", recoveryGroupCount());
        m.put("recovery.index", recoveryIndex());
        m.put("skip.counter", skipCounter());
        m.put("failure", hasFailure() ? 1L : 0L);
        return m;
    }
}
