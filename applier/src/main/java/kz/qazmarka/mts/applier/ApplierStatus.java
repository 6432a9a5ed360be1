package kz.qazmarka.mts.applier;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import kz.qazmarka.mts.checkpoint.Checkpoint;
import kz.qazmarka.mts.coordinator.ApplierFailureException;
import kz.qazmarka.mts.coordinator.GroupStatus;
import kz.qazmarka.mts.event.LogPosition;

/**
 * Неизменяемый снимок состояния применителя для операторов и мониторинга.
 */
public final class ApplierStatus {

    private final boolean running;
    private final LogPosition readSourcePosition;
    private final LogPosition readTargetPosition;
    private final LogPosition appliedSourcePosition;
    private final LogPosition appliedTargetPosition;
    private final Checkpoint durableCheckpoint;
    private final Checkpoint flushedCheckpoint;
    private final boolean recovering;
    private final boolean parallelExec;
    private final GroupStatus groupStatus;
    private final int[] workerQueueDepths;
    private final int checkpointQueueSize;
    private final Map<String, Long> counters;
    private final ApplierFailureException lastFailure;

    private ApplierStatus(Builder b) {
        this.running = b.running;
        this.readSourcePosition = b.readSourcePosition;
        this.readTargetPosition = b.readTargetPosition;
        this.appliedSourcePosition = b.appliedSourcePosition;
        this.appliedTargetPosition = b.appliedTargetPosition;
        this.durableCheckpoint = b.durableCheckpoint;
        this.flushedCheckpoint = b.flushedCheckpoint;
        this.recovering = b.recovering;
        this.parallelExec = b.parallelExec;
        this.groupStatus = b.groupStatus;
        this.workerQueueDepths = b.workerQueueDepths.clone();
        this.checkpointQueueSize = b.checkpointQueueSize;
        this.counters = Collections.unmodifiableMap(new LinkedHashMap<>(b.counters));
        this.lastFailure = b.lastFailure;
    }

    static Builder builder() {
        return new Builder();
    }

    public boolean isRunning() {
        return running;
    }

    /** Наибольшая прочитанная позиция журнала-источника. */
    public LogPosition readSourcePosition() {
        return readSourcePosition;
    }

    /** Наибольшая прочитанная позиция первичного сервера. */
    public LogPosition readTargetPosition() {
        return readTargetPosition;
    }

    /** Наибольшая позиция источника среди применённых групп (не обязательно непрерывно). */
    public LogPosition appliedSourcePosition() {
        return appliedSourcePosition;
    }

    public LogPosition appliedTargetPosition() {
        return appliedTargetPosition;
    }

    /** Низшая отметка: всё до неё включительно применено. */
    public Checkpoint durableCheckpoint() {
        return durableCheckpoint;
    }

    /** Последняя отметка, записанная в хранилище. */
    public Checkpoint flushedCheckpoint() {
        return flushedCheckpoint;
    }

    public boolean isRecovering() {
        return recovering;
    }

    public boolean isParallelExec() {
        return parallelExec;
    }

    public GroupStatus groupStatus() {
        return groupStatus;
    }

    /** Глубина очереди каждого исполнителя (локальная очередь плюс выполняемая группа). */
    public int[] workerQueueDepths() {
        return workerQueueDepths.clone();
    }

    public int checkpointQueueSize() {
        return checkpointQueueSize;
    }

    /** Счётчики и показатели; см. {@code CoordinatorContext#snapshot()}. */
    public Map<String, Long> counters() {
        return counters;
    }

    public long counter(String key) {
        Long v = counters.get(key);
        return v == null ? 0L : v;
    }

    /** Отказ, остановивший конвейер, или {@code null}. */
    public ApplierFailureException lastFailure() {
        return lastFailure;
    }

    @Override
    public String toString() {
        return "ApplierStatus{running=" + running
                + ", read=" + readSourcePosition
                + ", applied=" + appliedSourcePosition
                + ", durable=" + durableCheckpoint
                + ", recovering=" + recovering
                + ", workers=" + Arrays.toString(workerQueueDepths)
                + ", checkpointQueue=" + checkpointQueueSize
                + (lastFailure == null ? "" : ", failure=" + lastFailure.failureClass())
                + '}';
    }

    static final class Builder {
        private boolean running;
        private LogPosition readSourcePosition = LogPosition.NONE;
        private LogPosition readTargetPosition = LogPosition.NONE;
        private LogPosition appliedSourcePosition = LogPosition.NONE;
        private LogPosition appliedTargetPosition = LogPosition.NONE;
        private Checkpoint durableCheckpoint = Checkpoint.INITIAL;
        private Checkpoint flushedCheckpoint = Checkpoint.INITIAL;
        private boolean recovering;
        private boolean parallelExec;
        private GroupStatus groupStatus = GroupStatus.NOT_IN_GROUP;
        private int[] workerQueueDepths = new int[0];
        private int checkpointQueueSize;
        private Map<String, Long> counters = Collections.emptyMap();
        private ApplierFailureException lastFailure;

        private Builder() {
        }

        Builder running(boolean v) {
            this.running = v;
            return this;
        }

        Builder read(LogPosition source, LogPosition target) {
            this.readSourcePosition = source;
            this.readTargetPosition = target;
            return this;
        }

        Builder applied(LogPosition source, LogPosition target) {
            this.appliedSourcePosition = source;
            this.appliedTargetPosition = target;
            return this;
        }

        Builder checkpoints(Checkpoint durable, Checkpoint flushed) {
            this.durableCheckpoint = durable;
            this.flushedCheckpoint = flushed;
            return this;
        }

        Builder recovering(boolean v) {
            this.recovering = v;
            return this;
        }

        Builder parallelExec(boolean v) {
            this.parallelExec = v;
            return this;
        }

        Builder groupStatus(GroupStatus v) {
            this.groupStatus = v;
            return this;
        }

        Builder workerQueueDepths(int[] v) {
            this.workerQueueDepths = v;
            return this;
        }

        Builder checkpointQueueSize(int v) {
            this.checkpointQueueSize = v;
            return this;
        }

        Builder counters(Map<String, Long> v) {
            this.counters = v;
            return this;
        }

        Builder lastFailure(ApplierFailureException v) {
            this.lastFailure = v;
            return this;
        }

        ApplierStatus build() {
            return new ApplierStatus(this);
        }
    }
}
