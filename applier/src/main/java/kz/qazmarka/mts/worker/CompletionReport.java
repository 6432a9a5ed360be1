package kz.qazmarka.mts.worker;

import kz.qazmarka.mts.coordinator.FailureClass;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Асинхронный отчёт исполнителя о завершении группы.
 *
 * {@link ApplyOutcome#RETRYABLE} в отчёте означает, что группа не применена и будет
 * воспроизведена после перезапуска (брошена при остановке или из-за отказа предшественника).
 */
public final class CompletionReport {
    private final TransactionGroup group;
    private final int workerId;
    private final ApplyOutcome outcome;
    private final FailureClass failureClass;
    private final int attempts;
    private final Throwable cause;

    private CompletionReport(TransactionGroup group,
                             int workerId,
                             ApplyOutcome outcome,
                             FailureClass failureClass,
                             int attempts,
                             Throwable cause) {
        this.group = group;
        this.workerId = workerId;
        this.outcome = outcome;
        this.failureClass = failureClass;
        this.attempts = attempts;
        this.cause = cause;
    }

    public static CompletionReport success(TransactionGroup group, int workerId, int attempts) {
        return new CompletionReport(group, workerId, ApplyOutcome.SUCCESS, null, attempts, null);
    }

    public static CompletionReport abandoned(TransactionGroup group, int workerId, int attempts) {
        return new CompletionReport(group, workerId, ApplyOutcome.RETRYABLE, null, attempts, null);
    }

    public static CompletionReport failed(TransactionGroup group,
                                          int workerId,
                                          FailureClass failureClass,
                                          int attempts,
                                          Throwable cause) {
        return new CompletionReport(group, workerId, ApplyOutcome.FATAL, failureClass, attempts, cause);
    }

    public TransactionGroup group() {
        return group;
    }

    public long groupId() {
        return group.id();
    }

    public LogPosition appliedSourcePosition() {
        return group.sourcePosition();
    }

    public LogPosition appliedTargetPosition() {
        return group.targetPosition();
    }

    public ApplyOutcome outcome() {
        return outcome;
    }

    /** Класс ошибки для {@link ApplyOutcome#FATAL}, иначе {@code null}. */
    public FailureClass failureClass() {
        return failureClass;
    }

    public int workerId() {
        return workerId;
    }

    public int attempts() {
        return attempts;
    }

    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return "CompletionReport{G" + group.id() + ", worker=" + workerId + ", " + outcome
                + (failureClass != null ? ", " + failureClass : "") + ", attempts=" + attempts + '}';
    }
}
