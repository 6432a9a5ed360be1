package kz.qazmarka.mts.coordinator;

import kz.qazmarka.mts.event.LogPosition;

/**
 * Остановка конвейера применения: несёт номер группы, её позиции и класс ошибки.
 */
public final class ApplierFailureException extends Exception {
    private static final long serialVersionUID = 1L;

    private final FailureClass failureClass;
    private final long groupId;
    private final transient LogPosition sourcePosition;
    private final transient LogPosition targetPosition;

    public ApplierFailureException(FailureClass failureClass,
                                   long groupId,
                                   LogPosition sourcePosition,
                                   LogPosition targetPosition,
                                   String message,
                                   Throwable cause) {
        super(format(failureClass, groupId, sourcePosition, message), cause);
        this.failureClass = failureClass;
        this.groupId = groupId;
        this.sourcePosition = sourcePosition == null ? LogPosition.NONE : sourcePosition;
        this.targetPosition = targetPosition == null ? LogPosition.NONE : targetPosition;
    }

    private static String format(FailureClass cls, long groupId, LogPosition source, String message) {
        return "Репликация остановлена [" + cls + "] на группе " + groupId
                + " (позиция " + source + "): " + message;
    }

    public FailureClass failureClass() {
        return failureClass;
    }

    public long groupId() {
        return groupId;
    }

    public LogPosition sourcePosition() {
        return sourcePosition;
    }

    public LogPosition targetPosition() {
        return targetPosition;
    }
}
