package kz.qazmarka.mts.checkpoint;

import java.util.Objects;

import kz.qazmarka.mts.event.LogPosition;

/**
 * Низшая отметка применения: последняя группа, все предшественники которой завершены,
 * и её позиции в журнале-источнике и журнале первичного сервера.
 */
public final class Checkpoint {

    /** Начальное состояние: ни одна группа не применена. */
    public static final Checkpoint INITIAL = new Checkpoint(0L, LogPosition.NONE, LogPosition.NONE);

    private final long groupId;
    private final LogPosition sourcePosition;
    private final LogPosition targetPosition;

    public Checkpoint(long groupId, LogPosition sourcePosition, LogPosition targetPosition) {
        if (groupId < 0L) {
            throw new IllegalArgumentException("Номер группы не может быть отрицательным: " + groupId);
        }
        this.groupId = groupId;
        this.sourcePosition = Objects.requireNonNull(sourcePosition, "sourcePosition");
        this.targetPosition = Objects.requireNonNull(targetPosition, "targetPosition");
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checkpoint)) return false;
        Checkpoint that = (Checkpoint) o;
        return groupId == that.groupId
                && sourcePosition.equals(that.sourcePosition)
                && targetPosition.equals(that.targetPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, sourcePosition, targetPosition);
    }

    @Override
    public String toString() {
        return "Checkpoint{G" + groupId + ", src=" + sourcePosition + ", target=" + targetPosition + '}';
    }
}
