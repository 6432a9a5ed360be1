package kz.qazmarka.mts.checkpoint;

import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Запись очереди контрольных точек: номер группы, её позиции и признак завершения.
 * Изменяется только под блокировкой {@link CheckpointTracker}.
 */
public final class CheckpointEntry {
    private final long groupId;
    private final LogPosition sourcePosition;
    private final LogPosition targetPosition;
    private TransactionGroup group;
    private boolean done;

    CheckpointEntry(TransactionGroup group) {
        this.groupId = group.id();
        this.sourcePosition = group.sourcePosition();
        this.targetPosition = group.targetPosition();
        this.group = group;
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

    public boolean isDone() {
        return done;
    }

    void markDone() {
        done = true;
    }

    /** Освобождает события группы после выбытия записи. */
    void retire() {
        TransactionGroup g = group;
        group = null;
        if (g != null) {
            g.release();
        }
    }

    @Override
    public String toString() {
        return "G" + groupId + (done ? "+" : "-");
    }
}
