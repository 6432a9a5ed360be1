package kz.qazmarka.mts.config;

/**
 * Параметры очереди контрольных точек и политики сброса позиции.
 */
public final class CheckpointSettings {
    private final int group;
    private final long periodMs;
    private final boolean syncOnCommit;
    private final boolean flushAfterIsolation;

    public CheckpointSettings(int group, long periodMs, boolean syncOnCommit, boolean flushAfterIsolation) {
        this.group = group;
        this.periodMs = periodMs;
        this.syncOnCommit = syncOnCommit;
        this.flushAfterIsolation = flushAfterIsolation;
    }

    /** Максимальная длина очереди контрольных точек ({@code checkpoint_group}). */
    public int getGroup() {
        return group;
    }

    public long getPeriodMs() {
        return periodMs;
    }

    public boolean isSyncOnCommit() {
        return syncOnCommit;
    }

    public boolean isFlushAfterIsolation() {
        return flushAfterIsolation;
    }
}
