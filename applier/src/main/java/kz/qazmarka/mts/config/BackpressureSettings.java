package kz.qazmarka.mts.config;

/**
 * Пороговые значения обратного давления координатора.
 */
public final class BackpressureSettings {
    private final long pendingBytesMax;
    private final int overrunLevel;
    private final int underrunLevel;
    private final long basicNapMs;

    public BackpressureSettings(long pendingBytesMax, int overrunLevel, int underrunLevel, long basicNapMs) {
        this.pendingBytesMax = pendingBytesMax;
        this.overrunLevel = overrunLevel;
        this.underrunLevel = underrunLevel;
        this.basicNapMs = basicNapMs;
    }

    public long getPendingBytesMax() {
        return pendingBytesMax;
    }

    /** Заполненность (%), при которой координатор перестаёт назначать группы. */
    public int getOverrunLevel() {
        return overrunLevel;
    }

    /** Заполненность (%), ниже которой назначение возобновляется; исполнитель ниже неё считается «голодным». */
    public int getUnderrunLevel() {
        return underrunLevel;
    }

    public long getBasicNapMs() {
        return basicNapMs;
    }
}
