package kz.qazmarka.mts.config;

import org.apache.hadoop.conf.Configuration;

import kz.qazmarka.mts.util.Parsers;

/**
 * Пороги обратного давления из ключей {@code mts.pending.*}, {@code mts.worker.*run.level}
 * и {@code mts.coordinator.basic.nap.ms}. Уровни задаются в процентах.
 */
final class BackpressureSection {
    final long pendingBytesMax;
    final int overrunLevel;
    final int underrunLevel;
    final long basicNapMs;

    private BackpressureSection(long pendingBytesMax, int overrunLevel, int underrunLevel, long basicNapMs) {
        this.pendingBytesMax = pendingBytesMax;
        this.overrunLevel = overrunLevel;
        this.underrunLevel = underrunLevel;
        this.basicNapMs = basicNapMs;
    }

    /**
     * Формирует секцию, гарантируя минимальные значения. Соотношение уровней
     * (нижний строго меньше верхнего) выравнивает билдер.
     *
     * @param cfg конфигурация Hadoop
     * @return секция порогов обратного давления
     */
    static BackpressureSection from(Configuration cfg) {
        long pendingMax = Parsers.readLongMin(cfg, MtsConfig.K_PENDING_JOBS_SIZE_MAX,
                MtsConfig.DEFAULT_PENDING_JOBS_SIZE_MAX, 1024L);
        int over = Parsers.readIntRange(cfg, MtsConfig.K_OVERRUN_LEVEL, MtsConfig.DEFAULT_OVERRUN_LEVEL, 1, 100);
        int under = Parsers.readIntRange(cfg, MtsConfig.K_UNDERRUN_LEVEL, MtsConfig.DEFAULT_UNDERRUN_LEVEL, 0, 99);
        long nap = Parsers.readLongMin(cfg, MtsConfig.K_BASIC_NAP_MS, MtsConfig.DEFAULT_BASIC_NAP_MS, 1L);
        return new BackpressureSection(pendingMax, over, under, nap);
    }

    boolean levelsInverted() {
        return underrunLevel >= overrunLevel;
    }
}
