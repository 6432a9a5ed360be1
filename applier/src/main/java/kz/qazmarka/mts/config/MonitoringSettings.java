package kz.qazmarka.mts.config;

/**
 * Настройки мониторинга: экспорт JMX‑метрик и период журнала пропускной способности.
 */
public final class MonitoringSettings {
    private final boolean jmxEnabled;
    private final long throughputLogIntervalMs;

    public MonitoringSettings(boolean jmxEnabled, long throughputLogIntervalMs) {
        this.jmxEnabled = jmxEnabled;
        this.throughputLogIntervalMs = throughputLogIntervalMs;
    }

    public boolean isJmxEnabled() {
        return jmxEnabled;
    }

    public long getThroughputLogIntervalMs() {
        return throughputLogIntervalMs;
    }
}
