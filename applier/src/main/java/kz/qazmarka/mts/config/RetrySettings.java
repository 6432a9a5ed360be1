package kz.qazmarka.mts.config;

/**
 * Повторы применения группы при транзиентных ошибках.
 */
public final class RetrySettings {
    private final int maxRetries;
    private final long backoffBaseMs;
    private final long backoffMaxMs;

    public RetrySettings(int maxRetries, long backoffBaseMs, long backoffMaxMs) {
        this.maxRetries = maxRetries;
        this.backoffBaseMs = backoffBaseMs;
        this.backoffMaxMs = backoffMaxMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }
}
