package kz.qazmarka.mts.util;

import java.security.SecureRandom;
import java.util.concurrent.TimeUnit;

/**
 * Экспоненциальный backoff между повторами применения группы с криптографическим джиттером.
 * Задержка попытки {@code n} равна {@code base * 2^(n-1)}, но не больше {@code max}; к ней
 * добавляется симметричный джиттер в процентах.
 */
public final class BackoffPolicy {
    private static final SecureRandom SR = new SecureRandom();
    private final long baseNanos;
    private final long maxNanos;
    private final int jitterPercent;

    public BackoffPolicy(long baseMs, long maxMs, int jitterPercent) {
        this.baseNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, baseMs));
        this.maxNanos = Math.max(this.baseNanos, TimeUnit.MILLISECONDS.toNanos(Math.max(0L, maxMs)));
        this.jitterPercent = Math.max(0, Math.min(100, jitterPercent));
    }

    /**
     * @param attempt номер повтора, начиная с 1
     * @return задержка в наносекундах, не меньше нуля
     */
    public long delayNanos(int attempt) {
        if (baseNanos == 0L) {
            return 0L;
        }
        int shift = Math.max(0, Math.min(30, attempt - 1));
        long raw = baseNanos << shift;
        long capped = (raw <= 0L || raw > maxNanos) ? maxNanos : raw;
        if (jitterPercent == 0) {
            return capped;
        }
        long jitter = Math.max(1L, (capped * jitterPercent) / 100L);
        long d = capped + nextLongBetweenSecure(-jitter, jitter + 1);
        return (d < 0L) ? 0L : d;
    }

    /**
     * Спит положенную для попытки паузу.
     *
     * @throws InterruptedException если поток прерван во время ожидания
     */
    public void pause(int attempt) throws InterruptedException {
        long d = delayNanos(attempt);
        if (d > 0L) {
            TimeUnit.NANOSECONDS.sleep(d);
        }
    }

    private static long nextLongBetweenSecure(long originInclusive, long boundExclusive) {
        long n = boundExclusive - originInclusive;
        if (n <= 0) return originInclusive;
        long bits;
        long val;
        do {
            bits = SR.nextLong() >>> 1;
            val = bits % n;
        } while (bits - val + (n - 1) < 0L);
        return originInclusive + val;
    }
}
