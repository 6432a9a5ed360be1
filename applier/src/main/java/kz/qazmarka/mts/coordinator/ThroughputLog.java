package kz.qazmarka.mts.coordinator;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

/**
 * Периодическая строка скорости применения: группы и события за окно.
 * Вызывается только потоком координатора.
 */
final class ThroughputLog {

    private final long intervalNs;
    private long windowStart;
    private long groupsAtStart;
    private long eventsAtStart;
    private long completedAtStart;

    ThroughputLog(long intervalMs) {
        this.intervalNs = TimeUnit.MILLISECONDS.toNanos(intervalMs);
        this.windowStart = System.nanoTime();
    }

    void maybeLog(CoordinatorContext ctx, Logger log) {
        if (intervalNs <= 0L) {
            return;
        }
        long now = System.nanoTime();
        long elapsed = now - windowStart;
        if (elapsed < intervalNs) {
            return;
        }
        long groups = ctx.groupsAssigned();
        long events = ctx.eventsAssigned();
        long completed = ctx.groupsCompleted();
        long dGroups = groups - groupsAtStart;
        long dEvents = events - eventsAtStart;
        long dCompleted = completed - completedAtStart;
        windowStart = now;
        groupsAtStart = groups;
        eventsAtStart = events;
        completedAtStart = completed;
        if (dGroups == 0L && dCompleted == 0L) {
            return;
        }
        if (log.isInfoEnabled()) {
            double seconds = elapsed / 1_000_000_000.0;
            log.info("Скорость применения: назначено групп={}, событий={}, групп/с={}, применено групп={}, интервал_мс={}",
                    dGroups,
                    dEvents,
                    String.format(Locale.ROOT, "%.1f", dGroups / seconds),
                    dCompleted,
                    TimeUnit.NANOSECONDS.toMillis(elapsed));
        }
        if (log.isDebugEnabled()) {
            log.debug("Скорость применения (доп. метрики): ожиданий предшественника={}, ожиданий очереди фиксации={}, "
                            + "ожиданий обратного давления={}, повторов={}",
                    ctx.predecessorWaits(), ctx.commitOrderWaits(), ctx.oversizeWaits(), ctx.transactionRetries());
        }
    }
}
