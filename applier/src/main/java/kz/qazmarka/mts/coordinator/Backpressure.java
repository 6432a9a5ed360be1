package kz.qazmarka.mts.coordinator;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.config.BackpressureSettings;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Обратное давление координатора по суммарной загрузке исполнителей.
 *
 * Загрузка: наибольшее из двух процентов: байты групп в работе относительно
 * {@code mts.pending.jobs.size.max} и число групп в работе относительно суммарной ёмкости
 * очередей. При достижении верхнего уровня ({@code overrun}) координатор перестаёт
 * назначать и спит по {@code basic.nap}; назначение возобновляется, когда загрузка
 * опускается ниже нижнего уровня ({@code underrun}).
 *
 * Группа, которая одна больше лимита байтов, допускается только при пустом конвейере.
 * Все решения принимает поток координатора.
 */
final class Backpressure {

    private static final Logger LOG = LoggerFactory.getLogger(Backpressure.class);

    private final DependencyResolver resolver;
    private final CoordinatorContext ctx;
    private final long pendingBytesMax;
    private final int overrunLevel;
    private final int underrunLevel;
    private final long napMs;
    private final int entryCapacity;

    private boolean throttled;

    Backpressure(BackpressureSettings settings, DependencyResolver resolver, int workers, CoordinatorContext ctx) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.pendingBytesMax = Math.max(1L, settings.getPendingBytesMax());
        this.overrunLevel = settings.getOverrunLevel();
        this.underrunLevel = settings.getUnderrunLevel();
        this.napMs = Math.max(1L, settings.getBasicNapMs());
        this.entryCapacity = Math.max(1, resolver.maxGroups() + workers * (resolver.localCapacity() + 1));
    }

    /**
     * Ждёт, пока группу можно назначить.
     *
     * @param next      очередная группа
     * @param cancelled признак отмены ожидания (отказ или остановка)
     * @return {@code false}, если ожидание отменено
     * @throws InterruptedException поток координатора прерван
     */
    boolean admit(TransactionGroup next, BooleanSupplier cancelled) throws InterruptedException {
        boolean waited = false;
        try {
            while (true) {
                long pending = resolver.pendingBytes();
                boolean oversize = pending > 0L && pending + next.sizeBytes() > pendingBytesMax;
                int level = usagePercent(pending);
                if (throttled) {
                    if (level < underrunLevel) {
                        throttled = false;
                        if (LOG.isDebugEnabled()) {
                            LOG.debug("Обратное давление снято: загрузка {}%", level);
                        }
                    }
                } else if (level >= overrunLevel) {
                    throttled = true;
                    ctx.onOverrun();
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Обратное давление: загрузка {}% не ниже {}%, приостанавливаю назначение",
                                level, overrunLevel);
                    }
                }
                if (!throttled && !oversize) {
                    countHungry();
                    return true;
                }
                if (!waited) {
                    ctx.onOversizeWait();
                    ctx.setOversize(true);
                    waited = true;
                }
                if (cancelled.getAsBoolean()) {
                    return false;
                }
                TimeUnit.MILLISECONDS.sleep(napMs);
            }
        } finally {
            if (waited) {
                ctx.setOversize(false);
            }
        }
    }

    /** Текущая загрузка, %. */
    int usagePercent(long pendingBytes) {
        long bytesPct = pendingBytes * 100L / pendingBytesMax;
        long entriesPct = (long) resolver.inFlightCount() * 100L / entryCapacity;
        return (int) Math.min(100L, Math.max(bytesPct, entriesPct));
    }

    boolean isThrottled() {
        return throttled;
    }

    private void countHungry() {
        int hungry = 0;
        for (int load : resolver.workerLoads()) {
            if (load == 0) {
                hungry++;
            }
        }
        ctx.onHungryWorkers(hungry);
    }
}
