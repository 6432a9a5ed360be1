package kz.qazmarka.mts.applier;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.management.ObjectName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.applier.metrics.ApplierMetricsJmx;
import kz.qazmarka.mts.checkpoint.CheckpointTracker;
import kz.qazmarka.mts.checkpoint.DurableState;
import kz.qazmarka.mts.checkpoint.PositionStore;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.coordinator.Coordinator;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.EventArena;
import kz.qazmarka.mts.recovery.RecoveryGapException;
import kz.qazmarka.mts.recovery.RecoveryPlan;
import kz.qazmarka.mts.recovery.RecoveryPlanner;
import kz.qazmarka.mts.worker.CommitOrderManager;
import kz.qazmarka.mts.worker.GroupApplier;
import kz.qazmarka.mts.worker.GroupRunner;
import kz.qazmarka.mts.worker.WorkerPool;

/**
 * Компоненты одного запуска применителя: резолвер, трекер контрольных точек, менеджер
 * порядка фиксаций, пул исполнителей, координатор и JMX-регистрация.
 * Создаются атомарно (при ошибке уже созданное закрывается) и останавливаются одним вызовом.
 */
final class ApplierResources {

    private static final Logger LOG = LoggerFactory.getLogger(ApplierResources.class);

    private final CoordinatorContext ctx;
    private final DependencyResolver resolver;
    private final CommitOrderManager commitOrder;
    private final CheckpointTracker tracker;
    private final RecoveryPlanner recovery;
    private final WorkerPool pool;
    private final Coordinator coordinator;
    private volatile ObjectName jmxName;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    private ApplierResources(CoordinatorContext ctx,
                             DependencyResolver resolver,
                             CommitOrderManager commitOrder,
                             CheckpointTracker tracker,
                             RecoveryPlanner recovery,
                             WorkerPool pool,
                             Coordinator coordinator) {
        this.ctx = ctx;
        this.resolver = resolver;
        this.commitOrder = commitOrder;
        this.tracker = tracker;
        this.recovery = recovery;
        this.pool = pool;
        this.coordinator = coordinator;
    }

    /**
     * Строит компоненты по сохранённому состоянию.
     *
     * @throws RecoveryGapException сохранённое состояние несогласовано
     */
    static ApplierResources create(MtsConfig config,
                                   GroupApplier applier,
                                   PositionStore store,
                                   KeyEquivalence equivalence,
                                   DurableState state,
                                   LogPosition untilTarget,
                                   LogPosition untilSource,
                                   long skipGroups) throws RecoveryGapException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(applier, "applier");
        Objects.requireNonNull(store, "store");
        RecoveryPlan plan = RecoveryPlanner.plan(state);
        int workers = config.getScheduling().getWorkers();

        try (ResourceGuard guard = new ResourceGuard()) {
            CoordinatorContext ctx = new CoordinatorContext();
            ctx.setSkipCounter(skipGroups);
            DependencyResolver resolver = new DependencyResolver(config.getDependency(), equivalence, ctx);
            guard.register((AutoCloseable) resolver::close);
            CommitOrderManager commitOrder = new CommitOrderManager(config.getScheduling().isCommitOrder(), ctx);
            guard.register((AutoCloseable) commitOrder::abort);
            CheckpointTracker tracker = new CheckpointTracker(config.getCheckpoint(), store, state, ctx);
            guard.register((AutoCloseable) tracker::close);
            GroupRunner runner = new GroupRunner(applier, resolver, commitOrder, config.getRetry(), ctx);
            RecoveryPlanner recovery = new RecoveryPlanner(plan, workers, ctx);
            Coordinator coordinator = Coordinator.builder()
                    .config(config)
                    .arena(new EventArena())
                    .resolver(resolver)
                    .tracker(tracker)
                    .commitOrder(commitOrder)
                    .runner(runner)
                    .recovery(recovery)
                    .context(ctx)
                    .untilTarget(untilTarget)
                    .untilSource(untilSource)
                    .build();
            WorkerPool pool = workers > 0
                    ? guard.register(new WorkerPool(workers, config.getScheduling().getWorkerQueueCapacity(),
                            resolver, runner, coordinator))
                    : null;
            ApplierResources res = new ApplierResources(ctx, resolver, commitOrder, tracker, recovery, pool,
                    coordinator);
            if (config.getMonitoring().isJmxEnabled()) {
                res.jmxName = ApplierMetricsJmx.register(res::metrics);
            }
            guard.releaseAll();
            return res;
        }
    }

    void startWorkers() {
        if (pool != null) {
            pool.start();
        }
    }

    CoordinatorContext context() {
        return ctx;
    }

    Coordinator coordinator() {
        return coordinator;
    }

    CheckpointTracker tracker() {
        return tracker;
    }

    RecoveryPlan plan() {
        return recovery.plan();
    }

    int[] workerQueueDepths() {
        return pool == null ? new int[0] : pool.queueDepths();
    }

    /** Счётчики контекста и текущие показатели очередей. */
    Map<String, Long> metrics() {
        Map<String, Long> m = new LinkedHashMap<>(ctx.snapshot());
        m.put("queue.groups", (long) resolver.queuedGroups());
        m.put("queue.bytes", resolver.queuedBytes());
        m.put("groups.in.flight", (long) resolver.inFlightCount());
        m.put("pending.bytes", resolver.pendingBytes());
        m.put("keys.tracked", (long) resolver.keyMapSize());
        m.put("commit.order.pending", (long) commitOrder.pending());
        m.put("checkpoint.queue", (long) tracker.size());
        m.put("checkpoint.group.id", tracker.durable().groupId());
        m.put("recovery.active", recovery.isRecovering() ? 1L : 0L);
        m.put("sql.delay.remaining.ms", coordinator.sqlRemainingDelayMs());
        return m;
    }

    /**
     * Остановка: координатор перестаёт назначать, очереди очищаются, исполнители и сам
     * координатор бросают группы, которые ещё можно откатить; группы с нетранзакционными
     * эффектами дорабатывают.
     * В конце контрольная точка сбрасывается принудительно. Повторный вызов ничего не делает.
     *
     * @param coordinatorThread поток координатора или {@code null}
     * @param timeoutMs         ограничение ожидания потоков
     */
    void shutdown(Thread coordinatorThread, long timeoutMs) throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        coordinator.requestStop();
        if (coordinatorThread != null && coordinatorThread != Thread.currentThread()) {
            if (coordinator.abandonIsolated()) {
                coordinatorThread.interrupt();
            }
            coordinatorThread.join(remainingMs(deadline));
            if (coordinatorThread.isAlive()) {
                LOG.warn("Поток координатора не остановился за {} мс", timeoutMs);
            }
        }
        List<Long> discarded = resolver.clear();
        for (Long id : discarded) {
            commitOrder.withdraw(id);
        }
        int mustFinish = pool == null ? 0 : pool.abandonSafely();
        if (!discarded.isEmpty() || mustFinish > 0) {
            LOG.info("Остановка: выброшено из очередей групп: {}, дорабатывают: {}", discarded.size(), mustFinish);
        }
        if (pool != null) {
            long waitUntilClose = remainingMs(deadline);
            resolver.awaitAllDrained(waitUntilClose, TimeUnit.MILLISECONDS);
            pool.close();
            if (!pool.awaitTermination(remainingMs(deadline), TimeUnit.MILLISECONDS)) {
                LOG.warn("Не все исполнители остановились за {} мс", timeoutMs);
            }
        } else {
            resolver.close();
        }
        try {
            tracker.flush(true, false);
        } catch (IOException e) {
            LOG.warn("Остановка: не удалось сохранить контрольную точку: {}", e.toString());
        }
        tracker.close();
        commitOrder.abort();
        ApplierMetricsJmx.unregisterQuietly(jmxName);
        LOG.info("Применитель остановлен, контрольная точка {}", tracker.durable());
    }

    private static long remainingMs(long deadlineNanos) {
        return Math.max(1L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            LOG.warn("Ошибка при освобождении ресурса {}: {}", closeable, e.toString());
        }
    }

    /** Стек ресурсов, закрываемых в обратном порядке, если создание не завершилось. */
    private static final class ResourceGuard implements AutoCloseable {
        private final Deque<AutoCloseable> stack = new ArrayDeque<>();

        <T extends AutoCloseable> T register(T resource) {
            if (resource != null) {
                stack.push(resource);
            }
            return resource;
        }

        void releaseAll() {
            stack.clear();
        }

        @Override
        public void close() {
            while (!stack.isEmpty()) {
                closeQuietly(stack.pop());
            }
        }
    }
}
