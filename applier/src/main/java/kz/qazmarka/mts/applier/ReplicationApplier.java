package kz.qazmarka.mts.applier;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.checkpoint.DurableState;
import kz.qazmarka.mts.checkpoint.PositionStore;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.coordinator.ApplierFailureException;
import kz.qazmarka.mts.coordinator.Coordinator;
import kz.qazmarka.mts.coordinator.FailureClass;
import kz.qazmarka.mts.event.EventSource;
import kz.qazmarka.mts.event.EventStream;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.recovery.RecoveryGapException;
import kz.qazmarka.mts.worker.GroupApplier;

/**
 * Поверхность управления параллельным применением репликации.
 *
 * Жизненный цикл: настройка (сеттеры допустимы только в остановленном состоянии) →
 * {@link #start()}, {@link #startUntil(LogPosition)} или {@link #startUntilSource(LogPosition)} →
 * {@link #stop()}. Повторный запуск
 * после остановки или отказа читает сохранённое состояние заново и восстанавливает разрыв.
 *
 * Чтение потока и назначение групп выполняет поток {@code mts-coordinator}; группы
 * применяются потоками {@code mts-worker-<n>}.
 */
public final class ReplicationApplier implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicationApplier.class);
    /** Ограничение ожидания потоков при остановке. */
    static final long STOP_TIMEOUT_MS = 30_000L;

    private final EventSource source;
    private final GroupApplier applier;
    private final PositionStore store;
    private final KeyEquivalence equivalence;

    private MtsConfig config;
    private long skipGroups;
    private ApplierResources resources;
    private Thread coordinatorThread;
    private volatile ApplierFailureException lastFailure;

    public ReplicationApplier(Configuration cfg,
                              EventSource source,
                              GroupApplier applier,
                              PositionStore store) {
        this(MtsConfig.from(cfg), source, applier, store, KeyEquivalence.NATURAL);
    }

    public ReplicationApplier(MtsConfig config,
                              EventSource source,
                              GroupApplier applier,
                              PositionStore store,
                              KeyEquivalence equivalence) {
        this.config = Objects.requireNonNull(config, "config");
        this.source = Objects.requireNonNull(source, "source");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.store = Objects.requireNonNull(store, "store");
        this.equivalence = Objects.requireNonNull(equivalence, "equivalence");
    }

    // ==== запуск и остановка ====

    /**
     * Загружает сохранённое состояние, строит план восстановления и запускает конвейер.
     *
     * @throws IOException          ошибка чтения хранилища позиции
     * @throws RecoveryGapException сохранённое состояние несогласовано
     */
    public void start() throws IOException, RecoveryGapException {
        launch(LogPosition.NONE, LogPosition.NONE);
    }

    /**
     * Как {@link #start()}, но чтение останавливается после первой группы, позиция которой
     * на первичном сервере достигла {@code target}.
     */
    public void startUntil(LogPosition target) throws IOException, RecoveryGapException {
        launch(Objects.requireNonNull(target, "target"), LogPosition.NONE);
    }

    /**
     * Как {@link #start()}, но чтение останавливается после первой группы, позиция которой
     * в журнале-источнике достигла {@code source}.
     */
    public void startUntilSource(LogPosition source) throws IOException, RecoveryGapException {
        launch(LogPosition.NONE, Objects.requireNonNull(source, "source"));
    }

    private synchronized void launch(LogPosition untilTarget, LogPosition untilSource)
            throws IOException, RecoveryGapException {
        if (isRunning()) {
            throw new IllegalStateException("Применитель уже запущен");
        }
        DurableState state = store.load();
        if (state == null) {
            state = DurableState.EMPTY;
        }
        ApplierResources res;
        try {
            res = ApplierResources.create(config, applier, store, equivalence, state, untilTarget, untilSource,
                    skipGroups);
        } catch (RecoveryGapException e) {
            lastFailure = new ApplierFailureException(FailureClass.RECOVERY_GAP,
                    state.checkpoint().groupId(), state.checkpoint().sourcePosition(),
                    state.checkpoint().targetPosition(), e.getMessage(), e);
            LOG.error("Восстановление невозможно без вмешательства оператора: {}", e.getMessage());
            throw e;
        }
        skipGroups = 0L;
        lastFailure = null;
        resources = res;
        res.startWorkers();
        LogPosition from = res.plan().startPosition();
        Thread t = new Thread(() -> runCoordinator(res, from), "mts-coordinator");
        t.setDaemon(true);
        coordinatorThread = t;
        t.start();
        LOG.info("Применитель запущен: исполнителей {}, чтение после {}, {}",
                config.getScheduling().getWorkers(), from, res.plan());
    }

    private void runCoordinator(ApplierResources res, LogPosition from) {
        Coordinator coordinator = res.coordinator();
        try (EventStream stream = source.open(from)) {
            coordinator.run(stream);
        } catch (ApplierFailureException e) {
            lastFailure = e;
            LOG.error("{}", e.getMessage(), e.getCause());
        } catch (IOException e) {
            ApplierFailureException f = new ApplierFailureException(FailureClass.FATAL,
                    coordinator.nextGroupId(), coordinator.readSourcePosition(), coordinator.readTargetPosition(),
                    "ошибка ввода-вывода", e);
            res.context().fail(f);
            lastFailure = res.context().failure();
            LOG.error("Поток координатора остановлен ошибкой ввода-вывода", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (LOG.isDebugEnabled()) {
                LOG.debug("Поток координатора прерван");
            }
        } finally {
            try {
                res.shutdown(null, STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Остановка из потока координатора прервана");
            }
        }
    }

    /**
     * Останавливает конвейер: назначение прекращается, незавершённые группы бросаются
     * (кроме выполнивших нетранзакционные изменения), контрольная точка сбрасывается.
     */
    public void stop() throws InterruptedException {
        ApplierResources res;
        Thread t;
        synchronized (this) {
            res = resources;
            t = coordinatorThread;
        }
        if (res == null) {
            return;
        }
        res.shutdown(t, STOP_TIMEOUT_MS);
        if (t != null) {
            t.join(STOP_TIMEOUT_MS);
        }
    }

    public synchronized boolean isRunning() {
        return coordinatorThread != null && coordinatorThread.isAlive();
    }

    /** Отказ, остановивший последний запуск, или {@code null}. */
    public ApplierFailureException lastFailure() {
        return lastFailure;
    }

    @Override
    public void close() throws InterruptedException {
        stop();
    }

    // ==== настройки (только в остановленном состоянии) ====

    public synchronized void setWorkerCount(int workers) {
        ensureStopped();
        config = config.toBuilder().scheduling().workers(workers).done().build();
    }

    public synchronized void setCheckpointGroup(int group) {
        ensureStopped();
        config = config.toBuilder().checkpoint().group(group).done().build();
    }

    public synchronized void setQueueLimits(int maxGroups, long maxBytes) {
        ensureStopped();
        config = config.toBuilder().dependency().queueMaxGroups(maxGroups).queueMaxBytes(maxBytes).done().build();
    }

    public synchronized void setCommitOrder(boolean enabled) {
        ensureStopped();
        config = config.toBuilder().scheduling().commitOrder(enabled).done().build();
    }

    /** Пропустить следующие {@code groups} групп при ближайшем запуске (они отмечаются применёнными). */
    public synchronized void setSkipCounter(long groups) {
        ensureStopped();
        if (groups < 0L) {
            throw new IllegalArgumentException("Счётчик пропуска не может быть отрицательным: " + groups);
        }
        skipGroups = groups;
    }

    public synchronized MtsConfig config() {
        return config;
    }

    private void ensureStopped() {
        if (isRunning()) {
            throw new IllegalStateException("Настройку можно менять только у остановленного применителя");
        }
    }

    // ==== состояние ====

    /** Снимок состояния; до первого запуска содержит начальные значения. */
    public ApplierStatus status() {
        ApplierResources res;
        boolean running;
        synchronized (this) {
            res = resources;
            running = isRunning();
        }
        ApplierStatus.Builder b = ApplierStatus.builder().running(running).lastFailure(lastFailure);
        if (res == null) {
            return b.build();
        }
        Coordinator c = res.coordinator();
        return b.read(c.readSourcePosition(), c.readTargetPosition())
                .applied(c.appliedSourcePosition(), c.appliedTargetPosition())
                .checkpoints(res.tracker().durable(), res.tracker().lastFlushed())
                .recovering(c.isRecovering())
                .parallelExec(c.isParallelExec())
                .groupStatus(c.status())
                .workerQueueDepths(res.workerQueueDepths())
                .checkpointQueueSize(res.tracker().size())
                .counters(res.metrics())
                .build();
    }

    /**
     * Ждёт, пока низшая отметка не достигнет позиции первичного сервера.
     *
     * @return {@code true}, если позиция достигнута до таймаута
     */
    public boolean waitForPosition(LogPosition target, long timeoutMs) throws InterruptedException {
        Objects.requireNonNull(target, "target");
        ApplierResources res;
        synchronized (this) {
            res = resources;
        }
        if (res == null) {
            return false;
        }
        return res.tracker().awaitDurable(target, timeoutMs, TimeUnit.MILLISECONDS);
    }
}
