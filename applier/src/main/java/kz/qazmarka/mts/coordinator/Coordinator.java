package kz.qazmarka.mts.coordinator;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.checkpoint.CheckpointTracker;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventKind;
import kz.qazmarka.mts.event.EventStream;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.EventArena;
import kz.qazmarka.mts.group.GroupState;
import kz.qazmarka.mts.group.TransactionGroup;
import kz.qazmarka.mts.recovery.RecoveryAction;
import kz.qazmarka.mts.recovery.RecoveryPlanner;
import kz.qazmarka.mts.worker.ApplyOutcome;
import kz.qazmarka.mts.worker.CommitOrderManager;
import kz.qazmarka.mts.worker.CompletionListener;
import kz.qazmarka.mts.worker.CompletionReport;
import kz.qazmarka.mts.worker.GroupRunner;

/**
 * Единственный диспетчер конвейера: читает поток событий, собирает группы,
 * назначает их исполнителям и принимает отчёты о завершении.
 *
 * Поток координатора владеет состоянием группы ({@link GroupStatus}), счётчиком номеров
 * и решениями о назначении. Исполнители сообщают о завершении через
 * {@link #onCompletion(CompletionReport)}; отказ исполнителя только выставляет флаг
 * в {@link CoordinatorContext}, решение об остановке принимает координатор.
 *
 * Группа выполняется изолированно (после опустошения конвейера, силами координатора), если:
 *  - параллельное планирование выключено или идёт восстановление;
 *  - ключи группы неизвестны, группа содержит DDL или ключей больше {@code mts.dependency.max.keys};
 *  - группа не помещается в очередь резолвера по байтам.
 */
public final class Coordinator implements CompletionListener {

    private static final Logger LOG = LoggerFactory.getLogger(Coordinator.class);
    /** Шаг ожидания при опустошении конвейера; между шагами проверяются отказ и остановка. */
    private static final long DRAIN_STEP_MS = 50L;
    /** Сколько ждать завершения уже назначенных групп после отказа. */
    private static final long DRAIN_ON_FAILURE_MS = 10_000L;

    private final EventArena arena;
    private final DependencyResolver resolver;
    private final CheckpointTracker tracker;
    private final CommitOrderManager commitOrder;
    private final GroupRunner runner;
    private final RecoveryPlanner recovery;
    private final CoordinatorContext ctx;
    private final Backpressure backpressure;
    private final ThroughputLog throughput;
    private final int workers;
    private final int maxKeys;
    private final boolean flushAfterIsolation;
    private final boolean untilAfterGaps;
    private final long sqlDelayMs;
    private final LogPosition untilTarget;
    private final LogPosition untilSource;

    private volatile GroupStatus status = GroupStatus.NOT_IN_GROUP;
    private TransactionGroup.Builder current;
    private long nextId;
    private volatile boolean stopRequested;
    private volatile boolean untilReached;
    /** Группа, которую сейчас выполняет сам координатор. */
    private volatile TransactionGroup isolated;
    private volatile long delayDueMs;
    private volatile LogPosition readSource = LogPosition.NONE;
    private volatile LogPosition readTarget = LogPosition.NONE;
    private LogPosition appliedSource = LogPosition.NONE;
    private LogPosition appliedTarget = LogPosition.NONE;

    private Coordinator(Builder b) {
        MtsConfig config = Objects.requireNonNull(b.config, "config");
        this.arena = Objects.requireNonNull(b.arena, "arena");
        this.resolver = Objects.requireNonNull(b.resolver, "resolver");
        this.tracker = Objects.requireNonNull(b.tracker, "tracker");
        this.commitOrder = Objects.requireNonNull(b.commitOrder, "commitOrder");
        this.runner = Objects.requireNonNull(b.runner, "runner");
        this.recovery = Objects.requireNonNull(b.recovery, "recovery");
        this.ctx = Objects.requireNonNull(b.ctx, "ctx");
        this.untilTarget = b.untilTarget == null ? LogPosition.NONE : b.untilTarget;
        this.untilSource = b.untilSource == null ? LogPosition.NONE : b.untilSource;
        this.workers = config.getScheduling().getWorkers();
        this.maxKeys = config.getDependency().getMaxKeys();
        this.flushAfterIsolation = config.getCheckpoint().isFlushAfterIsolation();
        this.untilAfterGaps = config.getScheduling().isUntilAfterGaps();
        this.sqlDelayMs = config.getScheduling().getSqlDelayMs();
        this.backpressure = new Backpressure(config.getBackpressure(), resolver, workers, ctx);
        this.throughput = new ThroughputLog(config.getMonitoring().getThroughputLogIntervalMs());
        this.nextId = recovery.plan().firstGroupId();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==== разбиение потока на группы ====

    /**
     * Классифицирует событие и при завершающем событии назначает собранную группу.
     *
     * @throws ApplierFailureException отказ конвейера
     * @throws InterruptedException    поток координатора прерван
     */
    public void consume(ChangeEvent event) throws InterruptedException, ApplierFailureException {
        Objects.requireNonNull(event, "event");
        readSource = LogPosition.max(readSource, event.sourcePosition());
        readTarget = LogPosition.max(readTarget, event.targetPosition());
        EventKind kind = event.kind();
        if (kind.isBegin()) {
            if (status == GroupStatus.IN_GROUP) {
                LOG.warn("Маркер начала внутри незавершённой группы ({} событий): первичный сервер, вероятно, "
                        + "перезапущен; выбрасываю недособранную группу", current.eventCount());
                current.discard();
                current = null;
                ctx.onPartialGroupDiscarded();
            }
            startGroup().add(event);
            return;
        }
        if (status != GroupStatus.IN_GROUP) {
            if (kind == EventKind.COMMIT || kind == EventKind.ROLLBACK) {
                LOG.warn("Событие {} вне группы на позиции {}: пропускаю", kind, event.sourcePosition());
                return;
            }
            startGroup().add(event);
            if (kind == EventKind.QUERY || kind.isTerminal()) {
                endGroup();
            }
            return;
        }
        current.add(event);
        if (kind.isTerminal()) {
            endGroup();
        }
    }

    private TransactionGroup.Builder startGroup() {
        current = TransactionGroup.builder(arena);
        status = GroupStatus.IN_GROUP;
        return current;
    }

    private void endGroup() throws InterruptedException, ApplierFailureException {
        status = GroupStatus.END_GROUP;
        TransactionGroup g = current.build(nextId++);
        current = null;
        try {
            assign(g);
        } finally {
            status = GroupStatus.NOT_IN_GROUP;
        }
        if ((!untilTarget.isNone() && g.targetPosition().reached(untilTarget))
                || (!untilSource.isNone() && g.sourcePosition().reached(untilSource))) {
            untilReached = true;
        }
    }

    // ==== назначение ====

    /**
     * Назначает собранную группу: пропускает, выполняет изолированно или передаёт резолверу.
     *
     * @throws ApplierFailureException отказ конвейера
     * @throws InterruptedException    поток координатора прерван
     */
    public void assign(TransactionGroup group) throws InterruptedException, ApplierFailureException {
        checkFailure();
        RecoveryAction action = recovery.decide(group.id());
        if (action == RecoveryAction.SKIP || (action == RecoveryAction.SCHEDULE && ctx.consumeSkip())) {
            skip(group);
            return;
        }
        if (!awaitSqlDelay(group)) {
            group.release();
            checkFailure();
            return;
        }
        ctx.onGroupAssigned(group.eventCount());
        if (action == RecoveryAction.REPLAY || mustIsolate(group)) {
            executeIsolated(group);
            return;
        }
        if (!backpressure.admit(group, this::cancelled)) {
            group.release();
            checkFailure();
            return;
        }
        if (!tracker.record(group, this::cancelled)) {
            group.release();
            checkFailure();
            return;
        }
        resolver.register(group);
        commitOrder.register(group.id());
        int worker = resolver.dispatch(group);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Группа {} назначена {} (предшественники {})", group.id(),
                    worker >= 0 ? "исполнителю " + worker : "в общую очередь", group.predecessors());
        }
    }

    private boolean mustIsolate(TransactionGroup g) {
        return !isParallelExec()
                || !g.keysKnown()
                || g.containsDdl()
                || g.keys().size() > maxKeys
                || g.sizeBytes() > resolver.maxBytes();
    }

    private void skip(TransactionGroup g) throws InterruptedException, ApplierFailureException {
        if (!tracker.record(g, this::cancelled)) {
            g.release();
            checkFailure();
            return;
        }
        g.moveTo(GroupState.COMMITTED);
        tracker.markDone(g.id(), ApplyOutcome.SUCCESS);
        ctx.onSkipped();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Группа {} пропущена (позиция {})", g.id(), g.sourcePosition());
        }
    }

    /**
     * Ждёт, пока с метки времени группы на первичном сервере не пройдёт {@code mts.sql.delay.ms}.
     *
     * @return {@code false}, если ожидание прекращено отказом или остановкой
     */
    private boolean awaitSqlDelay(TransactionGroup g) throws InterruptedException {
        if (sqlDelayMs <= 0L || g.timestampMs() <= 0L) {
            return true;
        }
        long due = g.timestampMs() + sqlDelayMs;
        delayDueMs = due;
        try {
            long left = due - System.currentTimeMillis();
            if (left > 0L && LOG.isDebugEnabled()) {
                LOG.debug("Группа {} отложена на {} мс (задержка применения {} мс)", g.id(), left, sqlDelayMs);
            }
            while (left > 0L) {
                if (cancelled()) {
                    return false;
                }
                TimeUnit.MILLISECONDS.sleep(Math.min(left, DRAIN_STEP_MS));
                left = due - System.currentTimeMillis();
            }
            return true;
        } finally {
            delayDueMs = 0L;
        }
    }

    /**
     * Опустошает конвейер и выполняет группу силами координатора.
     */
    private void executeIsolated(TransactionGroup g) throws InterruptedException, ApplierFailureException {
        if (!drain()) {
            g.release();
            checkFailure();
            return;
        }
        ctx.onIsolated();
        if (!tracker.record(g, this::cancelled)) {
            g.release();
            checkFailure();
            return;
        }
        g.moveTo(GroupState.ASSIGNED);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Группа {} выполняется изолированно (ключи известны: {}, DDL: {})",
                    g.id(), g.keysKnown(), g.containsDdl());
        }
        CompletionReport report;
        isolated = g;
        try {
            // Остановка публикуется до чтения isolated в abandonIsolated(): одна из сторон видит другую.
            if (stopRequested && g.tryAbandon()) {
                g.moveTo(GroupState.FAILED);
                ctx.onAbandoned();
                report = CompletionReport.abandoned(g, TransactionGroup.NO_WORKER, 0);
            } else {
                report = runner.run(g, TransactionGroup.NO_WORKER);
            }
        } finally {
            isolated = null;
        }
        onCompletion(report);
        checkFailure();
        if (report.outcome() == ApplyOutcome.SUCCESS && flushAfterIsolation) {
            flushOrFail(true, true, g);
        }
    }

    /**
     * Ждёт, пока в работе не останется групп.
     *
     * @return {@code false}, если ожидание прекращено отказом или остановкой
     */
    private boolean drain() throws InterruptedException {
        while (!resolver.awaitAllDrained(DRAIN_STEP_MS, TimeUnit.MILLISECONDS)) {
            if (cancelled()) {
                return false;
            }
        }
        return !ctx.hasFailure();
    }

    private boolean cancelled() {
        return stopRequested || ctx.hasFailure();
    }

    private void checkFailure() throws ApplierFailureException {
        ApplierFailureException f = ctx.failure();
        if (f != null) {
            throw f;
        }
    }

    // ==== отчёты исполнителей ====

    /**
     * Принимает отчёт о завершении группы. Вызывается исполнителями и самим координатором.
     */
    @Override
    public void onCompletion(CompletionReport report) {
        TransactionGroup g = report.group();
        boolean ok = report.outcome() == ApplyOutcome.SUCCESS;
        tracker.markDone(g.id(), report.outcome());
        resolver.complete(g, ok);
        if (ok) {
            ctx.onGroupCompleted();
            synchronized (this) {
                appliedSource = LogPosition.max(appliedSource, report.appliedSourcePosition());
                appliedTarget = LogPosition.max(appliedTarget, report.appliedTargetPosition());
            }
            flushOrFail(false, true, g);
        } else if (report.outcome() == ApplyOutcome.FATAL) {
            ApplierFailureException f = new ApplierFailureException(report.failureClass(), g.id(),
                    g.sourcePosition(), g.targetPosition(),
                    "группа не применена после " + report.attempts() + " попыток", report.cause());
            if (ctx.fail(f)) {
                LOG.error("Отказ исполнителя {}: {}", report.workerId(), f.getMessage());
            }
        }
    }

    private void flushOrFail(boolean force, boolean isCommitEvent, TransactionGroup g) {
        try {
            tracker.flush(force, isCommitEvent);
        } catch (IOException e) {
            ApplierFailureException f = new ApplierFailureException(FailureClass.FATAL, g.id(),
                    g.sourcePosition(), g.targetPosition(), "не удалось сохранить контрольную точку", e);
            if (ctx.fail(f)) {
                LOG.error("Сохранение контрольной точки завершилось ошибкой: {}", e.toString());
            }
        }
    }

    // ==== цикл чтения ====

    /**
     * Читает поток до конца, до остановки, до целевой позиции или до отказа.
     * При нормальном завершении дожидается всех назначенных групп и сбрасывает контрольную точку.
     *
     * @throws ApplierFailureException отказ конвейера (после ограниченного ожидания назначенных групп)
     * @throws IOException             ошибка чтения потока или хранилища
     * @throws InterruptedException    поток координатора прерван
     */
    public void run(EventStream stream) throws IOException, InterruptedException, ApplierFailureException {
        Objects.requireNonNull(stream, "stream");
        try {
            while (!cancelled()) {
                ChangeEvent event = stream.next();
                if (event == null) {
                    if (recovery.isRecovering()) {
                        LOG.warn("Поток событий закончился до закрытия разрыва: осталось {} групп", recovery.remaining());
                    }
                    break;
                }
                consume(event);
                tracker.flush(false, false);
                throughput.maybeLog(ctx, LOG);
                if (untilReached) {
                    LOG.info("Достигнута целевая позиция {}, останавливаю чтение",
                            untilSource.isNone() ? untilTarget : untilSource);
                    break;
                }
                if (untilAfterGaps && recovery.plan().hasGap() && !recovery.isRecovering()) {
                    LOG.info("Разрыв до G{} воспроизведён, останавливаю чтение", recovery.plan().highestAssigned());
                    break;
                }
            }
        } catch (ApplierFailureException e) {
            killCurrent();
            drainAfterFailure();
            throw e;
        } finally {
            killCurrent();
        }
        if (!stopRequested) {
            drain();
        }
        if (ctx.hasFailure()) {
            drainAfterFailure();
            throw ctx.failure();
        }
        if (!stopRequested) {
            tracker.flush(true, false);
        }
    }

    private void killCurrent() {
        if (status == GroupStatus.IN_GROUP && current != null) {
            status = GroupStatus.KILLED_GROUP;
            int events = current.eventCount();
            current.discard();
            current = null;
            LOG.warn("Чтение прервано внутри группы ({} событий): группа будет воспроизведена после перезапуска", events);
        }
    }

    private void drainAfterFailure() throws InterruptedException {
        if (!resolver.awaitAllDrained(DRAIN_ON_FAILURE_MS, TimeUnit.MILLISECONDS)) {
            LOG.warn("После отказа не дождались завершения групп: в работе {}", resolver.inFlightCount());
        }
        try {
            tracker.flush(true, false);
        } catch (IOException e) {
            LOG.warn("Не удалось сохранить контрольную точку после отказа: {}", e.toString());
        }
    }

    // ==== управление и состояние ====

    /** Просит цикл чтения остановиться перед следующим событием. */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Пытается бросить группу, которую выполняет поток координатора. Вызывать после
     * {@link #requestStop()}; поток координатора можно прерывать, только если вернулось {@code true}.
     *
     * @return {@code false}, если группа уже выполнила нетранзакционные изменения и обязана завершиться
     */
    public boolean abandonIsolated() {
        TransactionGroup g = isolated;
        if (g == null || g.tryAbandon()) {
            return true;
        }
        LOG.info("Группа {} на координаторе уже выполнила нетранзакционные изменения: дожидаемся её завершения",
                g.id());
        return false;
    }

    /** Сколько ещё ждать текущей группе из-за задержки применения, мс; 0, если группа не ждёт. */
    public long sqlRemainingDelayMs() {
        long due = delayDueMs;
        return due == 0L ? 0L : Math.max(0L, due - System.currentTimeMillis());
    }

    /** Параллельное выполнение: есть исполнители и не идёт восстановление. */
    public boolean isParallelExec() {
        return recovery.isParallelSchedulingEligible();
    }

    public boolean isRecovering() {
        return recovery.isRecovering();
    }

    public boolean isUntilReached() {
        return untilReached;
    }

    public GroupStatus status() {
        return status;
    }

    /** Номер, который получит следующая собранная группа. */
    public long nextGroupId() {
        return nextId;
    }

    /** Наибольшая прочитанная позиция журнала-источника. */
    public LogPosition readSourcePosition() {
        return readSource;
    }

    /** Наибольшая прочитанная позиция первичного сервера. */
    public LogPosition readTargetPosition() {
        return readTarget;
    }

    public synchronized LogPosition appliedSourcePosition() {
        return appliedSource;
    }

    public synchronized LogPosition appliedTargetPosition() {
        return appliedTarget;
    }

    /**
     * Сборщик координатора: все участники передаются явно и не подменяются после создания.
     */
    public static final class Builder {
        private MtsConfig config;
        private EventArena arena;
        private DependencyResolver resolver;
        private CheckpointTracker tracker;
        private CommitOrderManager commitOrder;
        private GroupRunner runner;
        private RecoveryPlanner recovery;
        private CoordinatorContext ctx;
        private LogPosition untilTarget;
        private LogPosition untilSource;

        private Builder() {
        }

        public Builder config(MtsConfig v) {
            this.config = v;
            return this;
        }

        public Builder arena(EventArena v) {
            this.arena = v;
            return this;
        }

        public Builder resolver(DependencyResolver v) {
            this.resolver = v;
            return this;
        }

        public Builder tracker(CheckpointTracker v) {
            this.tracker = v;
            return this;
        }

        public Builder commitOrder(CommitOrderManager v) {
            this.commitOrder = v;
            return this;
        }

        public Builder runner(GroupRunner v) {
            this.runner = v;
            return this;
        }

        public Builder recovery(RecoveryPlanner v) {
            this.recovery = v;
            return this;
        }

        public Builder context(CoordinatorContext v) {
            this.ctx = v;
            return this;
        }

        /** Остановиться после первой группы, достигшей этой позиции первичного сервера. */
        public Builder untilTarget(LogPosition v) {
            this.untilTarget = v;
            return this;
        }

        /** Остановиться после первой группы, достигшей этой позиции журнала-источника. */
        public Builder untilSource(LogPosition v) {
            this.untilSource = v;
            return this;
        }

        public Coordinator build() {
            return new Coordinator(this);
        }
    }
}
