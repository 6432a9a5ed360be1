package kz.qazmarka.mts.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.mts.checkpoint.Checkpoint;
import kz.qazmarka.mts.checkpoint.CheckpointTracker;
import kz.qazmarka.mts.checkpoint.DurableState;
import kz.qazmarka.mts.checkpoint.InMemoryPositionStore;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventStream;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.EventArena;
import kz.qazmarka.mts.recovery.RecoveryGapException;
import kz.qazmarka.mts.recovery.RecoveryPlanner;
import kz.qazmarka.mts.testing.Events;
import kz.qazmarka.mts.testing.RecordingApplier;
import kz.qazmarka.mts.testing.TestEventSource;
import kz.qazmarka.mts.worker.CommitOrderManager;
import kz.qazmarka.mts.worker.GroupRunner;

/**
 * Координатор без исполнителей: каждая группа выполняется изолированно в потоке теста,
 * поэтому разбиение потока на группы и решения координатора проверяются детерминированно.
 *
 * Что проверяем:
 * - переходы NOT_IN_GROUP → IN_GROUP → NOT_IN_GROUP и KILLED_GROUP при обрыве;
 * - недособранная группа выбрасывается при новом маркере начала;
 * - фиксация вне группы пропускается, оператор вне группы образует отдельную группу;
 * - пропуск групп по счётчику и по плану восстановления;
 * - остановка на целевой позиции и отказ исполнителя.
 */
class CoordinatorTest {

    private final EventArena arena = new EventArena();
    private final CoordinatorContext ctx = new CoordinatorContext();
    private final InMemoryPositionStore store = new InMemoryPositionStore();
    private final RecordingApplier applier = new RecordingApplier();

    private Coordinator coordinator(DurableState state, LogPosition until) throws RecoveryGapException {
        MtsConfig config = MtsConfig.builder()
                .scheduling().workers(0).done()
                .retry().maxRetries(0).backoffBaseMs(0L).done()
                .jmxEnabled(false)
                .build();
        DependencyResolver resolver = new DependencyResolver(config.getDependency(), KeyEquivalence.NATURAL, ctx);
        CommitOrderManager commitOrder = new CommitOrderManager(true, ctx);
        CheckpointTracker tracker = new CheckpointTracker(config.getCheckpoint(), store, state, ctx);
        return Coordinator.builder()
                .config(config)
                .arena(arena)
                .resolver(resolver)
                .tracker(tracker)
                .commitOrder(commitOrder)
                .runner(new GroupRunner(applier, resolver, commitOrder, config.getRetry(), ctx))
                .recovery(new RecoveryPlanner(RecoveryPlanner.plan(state), 0, ctx))
                .context(ctx)
                .untilTarget(until)
                .build();
    }

    private Coordinator coordinator() throws RecoveryGapException {
        return coordinator(DurableState.EMPTY, LogPosition.NONE);
    }

    @Test
    @DisplayName("Транзакция проходит состояния группы и применяется по завершающему событию")
    void transactionLifecycle() throws Exception {
        Coordinator c = coordinator();
        List<ChangeEvent> txn = Events.txn(1L, "a", "b");

        c.consume(txn.get(0));
        assertEquals(GroupStatus.IN_GROUP, c.status());
        c.consume(txn.get(1));
        c.consume(txn.get(2));
        assertTrue(applier.commits().isEmpty());

        c.consume(txn.get(3));

        assertEquals(GroupStatus.NOT_IN_GROUP, c.status());
        assertEquals(List.of(1L), applier.commits());
        assertEquals(2L, c.nextGroupId());
        assertEquals(Events.source(4L), c.readSourcePosition());
        assertEquals(Events.target(4L), c.appliedTargetPosition());
        assertFalse(c.isParallelExec());
        assertEquals(1L, ctx.isolatedGroups());
        assertEquals(4L, ctx.eventsAssigned());
    }

    /**
     * GIVEN: BEGIN, строка, затем снова BEGIN (первичный сервер перезапущен посреди транзакции).
     * WHEN:  поток продолжается полной транзакцией.
     * THEN:  недособранная группа выброшена без номера, применена только полная.
     */
    @Test
    @DisplayName("Маркер начала внутри группы выбрасывает недособранную группу")
    void beginInsideGroupDiscardsPartial() throws Exception {
        Coordinator c = coordinator();
        c.consume(Events.begin(1L));
        c.consume(Events.row(2L, "a", "lost"));

        for (ChangeEvent e : Events.txn(3L, "a")) {
            c.consume(e);
        }

        assertEquals(List.of(1L), applier.commits());
        assertEquals("v4", applier.state().get("a"));
        assertEquals(1L, ctx.snapshot().get("groups.partial.discarded"));
    }

    @Test
    @DisplayName("Фиксация вне группы пропускается, оператор вне группы образует отдельную группу")
    void eventsOutsideGroup() throws Exception {
        Coordinator c = coordinator();

        c.consume(Events.commit(1L));
        assertEquals(1L, c.nextGroupId());

        c.consume(Events.query(2L, "q", "x"));
        assertEquals(GroupStatus.NOT_IN_GROUP, c.status());
        assertEquals(List.of(1L), applier.commits());
        assertEquals("x", applier.state().get("q"));
    }

    @Test
    @DisplayName("Строка без маркера начала открывает группу до завершающего события")
    void rowsWithoutBeginOpenGroup() throws Exception {
        Coordinator c = coordinator();

        c.consume(Events.row(1L, "a", "x"));
        assertEquals(GroupStatus.IN_GROUP, c.status());
        c.consume(Events.commit(2L));

        assertEquals(List.of(1L), applier.commits());
    }

    @Test
    @DisplayName("DDL завершает группу и выполняется изолированно")
    void ddlEndsGroup() throws Exception {
        Coordinator c = coordinator();

        c.consume(Events.begin(1L));
        c.consume(Events.row(2L, "a", "x"));
        c.consume(Events.ddl(3L));

        assertEquals(GroupStatus.NOT_IN_GROUP, c.status());
        assertEquals(List.of(1L), applier.commits());
    }

    @Test
    @DisplayName("Поток закончился внутри группы → KILLED_GROUP, отметка сброшена принудительно")
    void streamEndsInsideGroup() throws Exception {
        Coordinator c = coordinator();
        List<ChangeEvent> events = new ArrayList<>(Events.stream(Events.keys("a"), Events.keys("b")));
        events.add(Events.begin(7L));
        events.add(Events.row(8L, "c", "x"));

        try (EventStream s = new TestEventSource(events).open(LogPosition.NONE)) {
            c.run(s);
        }

        assertEquals(GroupStatus.KILLED_GROUP, c.status());
        assertEquals(List.of(1L, 2L), applier.commits());
        assertEquals(0, arena.liveRecords());
        DurableState saved = store.load();
        assertEquals(2L, saved.checkpoint().groupId());
        assertEquals(Events.source(6L), saved.checkpoint().sourcePosition());
        assertTrue(store.forcedFlushes() > 0L);
    }

    @Test
    @DisplayName("Счётчик пропуска: группы отмечаются применёнными без выполнения")
    void skipCounter() throws Exception {
        Coordinator c = coordinator();
        ctx.setSkipCounter(2L);

        for (ChangeEvent e : Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"))) {
            c.consume(e);
        }

        assertEquals(List.of(3L), applier.commits());
        assertEquals(2L, ctx.skippedGroups());
        assertEquals(0L, ctx.skipCounter());
    }

    /**
     * GIVEN: сохранено P = G1, Q = G3, G3 завершена до сбоя.
     * WHEN:  поток перечитывается с позиции G1.
     * THEN:  G2 воспроизводится, G3 пропускается, G4 планируется обычно.
     */
    @Test
    @DisplayName("Восстановление: воспроизведение, пропуск и возврат к обычному планированию")
    void recoveryReplayAndSkip() throws Exception {
        BitSet done = new BitSet();
        done.set(1);
        DurableState state = new DurableState(new Checkpoint(1L, Events.source(3L), Events.target(3L)), 3L, done);
        Coordinator c = coordinator(state, LogPosition.NONE);
        assertTrue(c.isRecovering());
        TestEventSource source = new TestEventSource(Events.stream(
                Events.keys("a"), Events.keys("b"), Events.keys("c"), Events.keys("d")));

        try (EventStream s = source.open(Events.source(3L))) {
            c.run(s);
        }

        assertEquals(List.of(2L, 4L), applier.commits());
        assertFalse(c.isRecovering());
        assertEquals(1L, ctx.skippedGroups());
        assertEquals(4L, store.load().checkpoint().groupId());
    }

    @Test
    @DisplayName("Чтение останавливается после группы, достигшей целевой позиции")
    void untilTarget() throws Exception {
        Coordinator c = coordinator(DurableState.EMPTY, Events.target(6L));
        TestEventSource source = new TestEventSource(Events.stream(
                Events.keys("a"), Events.keys("b"), Events.keys("c")));

        try (EventStream s = source.open(LogPosition.NONE)) {
            c.run(s);
        }

        assertTrue(c.isUntilReached());
        assertEquals(List.of(1L, 2L), applier.commits());
    }

    @Test
    @DisplayName("Фатальный отказ группы останавливает чтение с классом ошибки и позицией")
    void fatalGroupStopsRun() throws Exception {
        applier.fatal(2L);
        Coordinator c = coordinator();
        TestEventSource source = new TestEventSource(Events.stream(
                Events.keys("a"), Events.keys("b"), Events.keys("c")));

        ApplierFailureException ex;
        try (EventStream s = source.open(LogPosition.NONE)) {
            ex = assertThrows(ApplierFailureException.class, () -> c.run(s));
        }

        assertEquals(FailureClass.FATAL, ex.failureClass());
        assertEquals(2L, ex.groupId());
        assertEquals(Events.source(6L), ex.sourcePosition());
        assertEquals(List.of(1L), applier.commits());
        assertEquals(1L, store.load().checkpoint().groupId());
        assertTrue(ctx.hasFailure());
    }
}
