package kz.qazmarka.mts.applier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import kz.qazmarka.mts.checkpoint.Checkpoint;
import kz.qazmarka.mts.checkpoint.DurableState;
import kz.qazmarka.mts.checkpoint.InMemoryPositionStore;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.coordinator.ApplierFailureException;
import kz.qazmarka.mts.coordinator.FailureClass;
import kz.qazmarka.mts.coordinator.GroupStatus;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.testing.Events;
import kz.qazmarka.mts.testing.RecordingApplier;
import kz.qazmarka.mts.testing.TestEventSource;
import kz.qazmarka.mts.testing.Waits;

/**
 * Сквозные проверки применителя с пулом исполнителей.
 *
 * Что проверяем:
 * - параллельное применение даёт то же состояние, что и последовательное;
 * - группы с общими ключами не выполняются одновременно и фиксируются в порядке потока;
 * - DDL выполняется изолированно;
 * - перезапуск после остановки с разрывом воспроизводит только незавершённые группы;
 * - счётчик пропуска, остановка на позиции, ожидание позиции;
 * - отказ, в том числе при заполненной очереди контрольных точек;
 * - остановка с нетранзакционной группой на исполнителе и на координаторе;
 * - остановка на позиции источника и задержка применения;
 * - настройки меняются только у остановленного применителя.
 */
class ReplicationApplierTest {

    private static final long WAIT_MS = 10_000L;

    private static MtsConfig config(int workers, boolean commitOrder) {
        return MtsConfig.builder()
                .scheduling().workers(workers).commitOrder(commitOrder).done()
                .retry().maxRetries(0).backoffBaseMs(0L).done()
                .jmxEnabled(false)
                .build();
    }

    private static ReplicationApplier applier(MtsConfig config,
                                              TestEventSource source,
                                              RecordingApplier applier,
                                              InMemoryPositionStore store) {
        return new ReplicationApplier(config, source, applier, store, KeyEquivalence.NATURAL);
    }

    /** Поток из {@code count} транзакций по 1–3 ключа из {@code keySpace} ключей. */
    private static List<ChangeEvent> randomStream(long seed, int count, int keySpace) {
        Random rnd = new Random(seed);
        List<String[]> groups = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int n = 1 + rnd.nextInt(3);
            String[] keys = new String[n];
            for (int k = 0; k < n; k++) {
                keys[k] = "k" + rnd.nextInt(keySpace);
            }
            groups.add(keys);
        }
        return Events.stream(groups.toArray(new String[0][]));
    }

    private static void awaitStopped(ReplicationApplier app) throws InterruptedException {
        assertTrue(Waits.until(() -> !app.isRunning(), WAIT_MS), "применитель не остановился");
    }

    @Test
    @DisplayName("Параллельное применение совпадает с последовательным")
    void parallelMatchesSerial() throws Exception {
        List<ChangeEvent> events = randomStream(42L, 300, 12);

        RecordingApplier serial = new RecordingApplier();
        ReplicationApplier one = applier(config(0, true), new TestEventSource(events), serial,
                new InMemoryPositionStore());
        one.start();
        awaitStopped(one);

        RecordingApplier parallel = new RecordingApplier();
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier many = applier(config(4, false), new TestEventSource(events), parallel, store);
        many.start();
        awaitStopped(many);

        assertNull(many.lastFailure());
        assertEquals(300, parallel.commits().size());
        assertEquals(serial.state(), parallel.state());
        assertEquals(0, parallel.overlaps(), "группы с общими ключами выполнялись одновременно");
        for (int k = 0; k < 12; k++) {
            List<Long> writers = parallel.writesTo("k" + k);
            for (int i = 1; i < writers.size(); i++) {
                assertTrue(writers.get(i - 1) < writers.get(i), "ключ k" + k + ": " + writers);
            }
        }
        assertEquals(300L, store.load().checkpoint().groupId());
    }

    @Test
    @DisplayName("С порядком фиксаций группы фиксируются строго по номерам")
    void commitOrderPreserved() throws Exception {
        RecordingApplier rec = new RecordingApplier().delay(2L);
        ReplicationApplier app = applier(config(4, true), new TestEventSource(randomStream(7L, 60, 40)), rec,
                new InMemoryPositionStore());
        app.start();
        awaitStopped(app);

        List<Long> commits = rec.commits();
        assertEquals(60, commits.size());
        for (int i = 0; i < commits.size(); i++) {
            assertEquals(i + 1L, commits.get(i));
        }
    }

    /**
     * GIVEN: G1 пишет a, G2 пишет b, G3 пишет a; применение G1 задержано
     * WHEN:  два исполнителя
     * THEN:  G2 фиксируется раньше G1, G3 только после G1
     */
    @Test
    @DisplayName("Группа с общим ключом ждёт предшественника, а независимая не ждёт")
    void conflictingGroupWaitsForPredecessor() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingApplier rec = new RecordingApplier().gate(1L, gate);
        TestEventSource source = new TestEventSource(
                Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("a"))).keepOpen();
        try (ReplicationApplier app = applier(config(2, false), source, rec, new InMemoryPositionStore())) {
            app.start();
            assertTrue(rec.awaitEntered(1L, WAIT_MS));
            assertTrue(Waits.until(() -> rec.commits().contains(2L), WAIT_MS));
            Thread.sleep(100L);
            assertFalse(rec.commits().contains(3L), "G3 зафиксирована раньше G1");

            gate.countDown();
            assertTrue(Waits.until(() -> rec.commits().size() == 3, WAIT_MS));
            assertEquals(Arrays.asList(1L, 3L), rec.writesTo("a"));
            assertEquals("v8", rec.state().get("a"));
        }
    }

    @Test
    @DisplayName("DDL выполняется после завершения всех предыдущих групп и до следующих")
    void ddlIsolatedInParallelMode() throws Exception {
        List<ChangeEvent> events = new ArrayList<>();
        events.addAll(Events.txn(1, "a"));
        events.addAll(Events.txn(4, "b"));
        events.add(Events.ddl(7));
        events.addAll(Events.txn(8, "c"));
        RecordingApplier rec = new RecordingApplier().delay(20L);
        ReplicationApplier app = applier(config(3, false), new TestEventSource(events), rec,
                new InMemoryPositionStore());
        app.start();
        awaitStopped(app);

        List<Long> commits = rec.commits();
        assertEquals(4, commits.size());
        int ddl = commits.indexOf(3L);
        assertTrue(commits.indexOf(1L) < ddl && commits.indexOf(2L) < ddl, commits.toString());
        assertTrue(commits.indexOf(4L) > ddl, commits.toString());
        assertEquals(1L, app.status().counter("groups.isolated"));
    }

    /**
     * GIVEN: G1 задержана, G2 и G3 (независимые) применены на других исполнителях,
     *        порядок фиксаций выключен
     * WHEN:  остановка и повторный запуск
     * THEN:  сохранён разрыв P=0, Q=3; при перезапуске G1 воспроизводится, G2 и G3 пропускаются
     */
    @Test
    @DisplayName("Перезапуск после остановки с разрывом воспроизводит только незавершённые группы")
    void restartReplaysGap() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingApplier rec = new RecordingApplier().gate(1L, gate);
        InMemoryPositionStore store = new InMemoryPositionStore();
        TestEventSource source = new TestEventSource(
                Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"))).keepOpen();
        ReplicationApplier app = applier(config(3, false), source, rec, store);

        app.start();
        assertTrue(rec.awaitEntered(1L, WAIT_MS));
        assertTrue(Waits.until(() -> rec.commits().size() == 2, WAIT_MS));
        app.stop();
        assertFalse(app.isRunning());

        DurableState saved = store.load();
        assertEquals(0L, saved.checkpoint().groupId());
        assertEquals(3L, saved.highestAssignedGroupId());
        assertFalse(saved.isCompleted(1L));
        assertTrue(saved.isCompleted(2L));
        assertTrue(saved.isCompleted(3L));
        assertEquals(1, rec.rollbacks());

        gate.countDown();
        app.start();
        try {
            assertTrue(Waits.until(() -> rec.commits().size() == 3, WAIT_MS));
            List<Long> commits = rec.commits();
            assertEquals(new HashSet<>(Arrays.asList(2L, 3L)), new HashSet<>(commits.subList(0, 2)));
            assertEquals(1L, commits.get(2));
            assertEquals(2, rec.attempts(1L));
            assertEquals(1, rec.attempts(2L));
            assertEquals(1, rec.attempts(3L));
            assertTrue(app.waitForPosition(Events.target(9), WAIT_MS));
            assertEquals(2L, app.status().counter("groups.skipped"));
        } finally {
            app.stop();
        }
        assertEquals(3L, store.load().checkpoint().groupId());
        assertEquals(0L, store.load().highestAssignedGroupId() - store.load().checkpoint().groupId());
    }

    @Test
    @DisplayName("Группа с числом ключей сверх предела выполняется изолированно")
    void tooManyKeysRunIsolated() throws Exception {
        MtsConfig config = MtsConfig.builder()
                .scheduling().workers(2).done()
                .dependency().maxKeys(2).done()
                .retry().maxRetries(0).backoffBaseMs(0L).done()
                .jmxEnabled(false)
                .build();
        RecordingApplier rec = new RecordingApplier();
        ReplicationApplier app = applier(config,
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b", "c", "d"), Events.keys("e"))),
                rec, new InMemoryPositionStore());
        app.start();
        awaitStopped(app);

        assertEquals(Arrays.asList(1L, 2L, 3L), rec.commits());
        assertEquals(1L, app.status().counter("groups.isolated"));
    }

    /**
     * GIVEN: сохранено P=1, Q=3, G3 завершена; включена остановка после разрыва
     * WHEN:  запуск
     * THEN:  воспроизводится только G2, G3 пропускается, G4 не читается
     */
    @Test
    @DisplayName("Остановка после воспроизведения разрыва")
    void untilAfterGapsStopsAfterReplay() throws Exception {
        BitSet done = new BitSet();
        done.set(1);
        InMemoryPositionStore store = new InMemoryPositionStore(
                new DurableState(new Checkpoint(1L, Events.source(3), Events.target(3)), 3L, done));
        MtsConfig config = MtsConfig.builder()
                .scheduling().workers(2).untilAfterGaps(true).done()
                .retry().maxRetries(0).backoffBaseMs(0L).done()
                .jmxEnabled(false)
                .build();
        RecordingApplier rec = new RecordingApplier();
        TestEventSource source = new TestEventSource(
                Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"), Events.keys("d"))).keepOpen();
        ReplicationApplier app = applier(config, source, rec, store);
        app.start();
        awaitStopped(app);

        assertNull(app.lastFailure());
        assertEquals(Arrays.asList(Events.source(3)), source.opens());
        assertEquals(Arrays.asList(2L), rec.commits());
        assertEquals(1L, app.status().counter("groups.skipped"));
        assertEquals(3L, store.load().checkpoint().groupId());
        assertFalse(app.status().isRecovering());
    }

    @Test
    @DisplayName("Счётчик пропуска отмечает группы применёнными без выполнения")
    void skipCounterSkipsGroups() throws Exception {
        RecordingApplier rec = new RecordingApplier();
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(2, true),
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"))), rec, store);
        app.setSkipCounter(1L);
        app.start();
        awaitStopped(app);

        assertEquals(Arrays.asList(2L, 3L), rec.commits());
        assertEquals(0, rec.attempts(1L));
        assertEquals(1L, app.status().counter("groups.skipped"));
        assertEquals(3L, store.load().checkpoint().groupId());
    }

    @Test
    @DisplayName("Запуск до позиции останавливает чтение после группы, достигшей её")
    void startUntilStopsAtTarget() throws Exception {
        RecordingApplier rec = new RecordingApplier();
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(2, true),
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"),
                        Events.keys("d"))), rec, store);
        app.startUntil(Events.target(6));
        awaitStopped(app);

        assertEquals(Arrays.asList(1L, 2L), rec.commits());
        assertEquals(2L, store.load().checkpoint().groupId());
        assertEquals(Events.source(6), store.load().checkpoint().sourcePosition());
    }

    @Test
    @DisplayName("Ожидание позиции завершается, когда низшая отметка её достигла")
    void waitForPosition() throws Exception {
        RecordingApplier rec = new RecordingApplier();
        TestEventSource source = new TestEventSource(
                Events.stream(Events.keys("a"), Events.keys("b"))).keepOpen();
        try (ReplicationApplier app = applier(config(2, true), source, rec, new InMemoryPositionStore())) {
            assertFalse(app.waitForPosition(Events.target(6), 10L), "до запуска позиция не достигнута");
            app.start();
            assertTrue(app.waitForPosition(Events.target(6), WAIT_MS));
            assertFalse(app.waitForPosition(Events.target(100), 50L));

            ApplierStatus st = app.status();
            assertTrue(st.isRunning());
            assertTrue(st.isParallelExec());
            assertFalse(st.isRecovering());
            assertEquals(GroupStatus.NOT_IN_GROUP, st.groupStatus());
            assertEquals(2, st.workerQueueDepths().length);
            assertEquals(Events.target(6), st.readTargetPosition());
            assertEquals(2L, st.durableCheckpoint().groupId());
            assertTrue(Waits.until(() -> app.status().counter("groups.completed") == 2L, WAIT_MS));
        }
    }

    @Test
    @DisplayName("Отказ исполнителя останавливает конвейер и доступен через lastFailure")
    void fatalFailureSurfaces() throws Exception {
        RecordingApplier rec = new RecordingApplier().fatal(2L);
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(2, true),
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"))), rec, store);
        app.start();
        awaitStopped(app);

        ApplierFailureException f = app.lastFailure();
        assertNotNull(f);
        assertEquals(FailureClass.FATAL, f.failureClass());
        assertEquals(2L, f.groupId());
        assertEquals(Events.source(6), f.sourcePosition());
        assertEquals(f, app.status().lastFailure());
        assertFalse(rec.commits().contains(2L));
        assertEquals(1L, store.load().checkpoint().groupId());
    }

    /**
     * GIVEN: очередь контрольных точек на две группы; G1 остановлена на защёлке и затем
     *        завершается FATAL, следом идут независимые G2..G5
     * WHEN:  координатор ждёт места в очереди, а G1 не выбудет никогда
     * THEN:  отказ G1 всё равно доходит до координатора, запуск завершается с отказом
     */
    @Test
    @DisplayName("Отказ исполнителя доходит до координатора, ждущего места в очереди контрольных точек")
    void failureSurfacesWhileCheckpointQueueFull() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingApplier rec = new RecordingApplier().gate(1L, gate).fatal(1L);
        InMemoryPositionStore store = new InMemoryPositionStore();
        MtsConfig cfg = config(2, false).toBuilder().checkpoint().group(2).done().build();
        ReplicationApplier app = applier(cfg,
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"),
                        Events.keys("d"), Events.keys("e"))).keepOpen(), rec, store);
        app.start();
        assertTrue(rec.awaitEntered(1L, WAIT_MS));
        assertTrue(Waits.until(() -> app.status().counter("checkpoint.full.waits") > 0L, WAIT_MS),
                "координатор не дошёл до ожидания места");

        gate.countDown();
        awaitStopped(app);

        ApplierFailureException f = app.lastFailure();
        assertNotNull(f, "отказ не зарегистрирован");
        assertEquals(FailureClass.FATAL, f.failureClass());
        assertEquals(1L, f.groupId());
        assertEquals(f, app.status().lastFailure());
        assertFalse(rec.commits().contains(1L));
        assertEquals(0L, store.load().checkpoint().groupId());
    }

    /**
     * GIVEN: G2 уже записала в нетранзакционную таблицу и остановлена на защёлке
     * WHEN:  остановка применителя
     * THEN:  остановка ждёт G2, группа фиксируется, отката нет
     */
    @Test
    @DisplayName("Группа с нетранзакционными изменениями дорабатывает при остановке")
    void nonTransactionalGroupFinishesOnStop() throws Exception {
        assertStopWaitsForNonTransactionalGroup(2, Events.commit(6));
    }

    @Test
    @DisplayName("Без исполнителей группа с нетранзакционными изменениями дорабатывает на координаторе")
    void nonTransactionalGroupFinishesOnStopWithoutWorkers() throws Exception {
        assertStopWaitsForNonTransactionalGroup(0, Events.commit(6));
    }

    @Test
    @DisplayName("Изолированная DDL-группа с нетранзакционными изменениями дорабатывает при остановке")
    void nonTransactionalDdlGroupFinishesOnStop() throws Exception {
        assertStopWaitsForNonTransactionalGroup(2, Events.ddl(6));
    }

    /**
     * G1 обычная; G2: BEGIN, нетранзакционная строка и {@code terminal}. G2 останавливается
     * на защёлке после нетранзакционной записи, затем вызывается остановка.
     */
    private static void assertStopWaitsForNonTransactionalGroup(int workers, ChangeEvent terminal)
            throws Exception {
        List<ChangeEvent> events = new ArrayList<>(Events.txn(1, "a"));
        events.add(Events.begin(4));
        events.add(Events.nonTransactionalRow(5, "x", "n"));
        events.add(terminal);
        CountDownLatch gate = new CountDownLatch(1);
        RecordingApplier rec = new RecordingApplier().gate(2L, gate);
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(workers, true), new TestEventSource(events).keepOpen(), rec, store);
        app.start();
        assertTrue(rec.awaitEntered(2L, WAIT_MS));

        CompletableFuture<Void> stopping = stopAsync(app);
        Thread.sleep(200L);
        assertFalse(stopping.isDone(), "остановка не дождалась нетранзакционной группы");

        gate.countDown();
        stopping.get(WAIT_MS, TimeUnit.MILLISECONDS);
        assertFalse(app.isRunning());
        assertEquals(Arrays.asList(1L, 2L), rec.commits());
        assertEquals("n", rec.state().get("x"));
        assertEquals(0, rec.rollbacks());
        assertEquals(2L, store.load().checkpoint().groupId());
    }

    @Test
    @DisplayName("Без исполнителей остановка бросает группу координатора, если её можно откатить")
    void stopAbandonsTransactionalGroupWithoutWorkers() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingApplier rec = new RecordingApplier().gate(2L, gate);
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(0, true),
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"))).keepOpen(), rec, store);
        app.start();
        assertTrue(rec.awaitEntered(2L, WAIT_MS));

        stopAsync(app).get(WAIT_MS, TimeUnit.MILLISECONDS);

        assertFalse(app.isRunning());
        assertEquals(Arrays.asList(1L), rec.commits());
        assertEquals(1, rec.rollbacks());
        assertEquals(1L, store.load().checkpoint().groupId());
        gate.countDown();
    }

    @Test
    @DisplayName("Запуск до позиции источника останавливает чтение после группы, достигшей её")
    void startUntilSourceStopsAtSourcePosition() throws Exception {
        RecordingApplier rec = new RecordingApplier();
        InMemoryPositionStore store = new InMemoryPositionStore();
        ReplicationApplier app = applier(config(2, true),
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"), Events.keys("c"))).keepOpen(),
                rec, store);
        app.startUntilSource(Events.source(5));
        awaitStopped(app);

        assertEquals(Arrays.asList(1L, 2L), rec.commits());
        assertEquals(Events.source(6), store.load().checkpoint().sourcePosition());
        assertNull(app.lastFailure());
    }

    @Test
    @DisplayName("Задержка применения откладывает группы относительно метки времени первичного сервера")
    void sqlDelayPostponesApply() throws Exception {
        long delayMs = 300L;
        long stampedAt = System.currentTimeMillis();
        RecordingApplier rec = new RecordingApplier();
        MtsConfig cfg = config(2, true).toBuilder().scheduling().sqlDelayMs(delayMs).done().build();
        ReplicationApplier app = applier(cfg,
                new TestEventSource(Events.stamped(Events.stream(Events.keys("a"), Events.keys("b")), stampedAt)),
                rec, new InMemoryPositionStore());
        app.start();
        awaitStopped(app);

        assertEquals(Arrays.asList(1L, 2L), rec.commits());
        assertTrue(System.currentTimeMillis() - stampedAt >= delayMs, "группы применены раньше задержки");
    }

    @Test
    @DisplayName("Остановка не ждёт конца задержки применения")
    void stopInterruptsSqlDelay() throws Exception {
        RecordingApplier rec = new RecordingApplier();
        MtsConfig cfg = config(2, true).toBuilder().scheduling().sqlDelayMs(TimeUnit.HOURS.toMillis(1)).done().build();
        ReplicationApplier app = applier(cfg,
                new TestEventSource(Events.stamped(Events.stream(Events.keys("a")), System.currentTimeMillis()))
                        .keepOpen(),
                rec, new InMemoryPositionStore());
        app.start();
        assertTrue(Waits.until(() -> app.status().counter("sql.delay.remaining.ms") > 0L, WAIT_MS),
                "группа не ждёт задержки");

        stopAsync(app).get(WAIT_MS, TimeUnit.MILLISECONDS);

        assertFalse(app.isRunning());
        assertEquals(0, rec.attempts(1L));
        assertTrue(rec.commits().isEmpty());
        assertNull(app.lastFailure());
    }

    private static CompletableFuture<Void> stopAsync(ReplicationApplier app) {
        return CompletableFuture.runAsync(() -> {
            try {
                app.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Test
    @DisplayName("Настройки меняются только у остановленного применителя")
    void settersRequireStoppedApplier() throws Exception {
        TestEventSource source = new TestEventSource(Events.stream(Events.keys("a"))).keepOpen();
        ReplicationApplier app = applier(config(2, true), source, new RecordingApplier(), new InMemoryPositionStore());
        assertThrows(IllegalArgumentException.class, () -> app.setSkipCounter(-1L));

        app.start();
        try {
            assertThrows(IllegalStateException.class, () -> app.setWorkerCount(3));
            assertThrows(IllegalStateException.class, () -> app.setCheckpointGroup(64));
            assertThrows(IllegalStateException.class, () -> app.setQueueLimits(10, 1024L));
            assertThrows(IllegalStateException.class, () -> app.setCommitOrder(false));
            assertThrows(IllegalStateException.class, () -> app.setSkipCounter(1L));
            assertThrows(IllegalStateException.class, app::start);
        } finally {
            app.stop();
        }

        app.setWorkerCount(3);
        app.setCheckpointGroup(64);
        app.setQueueLimits(10, 1024L);
        app.setCommitOrder(false);
        MtsConfig c = app.config();
        assertEquals(3, c.getScheduling().getWorkers());
        assertEquals(64, c.getCheckpoint().getGroup());
        assertEquals(10, c.getDependency().getQueueMaxGroups());
        assertEquals(1024L, c.getDependency().getQueueMaxBytes());
        assertFalse(c.getScheduling().isCommitOrder());
    }

    @Test
    @DisplayName("Конфигурация Hadoop читается при создании применителя")
    void configurationConstructor() throws Exception {
        Configuration cfg = new Configuration(false);
        cfg.set(MtsConfig.Keys.WORKERS, "3");
        cfg.set(MtsConfig.Keys.JMX_ENABLED, "false");
        RecordingApplier rec = new RecordingApplier();
        ReplicationApplier app = new ReplicationApplier(cfg,
                new TestEventSource(Events.stream(Events.keys("a"), Events.keys("b"))), rec,
                new InMemoryPositionStore());

        assertEquals(3, app.config().getScheduling().getWorkers());
        assertFalse(app.status().isRunning());
        assertTrue(app.status().counters().isEmpty());

        app.start();
        awaitStopped(app);
        assertEquals(Arrays.asList(1L, 2L), rec.commits());
    }
}
