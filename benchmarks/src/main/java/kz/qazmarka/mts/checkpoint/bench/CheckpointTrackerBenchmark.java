package kz.qazmarka.mts.checkpoint.bench;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import kz.qazmarka.mts.checkpoint.Checkpoint;
import kz.qazmarka.mts.checkpoint.CheckpointTracker;
import kz.qazmarka.mts.checkpoint.InMemoryPositionStore;
import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventKind;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.EventArena;
import kz.qazmarka.mts.group.TransactionGroup;
import kz.qazmarka.mts.worker.ApplyOutcome;

/**
 * Бенчмарк продвижения низшей отметки {@link CheckpointTracker}.
 *
 * Сценарии:
 *  - {@code inOrder}: группы завершаются в порядке назначения, отметка сдвигается на каждой;
 *  - {@code reversedWindow}: пачка из {@value #BATCH} групп завершается в обратном порядке,
 *    отметка стоит до завершения первой группы пачки;
 *  - {@code snapshotWithGap}: снимок для сохранения при незакрытом разрыве.
 *
 * Сброс в хранилище выполняется только по периоду, поэтому в измерение попадает
 * учёт очереди, а не запись.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class CheckpointTrackerBenchmark {

    static final int BATCH = 8;

    @State(Scope.Thread)
    public static class TrackerState {
        CheckpointTracker tracker;
        EventArena arena;
        ChangeEvent[] commits;
        long nextId;

        @Setup(Level.Trial)
        public void setUp() {
            MtsConfig config = MtsConfig.builder()
                    .checkpoint().group(4096).periodMs(1_000L).done()
                    .jmxEnabled(false)
                    .build();
            tracker = new CheckpointTracker(config.getCheckpoint(), new InMemoryPositionStore(),
                    Checkpoint.INITIAL, new CoordinatorContext());
            arena = new EventArena(BATCH * 4);
            commits = new ChangeEvent[1024];
            for (int i = 0; i < commits.length; i++) {
                LogPosition pos = LogPosition.of("relay.000001", i + 1L);
                commits[i] = ChangeEvent.builder(EventKind.COMMIT).source(pos).target(pos).build();
            }
            nextId = 1L;
        }

        long record() throws InterruptedException {
            long id = nextId++;
            ChangeEvent e = commits[(int) (id & (commits.length - 1))];
            tracker.record(TransactionGroup.builder(arena).add(e).build(id));
            return id;
        }
    }

    @State(Scope.Thread)
    public static class GapState {
        CheckpointTracker tracker;

        @Setup(Level.Trial)
        public void setUp() throws InterruptedException {
            TrackerState t = new TrackerState();
            t.setUp();
            tracker = t.tracker;
            for (int i = 0; i < 512; i++) {
                long id = t.record();
                // первая группа не завершается: весь остаток: разрыв
                if (id > 1L && (id & 1L) == 0L) {
                    tracker.markDone(id, ApplyOutcome.SUCCESS);
                }
            }
        }
    }

    @Benchmark
    public int inOrder(TrackerState s) throws InterruptedException, IOException {
        long id = s.record();
        int retired = s.tracker.markDone(id, ApplyOutcome.SUCCESS);
        s.tracker.flush(false, true);
        return retired;
    }

    @Benchmark
    @OperationsPerInvocation(BATCH)
    public int reversedWindow(TrackerState s) throws InterruptedException {
        long first = s.record();
        for (int i = 1; i < BATCH; i++) {
            s.record();
        }
        int retired = 0;
        for (long id = first + BATCH - 1; id >= first; id--) {
            retired += s.tracker.markDone(id, ApplyOutcome.SUCCESS);
        }
        return retired;
    }

    @Benchmark
    public long snapshotWithGap(GapState s) {
        return s.tracker.snapshot().completedBeyond().cardinality();
    }
}
