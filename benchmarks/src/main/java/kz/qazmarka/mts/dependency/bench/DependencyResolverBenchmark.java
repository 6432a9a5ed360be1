package kz.qazmarka.mts.dependency.bench;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import kz.qazmarka.mts.config.MtsConfig;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventKind;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.event.LogPosition;
import kz.qazmarka.mts.group.EventArena;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Бенчмарк {@link DependencyResolver}: стоимость сборки группы, вычисления предшественников
 * по карте последних писателей и снятия группы после фиксации.
 *
 * Параметры:
 *  - {@code keySpace}: число различных ключей; малое значение даёт частые конфликты;
 *  - {@code keysPerGroup}: строк в группе;
 *  - {@code window}: групп одновременно «в работе» (старейшая завершается перед регистрацией новой).
 *
 * Формат отчёта JMH: {@code Score}: среднее время на одну группу в наносекундах.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class DependencyResolverBenchmark {

    private static final String LOG = "relay.000001";

    @State(Scope.Thread)
    public static class ResolverState {
        @Param({"16", "100000"})
        int keySpace;

        @Param({"1", "8"})
        int keysPerGroup;

        @Param({"32"})
        int window;

        DependencyResolver resolver;
        EventArena arena;
        ArrayDeque<TransactionGroup> inFlight;
        ChangeEvent[] rows;
        ChangeEvent begin;
        ChangeEvent commit;
        long nextId;
        int cursor;

        @Setup(Level.Trial)
        public void setUp() {
            MtsConfig config = MtsConfig.builder().jmxEnabled(false).build();
            resolver = new DependencyResolver(config.getDependency(), KeyEquivalence.NATURAL, new CoordinatorContext());
            arena = new EventArena(window * (keysPerGroup + 2) * 2);
            inFlight = new ArrayDeque<>(window);
            LogPosition pos = LogPosition.of(LOG, 1L);
            begin = ChangeEvent.builder(EventKind.BEGIN).source(pos).target(pos).build();
            commit = ChangeEvent.builder(EventKind.COMMIT).source(pos).target(pos).build();
            // простой множитель перемешивает ключи без генератора случайных чисел
            rows = new ChangeEvent[4096];
            for (int i = 0; i < rows.length; i++) {
                long key = (i * 2_654_435_761L) % keySpace;
                rows[i] = ChangeEvent.builder(EventKind.ROWS).source(pos).target(pos)
                        .key(key).database("bench").size(128).build();
            }
            nextId = 1L;
        }
    }

    @Benchmark
    public int registerAndComplete(ResolverState s) {
        if (s.inFlight.size() >= s.window) {
            TransactionGroup done = s.inFlight.poll();
            s.resolver.complete(done, true);
            done.release();
        }
        TransactionGroup.Builder b = TransactionGroup.builder(s.arena).add(s.begin);
        for (int i = 0; i < s.keysPerGroup; i++) {
            b.add(s.rows[s.cursor]);
            s.cursor = (s.cursor + 1) & (s.rows.length - 1);
        }
        TransactionGroup g = b.add(s.commit).build(s.nextId++);
        int edges = s.resolver.register(g);
        s.inFlight.add(g);
        return edges;
    }
}
