package kz.qazmarka.mts.worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.dependency.DependencyResolver;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Пул из N независимых исполнителей, каждый в собственном потоке {@code mts-worker-<n>}.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final DependencyResolver resolver;
    private final List<Worker> workers;
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean started;

    public WorkerPool(int size,
                      int localCapacity,
                      DependencyResolver resolver,
                      GroupRunner runner,
                      CompletionListener listener) {
        if (size <= 0) {
            throw new IllegalArgumentException("Размер пула должен быть положительным: " + size);
        }
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        resolver.attachWorkers(size, localCapacity);
        List<Worker> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(new Worker(i, resolver, runner, listener));
        }
        this.workers = Collections.unmodifiableList(list);
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        for (Worker w : workers) {
            Thread t = new Thread(w, "mts-worker-" + w.id());
            t.setDaemon(true);
            threads.add(t);
            t.start();
        }
        started = true;
        LOG.info("Запущено исполнителей: {}", workers.size());
    }

    public int size() {
        return workers.size();
    }

    public Worker worker(int id) {
        return workers.get(id);
    }

    /** Глубина очереди каждого исполнителя (локальная очередь плюс выполняемая группа). */
    public int[] queueDepths() {
        return resolver.workerLoads();
    }

    boolean allIdle() {
        for (Worker w : workers) {
            if (!w.isIdle()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Просит исполнителей бросить текущие группы. Группы с нетранзакционными эффектами
     * дорабатывают до конца.
     *
     * @return число групп, которые обязаны завершиться
     */
    public int abandonSafely() {
        int mustFinish = 0;
        for (Worker w : workers) {
            TransactionGroup g = w.current();
            if (!w.requestAbandon()) {
                mustFinish++;
                LOG.info("Группа {} на исполнителе {} уже выполнила нетранзакционные изменения: дожидаемся её завершения",
                        g == null ? "?" : g.id(), w.id());
            }
        }
        return mustFinish;
    }

    /**
     * Ждёт завершения потоков исполнителей. Резолвер должен быть закрыт заранее.
     *
     * @return {@code true}, если все потоки завершились
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (Thread t : threads) {
            long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (left > 0L) {
                t.join(left);
            }
        }
        for (Thread t : threads) {
            if (t.isAlive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Закрывает резолвер и прерывает потоки без ожидания групп.
     */
    @Override
    public void close() {
        resolver.close();
        for (Thread t : threads) {
            t.interrupt();
        }
    }
}
