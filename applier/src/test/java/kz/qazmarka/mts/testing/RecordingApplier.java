package kz.qazmarka.mts.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import kz.qazmarka.mts.event.AccessKey;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.group.TransactionGroup;
import kz.qazmarka.mts.worker.ApplyOutcome;
import kz.qazmarka.mts.worker.DependencyViolationException;
import kz.qazmarka.mts.worker.GroupApplier;

/**
 * Исполнитель-заглушка: применяет записи строк к карте «ключ → значение», буферизуя их
 * до фиксации, и записывает порядок фиксаций.
 *
 * Проверяет, что две группы с пересекающимися ключами не выполняются одновременно:
 * ключи группы заняты от начала применения до фиксации или отката.
 */
public final class RecordingApplier implements GroupApplier {

    private final Map<Object, Object> state = new ConcurrentHashMap<>();
    private final Map<Object, Long> busyKeys = new ConcurrentHashMap<>();
    private final Map<Long, Map<Object, Object>> pending = new ConcurrentHashMap<>();
    private final List<Long> commits = Collections.synchronizedList(new ArrayList<>());
    private final Map<Object, List<Long>> writesByKey = new ConcurrentHashMap<>();
    private final AtomicInteger overlaps = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();
    private final Map<Long, Integer> attempts = new ConcurrentHashMap<>();

    private final Map<Long, Integer> retryableTimes = new ConcurrentHashMap<>();
    private final Map<Long, Integer> violationTimes = new ConcurrentHashMap<>();
    private final Map<Long, Boolean> fatal = new ConcurrentHashMap<>();
    private final Map<Long, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Map<Long, CountDownLatch> entered = new ConcurrentHashMap<>();
    private volatile long delayMs;

    // ==== сценарии ====

    /** Первые {@code times} попыток группы завершаются RETRYABLE. */
    public RecordingApplier retryable(long groupId, int times) {
        retryableTimes.put(groupId, times);
        return this;
    }

    /** Первые {@code times} попыток группы сообщают о нарушении зависимостей. */
    public RecordingApplier violation(long groupId, int times) {
        violationTimes.put(groupId, times);
        return this;
    }

    public RecordingApplier fatal(long groupId) {
        fatal.put(groupId, Boolean.TRUE);
        return this;
    }

    /**
     * Применение группы останавливается (после нетранзакционного эффекта, если он есть)
     * до открытия защёлки.
     */
    public RecordingApplier gate(long groupId, CountDownLatch latch) {
        gates.put(groupId, latch);
        entered.put(groupId, new CountDownLatch(1));
        return this;
    }

    /** Ждёт, пока группа дойдёт до защёлки. */
    public boolean awaitEntered(long groupId, long timeoutMs) throws InterruptedException {
        CountDownLatch l = entered.get(groupId);
        return l != null && l.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /** Задержка применения каждой группы. */
    public RecordingApplier delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    // ==== GroupApplier ====

    @Override
    public ApplyOutcome apply(TransactionGroup group) throws InterruptedException {
        long id = group.id();
        attempts.merge(id, 1, Integer::sum);
        for (AccessKey k : group.keys()) {
            Long other = busyKeys.putIfAbsent(k.value(), id);
            if (other != null && other != id) {
                overlaps.incrementAndGet();
            }
        }
        Map<Object, Object> writes = new LinkedHashMap<>();
        for (ChangeEvent e : group.events()) {
            if (e.isNonTransactional() && !group.markNonTransactionalEffect()) {
                throw new InterruptedException("группа брошена");
            }
            if (e.payload() != null) {
                for (AccessKey k : e.keys()) {
                    writes.put(k.value(), e.payload());
                }
            }
        }
        pending.put(id, writes);
        CountDownLatch gate = gates.get(id);
        if (gate != null) {
            entered.get(id).countDown();
            gate.await();
        }
        if (delayMs > 0L) {
            Thread.sleep(delayMs);
        }
        if (countDown(violationTimes, id)) {
            throw new DependencyViolationException("строка не найдена в группе " + id);
        }
        if (countDown(retryableTimes, id)) {
            return ApplyOutcome.RETRYABLE;
        }
        if (fatal.containsKey(id)) {
            return ApplyOutcome.FATAL;
        }
        return ApplyOutcome.SUCCESS;
    }

    @Override
    public void commit(TransactionGroup group) {
        long id = group.id();
        Map<Object, Object> writes = pending.remove(id);
        if (writes != null) {
            for (Map.Entry<Object, Object> w : writes.entrySet()) {
                state.put(w.getKey(), w.getValue());
                writesByKey.computeIfAbsent(w.getKey(), k -> Collections.synchronizedList(new ArrayList<>())).add(id);
            }
        }
        commits.add(id);
        freeKeys(group);
    }

    @Override
    public void rollback(TransactionGroup group) {
        pending.remove(group.id());
        rollbacks.incrementAndGet();
        freeKeys(group);
    }

    private void freeKeys(TransactionGroup group) {
        for (AccessKey k : group.keys()) {
            busyKeys.remove(k.value(), group.id());
        }
    }

    private static boolean countDown(Map<Long, Integer> budget, long id) {
        Integer left = budget.get(id);
        if (left == null || left <= 0) {
            return false;
        }
        budget.put(id, left - 1);
        return true;
    }

    // ==== наблюдения ====

    public Map<Object, Object> state() {
        return new HashMap<>(state);
    }

    /** Номера групп в порядке фиксации. */
    public List<Long> commits() {
        synchronized (commits) {
            return new ArrayList<>(commits);
        }
    }

    /** Номера групп, писавших ключ, в порядке фиксации. */
    public List<Long> writesTo(Object key) {
        List<Long> l = writesByKey.get(key);
        if (l == null) {
            return Collections.emptyList();
        }
        synchronized (l) {
            return new ArrayList<>(l);
        }
    }

    public int overlaps() {
        return overlaps.get();
    }

    public int rollbacks() {
        return rollbacks.get();
    }

    public int attempts(long groupId) {
        Integer a = attempts.get(groupId);
        return a == null ? 0 : a;
    }
}
