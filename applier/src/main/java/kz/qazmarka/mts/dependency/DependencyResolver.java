package kz.qazmarka.mts.dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kz.qazmarka.mts.config.ConflictPolicy;
import kz.qazmarka.mts.config.DependencySettings;
import kz.qazmarka.mts.coordinator.CoordinatorContext;
import kz.qazmarka.mts.event.AccessKey;
import kz.qazmarka.mts.event.KeyEquivalence;
import kz.qazmarka.mts.group.GroupState;
import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Резолвер зависимостей между группами транзакций.
 *
 * Хранит:
 *  - карту «ключ доступа → последняя группа-писатель»; ребро зависимости возникает, если
 *    писатель ещё в работе (или завершился отказом);
 *  - реестр групп в работе: от регистрации координатором до отчёта о завершении;
 *  - общую ограниченную очередь готовых групп (лимиты по числу и байтам, с порогом повторного
 *    заполнения) и локальные очереди исполнителей.
 *
 * Все структуры защищены одной блокировкой. Условия «очередь не полна», «очередь не пуста»
 * и «группа завершена» всегда будятся через {@code signalAll}: одно изменение состояния
 * (например, {@link #clear()}) может удовлетворить ожидающих сразу на нескольких условиях.
 *
 * Порядок выдачи: исполнитель берёт группы сначала из своей локальной очереди, затем из общей.
 * Координатор кладёт группу в локальную очередь только при пустой общей, поэтому каждый
 * исполнитель обрабатывает группы в порядке возрастания номеров.
 */
public final class DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyResolver.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private final Condition completed = lock.newCondition();

    private final KeyEquivalence equivalence;
    private final ConflictPolicy policy;
    private final int maxGroups;
    private final long maxBytes;
    private final int refillGroups;
    private final long refillBytes;
    private final CoordinatorContext ctx;

    private final Map<KeyRef, Long> lastWriter = new HashMap<>();
    private final Map<Long, TransactionGroup> inFlight = new HashMap<>();
    private final Set<Long> failed = new HashSet<>();
    private final ArrayDeque<TransactionGroup> queue = new ArrayDeque<>();
    private final List<ArrayDeque<TransactionGroup>> local = new ArrayList<>();
    private TransactionGroup[] running = new TransactionGroup[0];
    private int localCapacity = 1;
    private long queuedBytes;
    private long pendingBytes;
    private boolean full;
    private boolean closed;

    public DependencyResolver(DependencySettings settings, KeyEquivalence equivalence, CoordinatorContext ctx) {
        Objects.requireNonNull(settings, "settings");
        this.equivalence = Objects.requireNonNull(equivalence, "equivalence");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.policy = settings.getPolicy();
        this.maxGroups = settings.getQueueMaxGroups();
        this.maxBytes = settings.getQueueMaxBytes();
        this.refillGroups = (int) ((long) maxGroups * settings.getRefillPercent() / 100L);
        this.refillBytes = maxBytes / 100L * settings.getRefillPercent();
    }

    /**
     * Создаёт локальные очереди исполнителей. Вызывается пулом до старта потоков.
     */
    public void attachWorkers(int workers, int capacity) {
        lock.lock();
        try {
            local.clear();
            for (int i = 0; i < workers; i++) {
                local.add(new ArrayDeque<TransactionGroup>(Math.max(1, capacity)));
            }
            running = new TransactionGroup[workers];
            localCapacity = Math.max(1, capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Регистрирует обращение группы к ключу и обновляет последнего писателя.
     *
     * @return {@code true}, если предыдущий писатель ключа ещё не зафиксирован (конфликт)
     */
    public boolean recordAccess(TransactionGroup group, AccessKey key) {
        lock.lock();
        try {
            Long prev = lastWriter.put(new KeyRef(key, equivalence), group.id());
            if (prev == null || prev == group.id()) {
                return false;
            }
            if (inFlight.containsKey(prev) || failed.contains(prev)) {
                group.addPredecessor(prev);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Регистрирует группу как находящуюся в работе и вычисляет её предшественников.
     *
     * @return число конфликтующих предшественников
     */
    public int register(TransactionGroup group) {
        lock.lock();
        try {
            if (inFlight.put(group.id(), group) != null) {
                throw new IllegalStateException("Группа " + group.id() + " уже зарегистрирована");
            }
            pendingBytes += group.sizeBytes();
            for (AccessKey key : group.keys()) {
                recordAccess(group, key);
            }
            return group.predecessors().size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Передаёт зарегистрированную группу на выполнение: в локальную очередь выбранного
     * исполнителя либо, если свободного места нет, в общую очередь (с ожиданием при заполнении).
     *
     * @return номер исполнителя или {@code -1}, если группа поставлена в общую очередь
     * @throws InterruptedException ожидание места в очереди прервано
     */
    public int dispatch(TransactionGroup group) throws InterruptedException {
        lock.lock();
        try {
            int w = selectWorker(group);
            if (w >= 0) {
                local.get(w).add(group);
                group.assignWorker(w);
                group.moveTo(GroupState.ASSIGNED);
                notEmpty.signalAll();
                return w;
            }
            if (queue.isEmpty() && !local.isEmpty()) {
                ctx.onOverfill();
            }
            enqueueLocked(group);
            return -1;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Явно назначает группу в локальную очередь исполнителя.
     *
     * @throws IllegalStateException если локальная очередь исполнителя заполнена
     */
    public void assignTo(int workerId, TransactionGroup group) {
        lock.lock();
        try {
            ArrayDeque<TransactionGroup> q = local.get(workerId);
            if (q.size() >= localCapacity) {
                throw new IllegalStateException("Исполнитель " + workerId + " уже имеет назначение");
            }
            q.add(group);
            group.assignWorker(workerId);
            group.moveTo(GroupState.ASSIGNED);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ставит группу в общую очередь, ожидая, пока очередь не опустится ниже порога повторного заполнения.
     *
     * @return {@code false}, если резолвер закрыт и группа не принята
     */
    boolean enqueue(TransactionGroup group) throws InterruptedException {
        lock.lock();
        try {
            return enqueueLocked(group);
        } finally {
            lock.unlock();
        }
    }

    private boolean enqueueLocked(TransactionGroup group) throws InterruptedException {
        if (group.sizeBytes() > maxBytes) {
            throw new IllegalArgumentException("Группа " + group.id() + " (" + group.sizeBytes()
                    + " байт) больше лимита очереди " + maxBytes);
        }
        boolean counted = false;
        while (!closed && mustBlock(group)) {
            full = true;
            if (!counted) {
                ctx.onQueueFullWait();
                counted = true;
            }
            notFull.await();
        }
        if (closed) {
            return false;
        }
        queue.add(group);
        queuedBytes += group.sizeBytes();
        group.moveTo(GroupState.ASSIGNED);
        notEmpty.signalAll();
        return true;
    }

    private boolean mustBlock(TransactionGroup group) {
        return full || queue.size() >= maxGroups || queuedBytes + group.sizeBytes() > maxBytes;
    }

    /**
     * Выдаёт исполнителю следующую группу: из локальной очереди, затем из общей.
     *
     * @return группа или {@code null}, если резолвер закрыт
     * @throws InterruptedException ожидание прервано
     */
    public TransactionGroup next(int workerId) throws InterruptedException {
        lock.lock();
        try {
            boolean waiting = false;
            try {
                while (true) {
                    if (closed) {
                        return null;
                    }
                    TransactionGroup g = local.get(workerId).poll();
                    if (g == null) {
                        g = pollShared();
                    }
                    if (g != null) {
                        running[workerId] = g;
                        g.assignWorker(workerId);
                        return g;
                    }
                    if (!waiting) {
                        ctx.workerWaitStarted();
                        waiting = true;
                    }
                    notEmpty.await();
                }
            } finally {
                if (waiting) {
                    ctx.workerWaitFinished();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Неблокирующая выборка из общей очереди.
     */
    TransactionGroup poll() {
        lock.lock();
        try {
            return pollShared();
        } finally {
            lock.unlock();
        }
    }

    private TransactionGroup pollShared() {
        TransactionGroup g = queue.poll();
        if (g == null) {
            return null;
        }
        queuedBytes -= g.sizeBytes();
        if (full && queue.size() <= refillGroups && queuedBytes <= refillBytes) {
            full = false;
        }
        notFull.signalAll();
        return g;
    }

    /**
     * Ждёт, пока все предшественники группы не будут зафиксированы.
     *
     * @return {@code false}, если предшественник завершился отказом или резолвер закрыт
     */
    public boolean awaitPredecessors(TransactionGroup group) throws InterruptedException {
        lock.lock();
        try {
            boolean counted = false;
            while (true) {
                if (closed) {
                    return false;
                }
                boolean pending = false;
                for (Long p : group.predecessors()) {
                    if (failed.contains(p)) {
                        return false;
                    }
                    if (inFlight.containsKey(p)) {
                        pending = true;
                    }
                }
                if (!pending) {
                    return true;
                }
                if (!counted) {
                    ctx.onPredecessorWait();
                    counted = true;
                }
                completed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ждёт, пока не завершатся все группы с меньшими номерами. Используется для
     * последовательного повтора группы после нарушения зависимостей.
     *
     * @return {@code false}, если более ранняя группа завершилась отказом или резолвер закрыт
     */
    public boolean awaitOlderCompleted(TransactionGroup group) throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    return false;
                }
                boolean older = false;
                for (Long id : inFlight.keySet()) {
                    if (id < group.id()) {
                        older = true;
                        break;
                    }
                }
                for (Long id : failed) {
                    if (id < group.id()) {
                        return false;
                    }
                }
                if (!older) {
                    return true;
                }
                completed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Отчёт о завершении группы. Зафиксированная группа снимается с ключей, которые
     * она писала последней; незафиксированная запоминается как отказавшая, чтобы
     * зависимые от неё группы не были применены.
     */
    public void complete(TransactionGroup group, boolean committed) {
        lock.lock();
        try {
            if (inFlight.remove(group.id()) != null) {
                pendingBytes -= group.sizeBytes();
            }
            int w = group.workerId();
            if (w >= 0 && w < running.length && running[w] == group) {
                running[w] = null;
            }
            if (committed) {
                for (AccessKey key : group.keys()) {
                    KeyRef ref = new KeyRef(key, equivalence);
                    Long writer = lastWriter.get(ref);
                    if (writer != null && writer == group.id()) {
                        lastWriter.remove(ref);
                    }
                }
            } else {
                failed.add(group.id());
            }
            completed.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ждёт, пока в работе не останется ни одной группы.
     *
     * @return {@code true}, если всё завершено до истечения таймаута
     */
    public boolean awaitAllDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!inFlight.isEmpty()) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = completed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Полная очистка: выбрасывает группы из общей и локальных очередей (их цепочки событий
     * освобождаются), уменьшает число групп в работе на число выброшенных, очищает карту
     * писателей и будит всех ожидающих. Выполняющиеся группы остаются в реестре до отчёта.
     * Выброшенные группы считаются незафиксированными: зависящие от них группы не применяются.
     *
     * @return номера выброшенных групп
     */
    public List<Long> clear() {
        lock.lock();
        try {
            List<Long> discarded = new ArrayList<>();
            discard(queue, discarded);
            for (ArrayDeque<TransactionGroup> q : local) {
                discard(q, discarded);
            }
            queuedBytes = 0L;
            full = false;
            lastWriter.clear();
            failed.addAll(discarded);
            if (!discarded.isEmpty() && LOG.isDebugEnabled()) {
                LOG.debug("Резолвер: выброшено групп из очередей: {}, в работе осталось: {}",
                        discarded.size(), inFlight.size());
            }
            notFull.signalAll();
            notEmpty.signalAll();
            completed.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    private void discard(ArrayDeque<TransactionGroup> q, List<Long> sink) {
        TransactionGroup g;
        while ((g = q.poll()) != null) {
            if (inFlight.remove(g.id()) != null) {
                pendingBytes -= g.sizeBytes();
            }
            g.moveTo(GroupState.FAILED);
            g.release();
            sink.add(g.id());
        }
    }

    /**
     * Закрывает резолвер: исполнители перестают получать группы, ожидающие просыпаются.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notFull.signalAll();
            notEmpty.signalAll();
            completed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    public int queuedGroups() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long queuedBytes() {
        lock.lock();
        try {
            return queuedBytes;
        } finally {
            lock.unlock();
        }
    }

    /** Байты всех групп в работе: от регистрации до отчёта о завершении. */
    public long pendingBytes() {
        lock.lock();
        try {
            return pendingBytes;
        } finally {
            lock.unlock();
        }
    }

    /** Загрузка исполнителей: длина локальной очереди плюс выполняемая группа. */
    public int[] workerLoads() {
        lock.lock();
        try {
            int[] loads = new int[local.size()];
            for (int i = 0; i < loads.length; i++) {
                loads[i] = local.get(i).size() + (running[i] != null ? 1 : 0);
            }
            return loads;
        } finally {
            lock.unlock();
        }
    }

    public int localDepth(int workerId) {
        lock.lock();
        try {
            return local.get(workerId).size();
        } finally {
            lock.unlock();
        }
    }

    public int localCapacity() {
        lock.lock();
        try {
            return localCapacity;
        } finally {
            lock.unlock();
        }
    }

    public int keyMapSize() {
        lock.lock();
        try {
            return lastWriter.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxGroups() {
        return maxGroups;
    }

    public long maxBytes() {
        return maxBytes;
    }

    /**
     * Выбор исполнителя под блокировкой. При политике {@link ConflictPolicy#SAME_WORKER} группа
     * с незавершённым предшественником идёт к исполнителю самого позднего из них; иначе
     * выбирается наименее загруженный исполнитель со свободным местом, при равенстве
     * с меньшим номером.
     */
    private int selectWorker(TransactionGroup group) {
        if (local.isEmpty() || !queue.isEmpty()) {
            return -1;
        }
        if (policy == ConflictPolicy.SAME_WORKER) {
            long latest = -1L;
            for (Long p : group.predecessors()) {
                if (inFlight.containsKey(p) && p > latest) {
                    latest = p;
                }
            }
            if (latest >= 0L) {
                int w = inFlight.get(latest).workerId();
                if (w >= 0) {
                    return local.get(w).size() < localCapacity ? w : -1;
                }
            }
        }
        int best = -1;
        int bestLoad = Integer.MAX_VALUE;
        for (int i = 0; i < local.size(); i++) {
            int depth = local.get(i).size();
            if (depth >= localCapacity) {
                continue;
            }
            int load = depth + (running[i] != null ? 1 : 0);
            if (load < bestLoad) {
                best = i;
                bestLoad = load;
            }
        }
        return best;
    }

    /** Обёртка ключа с внешне заданным равенством. */
    private static final class KeyRef {
        private final AccessKey key;
        private final KeyEquivalence eq;
        private final int hash;

        KeyRef(AccessKey key, KeyEquivalence eq) {
            this.key = key;
            this.eq = eq;
            this.hash = eq.hash(key);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof KeyRef)) return false;
            return eq.same(key, ((KeyRef) o).key);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
