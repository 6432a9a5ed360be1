package kz.qazmarka.mts.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import kz.qazmarka.mts.event.AccessKey;
import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventKind;
import kz.qazmarka.mts.event.LogPosition;

/**
 * Группа транзакций: атомарная единица планирования.
 *
 * Неизменяемая часть (идентификатор, ключи, базы, позиции, размер) фиксируется билдером
 * при получении завершающего события. Изменяемая часть:
 *  - состояние жизненного цикла и номер исполнителя (volatile, пишет владелец текущей фазы);
 *  - множество предшественников: пишет и читает резолвер зависимостей под своей блокировкой;
 *  - признак нетранзакционного побочного эффекта и запрос на отказ от выполнения: под монитором группы.
 *
 * События хранятся в {@link EventArena}; цепочка освобождается один раз через {@link #release()}.
 */
public final class TransactionGroup {

    /** Номер «исполнителя» для групп, которые выполняет сам координатор. */
    public static final int NO_WORKER = -1;

    private final long id;
    private final EventArena arena;
    private final int head;
    private final int eventCount;
    private final List<AccessKey> keys;
    private final boolean keysKnown;
    private final Set<String> databases;
    private final LogPosition sourcePosition;
    private final LogPosition targetPosition;
    private final long timestampMs;
    private final long sizeBytes;
    private final boolean ddl;

    private volatile GroupState state = GroupState.PENDING;
    private volatile int workerId = NO_WORKER;
    private final Set<Long> predecessors = new LinkedHashSet<>(2);
    private final AtomicBoolean released = new AtomicBoolean();

    private boolean sideEffect;
    private boolean abandonRequested;

    private TransactionGroup(long id, Builder b) {
        this.id = id;
        this.arena = b.arena;
        this.head = b.head;
        this.eventCount = b.eventCount;
        this.keys = b.keysKnown
                ? Collections.unmodifiableList(new ArrayList<>(b.keys))
                : Collections.<AccessKey>emptyList();
        this.keysKnown = b.keysKnown;
        this.databases = Collections.unmodifiableSet(new LinkedHashSet<>(b.databases));
        this.sourcePosition = b.sourcePosition;
        this.targetPosition = b.targetPosition;
        this.timestampMs = b.timestampMs;
        this.sizeBytes = b.sizeBytes;
        this.ddl = b.ddl;
    }

    public static Builder builder(EventArena arena) {
        return new Builder(arena);
    }

    public long id() {
        return id;
    }

    /** События группы в порядке источника. */
    public List<ChangeEvent> events() {
        return arena.chain(head);
    }

    public int eventCount() {
        return eventCount;
    }

    /** Ключи в порядке первого обращения, без повторов. Пусто, если ключи неизвестны. */
    public List<AccessKey> keys() {
        return keys;
    }

    public boolean keysKnown() {
        return keysKnown;
    }

    public Set<String> databases() {
        return databases;
    }

    /** Позиция завершающего события в журнале-источнике. */
    public LogPosition sourcePosition() {
        return sourcePosition;
    }

    /** Позиция завершающего события в журнале первичного сервера. */
    public LogPosition targetPosition() {
        return targetPosition;
    }

    /** Метка времени первого события с известным временем; 0, если ни у одного события её нет. */
    public long timestampMs() {
        return timestampMs;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public boolean containsDdl() {
        return ddl;
    }

    public GroupState state() {
        return state;
    }

    public void moveTo(GroupState next) {
        this.state = Objects.requireNonNull(next, "state");
    }

    public int workerId() {
        return workerId;
    }

    public void assignWorker(int worker) {
        this.workerId = worker;
    }

    /** Вызывается резолвером зависимостей под его блокировкой. */
    public void addPredecessor(long groupId) {
        if (groupId >= id) {
            throw new IllegalArgumentException("Предшественник " + groupId + " не меньше группы " + id);
        }
        predecessors.add(groupId);
    }

    /** Живое представление; читать только под блокировкой резолвера. */
    public Set<Long> predecessors() {
        return predecessors;
    }

    /**
     * Исполнитель сообщает, что собирается выполнить нетранзакционный побочный эффект.
     *
     * @return {@code false}, если от группы уже отказались при остановке и эффект выполнять нельзя
     */
    public synchronized boolean markNonTransactionalEffect() {
        if (abandonRequested) {
            return false;
        }
        sideEffect = true;
        return true;
    }

    /** {@code true}, если откат группы оставит реплику в несогласованном состоянии. */
    public synchronized boolean cannotSafelyRollback() {
        return sideEffect;
    }

    /**
     * Пытается отказаться от выполнения группы при остановке.
     *
     * @return {@code true}, если группу можно бросить; {@code false}, если она обязана завершиться
     */
    public synchronized boolean tryAbandon() {
        if (sideEffect) {
            return false;
        }
        abandonRequested = true;
        return true;
    }

    public synchronized boolean isAbandonRequested() {
        return abandonRequested;
    }

    /**
     * Освобождает цепочку событий в арене. Повторные вызовы ничего не делают.
     *
     * @return число освобождённых записей
     */
    public int release() {
        if (!released.compareAndSet(false, true)) {
            return 0;
        }
        return arena.release(head);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public String toString() {
        return "G" + id + '{' + state + ", events=" + eventCount + ", keys="
                + (keysKnown ? String.valueOf(keys.size()) : "?") + ", src=" + sourcePosition + '}';
    }

    /**
     * Накопитель событий текущей группы. Используется координатором между маркером начала
     * и завершающим событием; {@link #build(long)} возвращает полностью готовую группу.
     */
    public static final class Builder {
        private final EventArena arena;
        private int head = EventArena.NIL;
        private int tail = EventArena.NIL;
        private int eventCount;
        private final Set<AccessKey> keys = new LinkedHashSet<>();
        private boolean keysKnown = true;
        private final Set<String> databases = new LinkedHashSet<>(2);
        private LogPosition sourcePosition = LogPosition.NONE;
        private LogPosition targetPosition = LogPosition.NONE;
        private long timestampMs;
        private long sizeBytes;
        private boolean ddl;
        private boolean closed;

        private Builder(EventArena arena) {
            this.arena = Objects.requireNonNull(arena, "arena");
        }

        public Builder add(ChangeEvent event) {
            ensureOpen();
            tail = arena.append(tail, event);
            if (head == EventArena.NIL) {
                head = tail;
            }
            eventCount++;
            sizeBytes += event.sizeBytes();
            if (event.kind() == EventKind.DDL) {
                ddl = true;
            }
            if (event.keysKnown()) {
                keys.addAll(event.keys());
            } else {
                keysKnown = false;
            }
            databases.addAll(event.databases());
            if (!event.sourcePosition().isNone()) {
                sourcePosition = event.sourcePosition();
            }
            if (!event.targetPosition().isNone()) {
                targetPosition = event.targetPosition();
            }
            if (timestampMs == 0L) {
                timestampMs = event.timestampMs();
            }
            return this;
        }

        public int eventCount() {
            return eventCount;
        }

        public boolean isEmpty() {
            return eventCount == 0;
        }

        /**
         * Выбрасывает недособранную группу и освобождает её цепочку.
         *
         * @return число освобождённых записей
         */
        public int discard() {
            ensureOpen();
            closed = true;
            return arena.release(head);
        }

        public TransactionGroup build(long id) {
            ensureOpen();
            closed = true;
            return new TransactionGroup(id, this);
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Группа уже собрана или выброшена");
            }
        }
    }
}
