package kz.qazmarka.mts.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Неизменяемое событие репликационного потока.
 *
 * Помимо типа, несёт позиции (в журнале-источнике и в журнале первичного сервера),
 * метку времени на первичном сервере, размер для учёта памяти, затронутые базы и ключи доступа. {@link #keysKnown()} равен
 * {@code false}, если источник не смог определить ключи: такая группа выполняется изолированно.
 * Полезная нагрузка непрозрачна для планировщика и предназначена исполнителю.
 */
public final class ChangeEvent {
    private final EventKind kind;
    private final List<AccessKey> keys;
    private final boolean keysKnown;
    private final Set<String> databases;
    private final LogPosition sourcePosition;
    private final LogPosition targetPosition;
    private final long timestampMs;
    private final int sizeBytes;
    private final boolean nonTransactional;
    private final Object payload;

    private ChangeEvent(Builder b) {
        this.kind = b.kind;
        this.keysKnown = b.keysKnown;
        this.keys = b.keysKnown
                ? Collections.unmodifiableList(new ArrayList<>(b.keys))
                : Collections.<AccessKey>emptyList();
        this.databases = Collections.unmodifiableSet(new LinkedHashSet<>(b.databases));
        this.sourcePosition = b.sourcePosition;
        this.targetPosition = b.targetPosition;
        this.timestampMs = b.timestampMs;
        this.sizeBytes = b.sizeBytes;
        this.nonTransactional = b.nonTransactional;
        this.payload = b.payload;
    }

    public static Builder builder(EventKind kind) {
        return new Builder(kind);
    }

    public EventKind kind() {
        return kind;
    }

    public List<AccessKey> keys() {
        return keys;
    }

    public boolean keysKnown() {
        return keysKnown;
    }

    public Set<String> databases() {
        return databases;
    }

    public LogPosition sourcePosition() {
        return sourcePosition;
    }

    public LogPosition targetPosition() {
        return targetPosition;
    }

    /** Время события на первичном сервере (мс от эпохи); 0, если неизвестно. */
    public long timestampMs() {
        return timestampMs;
    }

    public int sizeBytes() {
        return sizeBytes;
    }

    /** Событие имеет побочный эффект, который нельзя откатить (например, запись в нетранзакционную таблицу). */
    public boolean isNonTransactional() {
        return nonTransactional;
    }

    public Object payload() {
        return payload;
    }

    @Override
    public String toString() {
        return "ChangeEvent{" + kind + ", src=" + sourcePosition + ", keys="
                + (keysKnown ? String.valueOf(keys.size()) : "?") + '}';
    }

    /**
     * Билдер события. DDL по умолчанию считается событием с неизвестными ключами.
     */
    public static final class Builder {
        private final EventKind kind;
        private final List<AccessKey> keys = new ArrayList<>(4);
        private boolean keysKnown;
        private final Set<String> databases = new LinkedHashSet<>(2);
        private LogPosition sourcePosition = LogPosition.NONE;
        private LogPosition targetPosition = LogPosition.NONE;
        private long timestampMs;
        private int sizeBytes;
        private boolean nonTransactional;
        private Object payload;

        private Builder(EventKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.keysKnown = kind != EventKind.DDL;
        }

        public Builder key(Object value) {
            keys.add(AccessKey.of(value));
            return this;
        }

        public Builder keys(List<AccessKey> values) {
            keys.addAll(values);
            return this;
        }

        /** Помечает ключи события как неизвестные. */
        public Builder unknownKeys() {
            keysKnown = false;
            return this;
        }

        public Builder database(String name) {
            if (name != null && !name.isEmpty()) {
                databases.add(name);
            }
            return this;
        }

        public Builder source(LogPosition position) {
            sourcePosition = Objects.requireNonNull(position, "position");
            return this;
        }

        public Builder target(LogPosition position) {
            targetPosition = Objects.requireNonNull(position, "position");
            return this;
        }

        public Builder timestamp(long epochMillis) {
            timestampMs = Math.max(0L, epochMillis);
            return this;
        }

        public Builder size(int bytes) {
            sizeBytes = Math.max(0, bytes);
            return this;
        }

        public Builder nonTransactional() {
            nonTransactional = true;
            return this;
        }

        public Builder payload(Object value) {
            payload = value;
            return this;
        }

        public ChangeEvent build() {
            return new ChangeEvent(this);
        }
    }
}
