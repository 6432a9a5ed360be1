package kz.qazmarka.mts.checkpoint;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Хранилище позиции в памяти процесса: переживает перезапуск применителя, но не процесса.
 */
public final class InMemoryPositionStore implements PositionStore {

    private final AtomicReference<DurableState> state;
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong forcedFlushes = new AtomicLong();

    public InMemoryPositionStore() {
        this(DurableState.EMPTY);
    }

    public InMemoryPositionStore(DurableState initial) {
        this.state = new AtomicReference<>(initial);
    }

    @Override
    public void flush(DurableState s, boolean force) {
        state.set(s);
        flushes.incrementAndGet();
        if (force) {
            forcedFlushes.incrementAndGet();
        }
    }

    @Override
    public DurableState load() {
        return state.get();
    }

    public long flushes() {
        return flushes.get();
    }

    public long forcedFlushes() {
        return forcedFlushes.get();
    }
}
