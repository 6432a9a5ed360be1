package kz.qazmarka.mts.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import kz.qazmarka.mts.event.ChangeEvent;
import kz.qazmarka.mts.event.EventSource;
import kz.qazmarka.mts.event.EventStream;
import kz.qazmarka.mts.event.LogPosition;

/**
 * Источник событий из списка. Поток отдаёт события строго после позиции открытия.
 * В режиме {@link #keepOpen()} по исчерпании списка поток ждёт прерывания, как «живой» журнал.
 */
public final class TestEventSource implements EventSource {

    private final List<ChangeEvent> events;
    private final List<LogPosition> opens = new CopyOnWriteArrayList<>();
    private final CountDownLatch exhausted = new CountDownLatch(1);
    private volatile boolean keepOpen;

    public TestEventSource(List<ChangeEvent> events) {
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public TestEventSource keepOpen() {
        this.keepOpen = true;
        return this;
    }

    /** Позиции, с которых открывались потоки. */
    public List<LogPosition> opens() {
        return opens;
    }

    /** Срабатывает, когда поток отдал последнее событие списка. */
    public CountDownLatch exhausted() {
        return exhausted;
    }

    @Override
    public EventStream open(LogPosition after) {
        opens.add(after);
        final List<ChangeEvent> tail = new ArrayList<>();
        for (ChangeEvent e : events) {
            if (after.isNone() || e.sourcePosition().compareTo(after) > 0) {
                tail.add(e);
            }
        }
        return new EventStream() {
            private int index;

            @Override
            public ChangeEvent next() throws InterruptedException {
                if (index < tail.size()) {
                    return tail.get(index++);
                }
                exhausted.countDown();
                if (keepOpen) {
                    new CountDownLatch(1).await();
                }
                return null;
            }

            @Override
            public void close() {
                // нечего освобождать
            }
        };
    }
}
