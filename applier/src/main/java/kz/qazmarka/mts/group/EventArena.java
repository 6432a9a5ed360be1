package kz.qazmarka.mts.group;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import kz.qazmarka.mts.event.ChangeEvent;

/**
 * Арена записей событий, связанных в цепочки по индексу.
 *
 * Группа хранит только индекс головы своей цепочки; записи выделяются из общих массивов
 * и возвращаются в список свободных при {@link #release(int)}. Освобождение цепочки:
 * итеративный проход по индексам, поэтому длина транзакции не ограничена глубиной стека.
 *
 * Потокобезопасность: все методы синхронизированы на экземпляре; координатор дописывает
 * цепочки, исполнители читают их, освобождение выполняет трекер контрольных точек.
 */
public final class EventArena {
    /** Признак отсутствия следующей записи. */
    public static final int NIL = -1;

    private static final int DEFAULT_CAPACITY = 1024;

    private ChangeEvent[] events;
    private int[] next;
    private int freeHead = NIL;
    /** Граница ни разу не выданных записей. */
    private int watermark;
    private int live;

    public EventArena() {
        this(DEFAULT_CAPACITY);
    }

    public EventArena(int initialCapacity) {
        int cap = Math.max(16, initialCapacity);
        this.events = new ChangeEvent[cap];
        this.next = new int[cap];
    }

    /**
     * Добавляет событие в конец цепочки.
     *
     * @param tail индекс текущего хвоста или {@link #NIL} для новой цепочки
     * @param event событие
     * @return индекс новой записи (новый хвост)
     */
    public synchronized int append(int tail, ChangeEvent event) {
        int idx = allocate();
        events[idx] = event;
        next[idx] = NIL;
        if (tail != NIL) {
            next[tail] = idx;
        }
        live++;
        return idx;
    }

    /**
     * Возвращает события цепочки в порядке добавления.
     */
    public synchronized List<ChangeEvent> chain(int head) {
        if (head == NIL) {
            return Collections.emptyList();
        }
        List<ChangeEvent> out = new ArrayList<>();
        for (int i = head; i != NIL; i = next[i]) {
            out.add(events[i]);
        }
        return out;
    }

    /**
     * Освобождает всю цепочку, начиная с {@code head}.
     *
     * @return число освобождённых записей
     */
    public synchronized int release(int head) {
        int released = 0;
        int i = head;
        while (i != NIL) {
            int following = next[i];
            events[i] = null;
            next[i] = freeHead;
            freeHead = i;
            i = following;
            released++;
        }
        live -= released;
        return released;
    }

    /** Число занятых записей. */
    public synchronized int liveRecords() {
        return live;
    }

    private int allocate() {
        if (freeHead != NIL) {
            int idx = freeHead;
            freeHead = next[idx];
            return idx;
        }
        if (watermark == events.length) {
            int cap = events.length << 1;
            events = Arrays.copyOf(events, cap);
            next = Arrays.copyOf(next, cap);
        }
        return watermark++;
    }
}
