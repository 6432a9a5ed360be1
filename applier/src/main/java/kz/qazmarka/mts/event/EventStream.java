package kz.qazmarka.mts.event;

import java.io.Closeable;
import java.io.IOException;

/**
 * Ленивая упорядоченная последовательность событий.
 */
public interface EventStream extends Closeable {

    /**
     * Возвращает следующее событие, при необходимости ожидая его появления.
     *
     * @return событие либо {@code null}, если поток исчерпан
     * @throws IOException          ошибка чтения журнала
     * @throws InterruptedException ожидание прервано
     */
    ChangeEvent next() throws IOException, InterruptedException;
}
