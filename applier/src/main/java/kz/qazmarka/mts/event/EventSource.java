package kz.qazmarka.mts.event;

import java.io.IOException;

/**
 * Внешний поставщик событий. Поток можно переоткрыть с позиции контрольной точки:
 * {@link #open(LogPosition)} возвращает события строго после указанной позиции источника.
 */
public interface EventSource {

    EventStream open(LogPosition after) throws IOException;
}
