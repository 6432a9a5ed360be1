package kz.qazmarka.mts.checkpoint;

import java.io.IOException;

/**
 * Внешнее хранилище позиции применения. Формат и долговечность: ответственность реализации.
 */
public interface PositionStore {

    /**
     * Сохраняет состояние.
     *
     * @param state состояние для записи
     * @param force требование немедленной долговечной записи (например, fsync)
     * @throws IOException ошибка записи
     */
    void flush(DurableState state, boolean force) throws IOException;

    /**
     * @return последнее сохранённое состояние либо {@link DurableState#EMPTY}
     * @throws IOException ошибка чтения
     */
    DurableState load() throws IOException;
}
