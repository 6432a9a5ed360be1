package kz.qazmarka.mts.config;

/**
 * Параметры пула исполнителей: число исполнителей, ёмкость их локальных очередей,
 * упорядочивание фиксаций, остановка после закрытия разрыва восстановления и отложенное применение.
 */
public final class SchedulingSettings {
    private final int workers;
    private final int workerQueueCapacity;
    private final boolean commitOrder;
    private final boolean untilAfterGaps;
    private final long sqlDelayMs;

    public SchedulingSettings(int workers,
                              int workerQueueCapacity,
                              boolean commitOrder,
                              boolean untilAfterGaps,
                              long sqlDelayMs) {
        this.workers = workers;
        this.workerQueueCapacity = workerQueueCapacity;
        this.commitOrder = commitOrder;
        this.untilAfterGaps = untilAfterGaps;
        this.sqlDelayMs = sqlDelayMs;
    }

    /** При 0 параллельное применение выключено, каждая группа выполняется изолированно. */
    public int getWorkers() {
        return workers;
    }

    public int getWorkerQueueCapacity() {
        return workerQueueCapacity;
    }

    public boolean isCommitOrder() {
        return commitOrder;
    }

    public boolean isUntilAfterGaps() {
        return untilAfterGaps;
    }

    /**
     * Отставание реплики: группа назначается не раньше, чем через столько миллисекунд
     * после её метки времени на первичном сервере. 0: без задержки.
     */
    public long getSqlDelayMs() {
        return sqlDelayMs;
    }

    public boolean isParallel() {
        return workers > 0;
    }
}
