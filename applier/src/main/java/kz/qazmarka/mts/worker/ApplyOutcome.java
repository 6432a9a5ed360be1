package kz.qazmarka.mts.worker;

/**
 * Результат применения группы.
 */
public enum ApplyOutcome {
    SUCCESS,
    /** Транзиентная ошибка: группу можно применить повторно. */
    RETRYABLE,
    /** Фатальная ошибка: конвейер останавливается. */
    FATAL
}
