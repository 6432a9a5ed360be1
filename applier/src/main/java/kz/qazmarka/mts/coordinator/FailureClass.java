package kz.qazmarka.mts.coordinator;

/**
 * Класс ошибки, с которым останавливается конвейер применения.
 */
public enum FailureClass {
    /** Транзиентная ошибка, исчерпавшая лимит повторов. */
    TRANSIENT,
    /** Фатальная ошибка применения. */
    FATAL,
    /** Нарушение зависимостей: извлечение ключей доступа неполно. */
    DEPENDENCY_VIOLATION,
    /** Контрольная точка и карта завершённых групп несовместимы; нужно вмешательство оператора. */
    RECOVERY_GAP
}
