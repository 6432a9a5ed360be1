package kz.qazmarka.mts.config;

/**
 * Политика планирования групп, конфликтующих по ключам с группой в работе.
 */
public enum ConflictPolicy {
    /** Назначать на исполнителя последнего писателя ключа (FIFO исполнителя упорядочивает группы). */
    SAME_WORKER,
    /** Назначать на любого исполнителя; перед применением дождаться фиксации писателя. */
    AFTER_COMPLETION
}
