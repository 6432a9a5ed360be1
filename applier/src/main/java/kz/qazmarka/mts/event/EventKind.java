package kz.qazmarka.mts.event;

/**
 * Тип события репликационного потока с точки зрения разбиения на группы.
 */
public enum EventKind {
    /** Маркер начала транзакции. */
    BEGIN,
    /** Изменение строк; ключи доступа известны источнику. */
    ROWS,
    /** Оператор; вне транзакции образует самостоятельную autocommit‑группу. */
    QUERY,
    /** Фиксация транзакции. */
    COMMIT,
    /** Откат транзакции. */
    ROLLBACK,
    /** DDL: всегда завершает группу и выполняется изолированно. */
    DDL;

    public boolean isBegin() {
        return this == BEGIN;
    }

    public boolean isTerminal() {
        return this == COMMIT || this == ROLLBACK || this == DDL;
    }
}
