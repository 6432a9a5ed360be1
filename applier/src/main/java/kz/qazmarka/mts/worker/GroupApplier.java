package kz.qazmarka.mts.worker;

import kz.qazmarka.mts.group.TransactionGroup;

/**
 * Внешний исполнитель операторов/строк. Вызывается из любого потока-исполнителя,
 * поэтому реализация обязана быть потокобезопасной.
 *
 * Жизненный цикл одной попытки: {@link #apply} → {@link #commit} либо {@link #rollback}.
 * Перед нетранзакционным побочным эффектом реализация вызывает
 * {@link TransactionGroup#markNonTransactionalEffect()}; если тот вернул {@code false}, от группы
 * отказались при остановке, и реализация бросает {@link InterruptedException}.
 * Признаки переупорядочивания (например, отсутствующая строка) сообщаются через
 * {@link DependencyViolationException}.
 */
public interface GroupApplier {

    /**
     * Выполняет события группы, не фиксируя их.
     *
     * @throws InterruptedException если поток прерван (группа будет откатана и брошена)
     */
    ApplyOutcome apply(TransactionGroup group) throws InterruptedException;

    /**
     * Фиксирует ранее применённую группу. Вызывается в порядке источника, если
     * упорядочивание фиксаций включено.
     */
    default void commit(TransactionGroup group) {
        // нет отдельной фазы фиксации
    }

    /** Откатывает незафиксированную попытку. */
    default void rollback(TransactionGroup group) {
        // нечего откатывать
    }
}
