package kz.qazmarka.mts.group;

/**
 * Жизненный цикл группы транзакций.
 */
public enum GroupState {
    PENDING,
    ASSIGNED,
    APPLYING,
    APPLIED,
    COMMITTED,
    FAILED;

    public boolean isFinal() {
        return this == COMMITTED || this == FAILED;
    }
}
