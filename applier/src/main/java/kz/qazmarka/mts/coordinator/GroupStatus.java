package kz.qazmarka.mts.coordinator;

/**
 * Состояние координатора относительно текущей группы.
 *
 * NOT_IN_GROUP → IN_GROUP (маркер начала или первое событие с ключами) → END_GROUP
 * (завершающее событие) → NOT_IN_GROUP (после синхронизации с исполнителями).
 * Принудительная остановка до END_GROUP переводит в KILLED_GROUP: группа будет
 * воспроизведена после перезапуска.
 */
public enum GroupStatus {
    NOT_IN_GROUP,
    IN_GROUP,
    END_GROUP,
    KILLED_GROUP
}
