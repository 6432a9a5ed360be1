package kz.qazmarka.mts.recovery;

/** Решение планировщика восстановления для очередной группы потока. */
public enum RecoveryAction {
    /** Группа из разрыва, не отмеченная завершённой: воспроизвести изолированно. */
    REPLAY,
    /** Группа из разрыва, уже применённая до сбоя: пропустить. */
    SKIP,
    /** Группа за разрывом: обычное планирование. */
    SCHEDULE
}
