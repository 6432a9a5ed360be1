package kz.qazmarka.mts.recovery;

/**
 * Сохранённое состояние несогласовано и разрыв нельзя восстановить автоматически.
 * Требуется ручное вмешательство.
 */
public final class RecoveryGapException extends Exception {
    private static final long serialVersionUID = 1L;

    public RecoveryGapException(String message) {
        super(message);
    }
}
