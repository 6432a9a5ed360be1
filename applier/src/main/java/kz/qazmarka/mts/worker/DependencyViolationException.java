package kz.qazmarka.mts.worker;

/**
 * Исполнитель обнаружил симптом переупорядочивания: конфликт между группами, который
 * не был виден по ключам доступа. Группа откатывается и повторяется последовательно.
 */
public class DependencyViolationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public DependencyViolationException(String message) {
        super(message);
    }

    public DependencyViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
