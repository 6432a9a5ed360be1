package kz.qazmarka.mts.event;

/**
 * Непрозрачный идентификатор единицы изменяемого состояния (строка, партиция таблицы).
 *
 * Сам ключ лишь переносит значение, которое извлёк источник событий. Для планировщика
 * равенство и хеш задаются отдельно через {@link KeyEquivalence}; собственные
 * {@code equals/hashCode} используют естественное равенство значения.
 */
public final class AccessKey {
    private final Object value;

    private AccessKey(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Значение ключа доступа не может быть null");
        }
        this.value = value;
    }

    public static AccessKey of(Object value) {
        return new AccessKey(value);
    }

    public Object value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessKey)) return false;
        return KeyEquivalence.NATURAL.same(this, (AccessKey) o);
    }

    @Override
    public int hashCode() {
        return KeyEquivalence.NATURAL.hash(this);
    }

    @Override
    public String toString() {
        return "key(" + value + ')';
    }
}
