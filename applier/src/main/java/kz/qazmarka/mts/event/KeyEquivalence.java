package kz.qazmarka.mts.event;

import java.util.Arrays;
import java.util.Objects;

/**
 * Внешне заданное равенство ключей доступа. Передаётся в резолвер зависимостей,
 * чтобы, например, сравнивать ключи без учёта регистра или по префиксу партиции.
 * Реализация обязана быть согласованной: {@code same(a, b)} влечёт {@code hash(a) == hash(b)}.
 */
public interface KeyEquivalence {

    boolean same(AccessKey a, AccessKey b);

    int hash(AccessKey key);

    /** Естественное равенство значений; массивы байт сравниваются по содержимому. */
    KeyEquivalence NATURAL = new KeyEquivalence() {
        @Override
        public boolean same(AccessKey a, AccessKey b) {
            Object x = a.value();
            Object y = b.value();
            if (x instanceof byte[] && y instanceof byte[]) {
                return Arrays.equals((byte[]) x, (byte[]) y);
            }
            return Objects.equals(x, y);
        }

        @Override
        public int hash(AccessKey key) {
            Object v = key.value();
            return (v instanceof byte[]) ? Arrays.hashCode((byte[]) v) : v.hashCode();
        }
    };
}
