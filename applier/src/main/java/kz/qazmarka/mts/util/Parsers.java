package kz.qazmarka.mts.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;

/**
 * Набор утилит для чтения и нормализации конфигурации {@code mts.*}.
 *
 * Класс не хранит состояния, все методы статические и thread‑safe.
 */
public final class Parsers {

    /**
     * Значения, которые трактуем как {@code true} при разборе конфигурации.
     */
    private static final Set<String> TRUE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "true", "1", "yes", "on"
    )));
    /**
     * Значения, которые трактуем как {@code false} при разборе конфигурации.
     */
    private static final Set<String> FALSE_TOKENS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "false", "0", "no", "off"
    )));

    private Parsers() {}

    /**
     * Считывает {@code int} из {@link Configuration} с дефолтом и нижней границей.
     *
     * @param cfg     конфигурация Hadoop
     * @param key     ключ
     * @param defVal  значение по умолчанию
     * @param minVal  минимально допустимое значение (включительно)
     * @return значение из конфигурации, но не меньше {@code minVal}
     */
    public static int readIntMin(Configuration cfg, String key, int defVal, int minVal) {
        int v = readInt(cfg, key, defVal);
        if (v < minVal) return minVal;
        return v;
    }

    /**
     * Считывает {@code int} и зажимает его в диапазон {@code [minVal, maxVal]}.
     */
    public static int readIntRange(Configuration cfg, String key, int defVal, int minVal, int maxVal) {
        int v = readInt(cfg, key, defVal);
        if (v < minVal) return minVal;
        if (v > maxVal) return maxVal;
        return v;
    }

    private static int readInt(Configuration cfg, String key, int defVal) {
        String v = cfg.getTrimmed(key);
        if (v == null || v.isEmpty()) return defVal;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException nfe) {
            return defVal;
        }
    }

    /**
     * Считывает {@code long} из {@link Configuration} с мягкой деградацией.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defVal значение по умолчанию при {@code null}/некорректном вводе
     * @return валидное {@code long} значение либо {@code defVal}
     */
    public static long readLong(Configuration cfg, String key, long defVal) {
        String v = cfg.get(key);
        if (v == null) return defVal;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException nfe) {
            return defVal;
        }
    }

    /**
     * Считывает {@code long} с нижней границей.
     */
    public static long readLongMin(Configuration cfg, String key, long defVal, long minVal) {
        long v = readLong(cfg, key, defVal);
        return (v < minVal) ? minVal : v;
    }

    /**
     * Читает булево значение из {@link Configuration}, поддерживая распространённые алиасы.
     * Принимаются {@code true/false/1/0/yes/no/on/off} в любом регистре.
     *
     * @param cfg    конфигурация Hadoop
     * @param key    ключ
     * @param defVal значение по умолчанию, если ключ отсутствует или формат не распознан
     * @return boolean значение, либо {@code defVal}, если распознать не удалось
     */
    public static boolean readBoolean(Configuration cfg, String key, boolean defVal) {
        String raw = cfg.getTrimmed(key);
        if (raw == null) {
            return defVal;
        }
        return parseBoolean(raw, defVal);
    }

    private static boolean parseBoolean(String value, boolean defVal) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(normalized)) {
            return true;
        }
        if (FALSE_TOKENS.contains(normalized)) {
            return false;
        }
        return defVal;
    }

    /**
     * Универсальное чтение перечисления (enum) из {@link Configuration} по ключу.
     * Сопоставление выполняется без учёта регистра; дефисы приравниваются к подчёркиваниям,
     * поэтому {@code same-worker} распознаётся как {@code SAME_WORKER}.
     *
     * @param cfg      конфигурация Hadoop
     * @param key      ключ конфигурации
     * @param enumType класс перечисления
     * @param defVal   значение по умолчанию
     * @param <E>      тип перечисления
     * @return распознанное значение либо {@code defVal}, если ключ отсутствует или значение не распознано
     */
    public static <E extends Enum<E>> E readEnum(Configuration cfg, String key, Class<E> enumType, E defVal) {
        String v = cfg.getTrimmed(key);
        if (v == null || v.isEmpty()) return defVal;
        String normalized = v.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(enumType, normalized);
        } catch (IllegalArgumentException ex) {
            return defVal;
        }
    }
}
