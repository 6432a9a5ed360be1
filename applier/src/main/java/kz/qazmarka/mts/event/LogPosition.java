package kz.qazmarka.mts.event;

import java.util.Objects;

/**
 * Координаты в журнале: имя файла журнала и смещение внутри него.
 * Сравнение лексикографическое по имени, затем по смещению; имена журналов
 * предполагаются одинаковой ширины ({@code relay.000012}).
 */
public final class LogPosition implements Comparable<LogPosition> {

    /** Позиция «до начала журнала». */
    public static final LogPosition NONE = new LogPosition("", 0L);

    private final String logName;
    private final long offset;

    public LogPosition(String logName, long offset) {
        this.logName = Objects.requireNonNull(logName, "logName");
        if (offset < 0L) {
            throw new IllegalArgumentException("Смещение не может быть отрицательным: " + offset);
        }
        this.offset = offset;
    }

    public static LogPosition of(String logName, long offset) {
        return new LogPosition(logName, offset);
    }

    public String logName() {
        return logName;
    }

    public long offset() {
        return offset;
    }

    public boolean isNone() {
        return logName.isEmpty() && offset == 0L;
    }

    /** @return {@code true}, если текущая позиция не раньше {@code other} */
    public boolean reached(LogPosition other) {
        return compareTo(other) >= 0;
    }

    /** Возвращает большую из двух позиций; {@code null} трактуется как {@link #NONE}. */
    public static LogPosition max(LogPosition a, LogPosition b) {
        if (a == null) return (b == null) ? NONE : b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(LogPosition o) {
        int c = logName.compareTo(o.logName);
        return (c != 0) ? c : Long.compare(offset, o.offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogPosition)) return false;
        LogPosition that = (LogPosition) o;
        return offset == that.offset && logName.equals(that.logName);
    }

    @Override
    public int hashCode() {
        return 31 * logName.hashCode() + Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return logName + ':' + offset;
    }
}
