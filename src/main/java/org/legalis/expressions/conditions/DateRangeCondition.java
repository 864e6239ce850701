package org.legalis.expressions.conditions;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * 日期区间条件，两端均为闭区间且可省略。
 * 两端都省略时条件恒真。
 */
public final class DateRangeCondition extends Condition {

    public static final String VARIABLE = "date";

    private final LocalDate start;
    private final LocalDate end;

    private DateRangeCondition(LocalDate start, LocalDate end) {
        super(ConditionKind.DATE_RANGE);
        this.start = start;
        this.end = end;
    }

    /**
     * @param start 起始日期，可为 null。
     * @param end 结束日期，可为 null。
     */
    public static DateRangeCondition of(LocalDate start, LocalDate end) {
        return new DateRangeCondition(start, end);
    }

    public static DateRangeCondition from(LocalDate start) {
        return new DateRangeCondition(Objects.requireNonNull(start, "Start date cannot be null."), null);
    }

    public static DateRangeCondition until(LocalDate end) {
        return new DateRangeCondition(null, Objects.requireNonNull(end, "End date cannot be null."));
    }

    public Optional<LocalDate> getStart() {
        return Optional.ofNullable(start);
    }

    public Optional<LocalDate> getEnd() {
        return Optional.ofNullable(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DateRangeCondition)) {
            return false;
        }
        DateRangeCondition that = (DateRangeCondition) o;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.DATE_RANGE, start, end);
    }

    @Override
    public String toString() {
        if (start != null && end != null) {
            return "date in [" + start + ", " + end + "]";
        }
        if (start != null) {
            return "date >= " + start;
        }
        if (end != null) {
            return "date <= " + end;
        }
        return "date (any)";
    }
}
