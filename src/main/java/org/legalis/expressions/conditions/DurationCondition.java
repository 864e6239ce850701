package org.legalis.expressions.conditions;

import lombok.Getter;
import org.legalis.core.ComparisonOp;
import org.legalis.core.DurationUnit;

import java.util.Locale;
import java.util.Objects;

/**
 * 带单位的期间比较，例如 duration >= 2 YEARS。
 * 天/周比较 duration_days，月/年比较 duration_months，两者之间不换算。
 */
@Getter
public final class DurationCondition extends NumericComparisonCondition {

    public static final String DAYS_VARIABLE = "duration_days";
    public static final String MONTHS_VARIABLE = "duration_months";

    private final DurationUnit unit;
    private final long normalizedValue;

    private DurationCondition(ComparisonOp operator, long value, DurationUnit unit) {
        super(ConditionKind.DURATION, operator, value);
        this.unit = Objects.requireNonNull(unit, "Duration unit cannot be null.");
        try {
            this.normalizedValue = unit.toBaseUnit(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration " + value + " " + unit + " overflows the base unit", e);
        }
    }

    public static DurationCondition of(ComparisonOp operator, long value, DurationUnit unit) {
        return new DurationCondition(operator, value, unit);
    }

    @Override
    public String getVariableName() {
        return unit.isMonthBased() ? MONTHS_VARIABLE : DAYS_VARIABLE;
    }

    @Override
    public long getNormalizedValue() {
        return normalizedValue;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return unit == ((DurationCondition) o).unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), unit);
    }

    @Override
    public String toString() {
        return "duration " + getOperator().getSymbol() + " " + getValue() + " "
                + unit.name().toLowerCase(Locale.ROOT);
    }
}
