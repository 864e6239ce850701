package org.legalis.expressions.conditions;

import lombok.Getter;
import org.legalis.core.ComparisonOp;

import java.util.Objects;

/**
 * 形如 var ~ value 的整数比较条件的公共基类。
 * 子类决定比较的是哪个求解器变量，以及数值如何归一化。
 */
@Getter
public abstract class NumericComparisonCondition extends Condition {

    private final ComparisonOp operator;
    private final long value;

    NumericComparisonCondition(ConditionKind kind, ComparisonOp operator, long value) {
        super(kind);
        this.operator = Objects.requireNonNull(operator, "Comparison operator cannot be null.");
        if (value < 0) {
            throw new IllegalArgumentException(kind + " value must be non-negative, got " + value);
        }
        this.value = value;
    }

    /**
     * 该条件约束的求解器整数变量名。
     */
    public abstract String getVariableName();

    /**
     * 归一化后与变量比较的常数，默认即原始值。
     */
    public long getNormalizedValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NumericComparisonCondition that = (NumericComparisonCondition) o;
        return value == that.value
                && operator == that.operator
                && getVariableName().equals(that.getVariableName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), getVariableName(), operator, value);
    }
}
