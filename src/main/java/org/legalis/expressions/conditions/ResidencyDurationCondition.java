package org.legalis.expressions.conditions;

import org.legalis.core.ComparisonOp;

/**
 * 居住期限（月）比较。
 */
public final class ResidencyDurationCondition extends NumericComparisonCondition {

    public static final String VARIABLE = "residency_months";

    private ResidencyDurationCondition(ComparisonOp operator, int months) {
        super(ConditionKind.RESIDENCY_DURATION, operator, months);
    }

    public static ResidencyDurationCondition of(ComparisonOp operator, int months) {
        return new ResidencyDurationCondition(operator, months);
    }

    public long getMonths() {
        return getValue();
    }

    @Override
    public String getVariableName() {
        return VARIABLE;
    }

    @Override
    public String toString() {
        return "residency " + getOperator().getSymbol() + " " + getValue() + " months";
    }
}
