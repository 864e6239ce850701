package org.legalis.expressions.conditions;

import org.legalis.core.ComparisonOp;

/**
 * 收入比较，例如 income < 30000。
 */
public final class IncomeCondition extends NumericComparisonCondition {

    public static final String VARIABLE = "income";

    private IncomeCondition(ComparisonOp operator, long value) {
        super(ConditionKind.INCOME, operator, value);
    }

    public static IncomeCondition of(ComparisonOp operator, long value) {
        return new IncomeCondition(operator, value);
    }

    @Override
    public String getVariableName() {
        return VARIABLE;
    }

    @Override
    public String toString() {
        return "income " + getOperator().getSymbol() + " " + getValue();
    }
}
