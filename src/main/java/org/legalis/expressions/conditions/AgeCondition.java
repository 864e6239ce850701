package org.legalis.expressions.conditions;

import org.legalis.core.ComparisonOp;

/**
 * 年龄比较，例如 age >= 18。
 */
public final class AgeCondition extends NumericComparisonCondition {

    public static final String VARIABLE = "age";

    private AgeCondition(ComparisonOp operator, int value) {
        super(ConditionKind.AGE, operator, value);
    }

    public static AgeCondition of(ComparisonOp operator, int value) {
        return new AgeCondition(operator, value);
    }

    @Override
    public String getVariableName() {
        return VARIABLE;
    }

    @Override
    public String toString() {
        return "age " + getOperator().getSymbol() + " " + getValue();
    }
}
