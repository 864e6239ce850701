package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;
import org.legalis.core.ComparisonOp;

import java.util.Objects;

/**
 * 某个上下文中的百分比比较，例如 percentage(ownership) >= 25。
 */
@Getter
public final class PercentageCondition extends NumericComparisonCondition {

    private final String context;

    private PercentageCondition(ComparisonOp operator, int value, String context) {
        super(ConditionKind.PERCENTAGE, operator, value);
        this.context = Validate.notBlank(context, "Percentage context cannot be blank");
    }

    public static PercentageCondition of(ComparisonOp operator, int value, String context) {
        return new PercentageCondition(operator, value, context);
    }

    @Override
    public String getVariableName() {
        return "percentage_" + context;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return context.equals(((PercentageCondition) o).context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), context);
    }

    @Override
    public String toString() {
        return "percentage(" + context + ") " + getOperator().getSymbol() + " " + getValue();
    }
}
