package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 属性值属于（或不属于）给定集合。空集合的肯定形式恒假。
 */
@Getter
public final class SetMembershipCondition extends Condition {

    private final String attribute;
    private final List<String> values;
    private final boolean negated;

    private SetMembershipCondition(String attribute, List<String> values, boolean negated) {
        super(ConditionKind.SET_MEMBERSHIP);
        this.attribute = Validate.notBlank(attribute, "Set membership attribute cannot be blank");
        Objects.requireNonNull(values, "Set membership values cannot be null.");
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(Objects.requireNonNull(value, "Set membership value cannot be null."));
        }
        this.values = Collections.unmodifiableList(copy);
        this.negated = negated;
    }

    public static SetMembershipCondition in(String attribute, List<String> values) {
        return new SetMembershipCondition(attribute, values, false);
    }

    public static SetMembershipCondition notIn(String attribute, List<String> values) {
        return new SetMembershipCondition(attribute, values, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SetMembershipCondition)) {
            return false;
        }
        SetMembershipCondition that = (SetMembershipCondition) o;
        return negated == that.negated && attribute.equals(that.attribute) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.SET_MEMBERSHIP, attribute, values, negated);
    }

    @Override
    public String toString() {
        return attribute + (negated ? " not in " : " in ") + "{" + String.join(", ", values) + "}";
    }
}
