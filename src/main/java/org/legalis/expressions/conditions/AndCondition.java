package org.legalis.expressions.conditions;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * 合取。
 */
@Getter
public final class AndCondition extends Condition {

    private final Condition left;
    private final Condition right;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    private AndCondition(Condition left, Condition right) {
        super(ConditionKind.AND);
        this.left = Objects.requireNonNull(left, "AND left operand cannot be null.");
        this.right = Objects.requireNonNull(right, "AND right operand cannot be null.");
        this.hashCode = Objects.hash(ConditionKind.AND, left, right);
    }

    public static AndCondition of(Condition left, Condition right) {
        return new AndCondition(left, right);
    }

    @Override
    public int size() {
        return 1 + left.size() + right.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AndCondition)) {
            return false;
        }
        AndCondition that = (AndCondition) o;
        return hashCode == that.hashCode && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
