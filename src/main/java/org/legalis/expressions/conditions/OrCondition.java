package org.legalis.expressions.conditions;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * 析取。
 */
@Getter
public final class OrCondition extends Condition {

    private final Condition left;
    private final Condition right;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    private OrCondition(Condition left, Condition right) {
        super(ConditionKind.OR);
        this.left = Objects.requireNonNull(left, "OR left operand cannot be null.");
        this.right = Objects.requireNonNull(right, "OR right operand cannot be null.");
        this.hashCode = Objects.hash(ConditionKind.OR, left, right);
    }

    public static OrCondition of(Condition left, Condition right) {
        return new OrCondition(left, right);
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
        if (!(o instanceof OrCondition)) {
            return false;
        }
        OrCondition that = (OrCondition) o;
        return hashCode == that.hashCode && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
