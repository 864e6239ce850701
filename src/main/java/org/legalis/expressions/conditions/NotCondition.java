package org.legalis.expressions.conditions;

import lombok.Getter;

import java.util.Objects;

/**
 * 否定。
 */
@Getter
public final class NotCondition extends Condition {

    private final Condition inner;

    private NotCondition(Condition inner) {
        super(ConditionKind.NOT);
        this.inner = Objects.requireNonNull(inner, "NOT operand cannot be null.");
    }

    public static NotCondition of(Condition inner) {
        return new NotCondition(inner);
    }

    @Override
    public int size() {
        return 1 + inner.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NotCondition)) {
            return false;
        }
        return inner.equals(((NotCondition) o).inner);
    }

    @Override
    public int hashCode() {
        return 31 * ConditionKind.NOT.hashCode() + inner.hashCode();
    }

    @Override
    public String toString() {
        return "NOT " + inner;
    }
}
