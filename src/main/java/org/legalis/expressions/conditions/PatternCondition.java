package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 属性匹配某个模式。模式本身不做解释，求解器中当作不透明原子。
 */
@Getter
public final class PatternCondition extends Condition {

    private final String attribute;
    private final String pattern;
    private final boolean negated;

    private PatternCondition(String attribute, String pattern, boolean negated) {
        super(ConditionKind.PATTERN);
        this.attribute = Validate.notBlank(attribute, "Pattern attribute cannot be blank");
        this.pattern = Objects.requireNonNull(pattern, "Pattern cannot be null.");
        this.negated = negated;
    }

    public static PatternCondition matches(String attribute, String pattern) {
        return new PatternCondition(attribute, pattern, false);
    }

    public static PatternCondition notMatches(String attribute, String pattern) {
        return new PatternCondition(attribute, pattern, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatternCondition)) {
            return false;
        }
        PatternCondition that = (PatternCondition) o;
        return negated == that.negated && attribute.equals(that.attribute) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.PATTERN, attribute, pattern, negated);
    }

    @Override
    public String toString() {
        return attribute + (negated ? " !~ " : " =~ ") + "/" + pattern + "/";
    }
}
