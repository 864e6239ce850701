package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * 主体拥有某个属性。
 */
@Getter
public final class HasAttributeCondition extends Condition {

    private final String key;

    private HasAttributeCondition(String key) {
        super(ConditionKind.HAS_ATTRIBUTE);
        this.key = Validate.notBlank(key, "Attribute key cannot be blank");
    }

    public static HasAttributeCondition of(String key) {
        return new HasAttributeCondition(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HasAttributeCondition)) {
            return false;
        }
        return key.equals(((HasAttributeCondition) o).key);
    }

    @Override
    public int hashCode() {
        return 31 * ConditionKind.HAS_ATTRIBUTE.hashCode() + key.hashCode();
    }

    @Override
    public String toString() {
        return "has " + key;
    }
}
