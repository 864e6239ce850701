package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 属性取某个具体的值，例如 citizenship == "JP"。
 */
@Getter
public final class AttributeEqualsCondition extends Condition {

    private final String key;
    private final String value;

    private AttributeEqualsCondition(String key, String value) {
        super(ConditionKind.ATTRIBUTE_EQUALS);
        this.key = Validate.notBlank(key, "Attribute key cannot be blank");
        this.value = Objects.requireNonNull(value, "Attribute value cannot be null.");
    }

    public static AttributeEqualsCondition of(String key, String value) {
        return new AttributeEqualsCondition(key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeEqualsCondition)) {
            return false;
        }
        AttributeEqualsCondition that = (AttributeEqualsCondition) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ConditionKind.ATTRIBUTE_EQUALS, key, value);
    }

    @Override
    public String toString() {
        return key + " == \"" + value + "\"";
    }
}
