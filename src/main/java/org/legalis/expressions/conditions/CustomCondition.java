package org.legalis.expressions.conditions;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

/**
 * 无法进一步形式化的自由文本条件，求解器中当作不透明的布尔原子。
 * 描述完全相同的两个 CustomCondition 对应同一个原子。
 */
@Getter
public final class CustomCondition extends Condition {

    private final String description;

    private CustomCondition(String description) {
        super(ConditionKind.CUSTOM);
        this.description = Validate.notBlank(description, "Custom condition description cannot be blank");
    }

    public static CustomCondition of(String description) {
        return new CustomCondition(description);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CustomCondition)) {
            return false;
        }
        return description.equals(((CustomCondition) o).description);
    }

    @Override
    public int hashCode() {
        return 31 * ConditionKind.CUSTOM.hashCode() + description.hashCode();
    }

    @Override
    public String toString() {
        return "custom(" + description + ")";
    }
}
