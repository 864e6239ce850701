package org.legalis.expressions.conditions;

/**
 * Condition 的变体标签。
 * EXTENSION 表示由外部代码扩展的条件类型，翻译器不认识这类条件。
 */
public enum ConditionKind {
    AGE,
    INCOME,
    HAS_ATTRIBUTE,
    ATTRIBUTE_EQUALS,
    DATE_RANGE,
    GEOGRAPHIC,
    ENTITY_RELATIONSHIP,
    RESIDENCY_DURATION,
    DURATION,
    PERCENTAGE,
    SET_MEMBERSHIP,
    PATTERN,
    CUSTOM,
    AND,
    OR,
    NOT,
    EXTENSION;

    /**
     * 是否为逻辑组合 (AND / OR / NOT)。
     */
    public boolean isComposite() {
        return this == AND || this == OR || this == NOT;
    }
}
