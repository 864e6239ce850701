package org.legalis.expressions.conditions;

import java.util.List;
import java.util.Objects;

/**
 * 法规前提条件的表达式树。
 * 条件是不可变的值对象，组合节点独占其子节点，树中不存在回边。
 * 内置变体都在本包中定义；外部子类的 kind 固定为 {@link ConditionKind#EXTENSION}。
 * @author Ayalyt
 */
public abstract class Condition {

    private final ConditionKind kind;

    Condition(ConditionKind kind) {
        this.kind = Objects.requireNonNull(kind, "Condition kind cannot be null.");
    }

    /**
     * 供外部扩展使用的构造函数。
     */
    protected Condition() {
        this(ConditionKind.EXTENSION);
    }

    public final ConditionKind getKind() {
        return kind;
    }

    // --- 组合 ---

    public Condition and(Condition other) {
        return AndCondition.of(this, other);
    }

    public Condition or(Condition other) {
        return OrCondition.of(this, other);
    }

    public Condition negate() {
        return NotCondition.of(this);
    }

    /**
     * 将非空条件列表从左到右折叠为 AND 链。
     * @param conditions 条件列表。
     * @return 合取后的条件；单个元素时返回其本身。
     * @throws IllegalArgumentException 如果列表为空。
     */
    public static Condition allOf(List<? extends Condition> conditions) {
        Objects.requireNonNull(conditions, "Conditions cannot be null.");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("Cannot conjoin an empty list of conditions");
        }
        Condition combined = conditions.get(0);
        for (int i = 1; i < conditions.size(); i++) {
            combined = AndCondition.of(combined, conditions.get(i));
        }
        return combined;
    }

    /**
     * 将非空条件列表从左到右折叠为 OR 链。
     */
    public static Condition anyOf(List<? extends Condition> conditions) {
        Objects.requireNonNull(conditions, "Conditions cannot be null.");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("Cannot disjoin an empty list of conditions");
        }
        Condition combined = conditions.get(0);
        for (int i = 1; i < conditions.size(); i++) {
            combined = OrCondition.of(combined, conditions.get(i));
        }
        return combined;
    }

    /**
     * 树中节点的总数。
     */
    public int size() {
        return 1;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
