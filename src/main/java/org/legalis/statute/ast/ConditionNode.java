package org.legalis.statute.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 解析器产出的条件语法树。只携带语法信息，语义检查由 SemanticValidator 完成。
 */
public abstract class ConditionNode {

    private ConditionNode() {
    }

    public static Comparison comparison(String field, String operator, ConditionValue value) {
        return new Comparison(field, operator, value);
    }

    public static HasAttribute hasAttribute(String key) {
        return new HasAttribute(key);
    }

    public static Between between(String field, ConditionValue min, ConditionValue max) {
        return new Between(field, min, max);
    }

    public static InRange inRange(String field, ConditionValue min, ConditionValue max,
                                  boolean inclusiveMin, boolean inclusiveMax) {
        return new InRange(field, min, max, inclusiveMin, inclusiveMax);
    }

    public static And and(ConditionNode left, ConditionNode right) {
        return new And(left, right);
    }

    public static Or or(ConditionNode left, ConditionNode right) {
        return new Or(left, right);
    }

    public static Not not(ConditionNode inner) {
        return new Not(inner);
    }

    /** field op value */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Comparison extends ConditionNode {
        private final String field;
        private final String operator;
        private final ConditionValue value;

        private Comparison(String field, String operator, ConditionValue value) {
            this.field = Objects.requireNonNull(field, "field");
            this.operator = Objects.requireNonNull(operator, "operator");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return field + " " + operator + " " + value;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class HasAttribute extends ConditionNode {
        private final String key;

        private HasAttribute(String key) {
            this.key = Objects.requireNonNull(key, "key");
        }

        @Override
        public String toString() {
            return "HAS " + key;
        }
    }

    /** field BETWEEN min AND max */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Between extends ConditionNode {
        private final String field;
        private final ConditionValue min;
        private final ConditionValue max;

        private Between(String field, ConditionValue min, ConditionValue max) {
            this.field = Objects.requireNonNull(field, "field");
            this.min = Objects.requireNonNull(min, "min");
            this.max = Objects.requireNonNull(max, "max");
        }

        @Override
        public String toString() {
            return field + " BETWEEN " + min + " AND " + max;
        }
    }

    /** field IN [min, max] / (min, max) 等开闭区间 */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class InRange extends ConditionNode {
        private final String field;
        private final ConditionValue min;
        private final ConditionValue max;
        private final boolean inclusiveMin;
        private final boolean inclusiveMax;

        private InRange(String field, ConditionValue min, ConditionValue max, boolean inclusiveMin, boolean inclusiveMax) {
            this.field = Objects.requireNonNull(field, "field");
            this.min = Objects.requireNonNull(min, "min");
            this.max = Objects.requireNonNull(max, "max");
            this.inclusiveMin = inclusiveMin;
            this.inclusiveMax = inclusiveMax;
        }

        @Override
        public String toString() {
            return field + " IN " + (inclusiveMin ? "[" : "(") + min + ", " + max + (inclusiveMax ? "]" : ")");
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class And extends ConditionNode {
        private final ConditionNode left;
        private final ConditionNode right;

        private And(ConditionNode left, ConditionNode right) {
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " AND " + right + ")";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Or extends ConditionNode {
        private final ConditionNode left;
        private final ConditionNode right;

        private Or(ConditionNode left, ConditionNode right) {
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " OR " + right + ")";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Not extends ConditionNode {
        private final ConditionNode inner;

        private Not(ConditionNode inner) {
            this.inner = Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String toString() {
            return "NOT " + inner;
        }
    }
}
