package org.legalis.statute.ast;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * DSL 条件中出现的字面值：数字、文本、布尔或日期。
 */
public final class ConditionValue {

    public enum Type {
        NUMBER,
        TEXT,
        BOOLEAN,
        DATE
    }

    private final Type type;
    private final Object value;

    private ConditionValue(Type type, Object value) {
        this.type = type;
        this.value = Objects.requireNonNull(value, "Condition value cannot be null.");
    }

    public static ConditionValue number(long value) {
        return new ConditionValue(Type.NUMBER, value);
    }

    public static ConditionValue text(String value) {
        return new ConditionValue(Type.TEXT, value);
    }

    public static ConditionValue bool(boolean value) {
        return new ConditionValue(Type.BOOLEAN, value);
    }

    public static ConditionValue date(LocalDate value) {
        return new ConditionValue(Type.DATE, value);
    }

    public Type getType() {
        return type;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    /**
     * 数值；不是数字时为空。
     */
    public OptionalLong asNumber() {
        return type == Type.NUMBER ? OptionalLong.of((Long) value) : OptionalLong.empty();
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConditionValue)) {
            return false;
        }
        ConditionValue that = (ConditionValue) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type == Type.TEXT ? "\"" + value + "\"" : value.toString();
    }
}
