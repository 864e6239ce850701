package org.legalis.symbolic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个满足赋值：变量名 -> 整数值，按变量注册顺序排列。
 * 用作见证或反例。
 */
public final class SatModel {

    private final Map<String, Long> values;
    private final Map<String, List<String>> internedValues;

    SatModel(Map<String, Long> values, Map<String, List<String>> internedValues) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.internedValues = Objects.requireNonNull(internedValues);
    }

    public Optional<Long> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Long> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * 把 attr_{key} 的编码还原为字符串值。
     * 变量不在模型中，或者取到了任何已知值以外的编码时为空。
     */
    public Optional<String> decodedAttribute(String key) {
        Long code = values.get("attr_" + key);
        List<String> known = internedValues.get(key);
        if (code == null || known == null || code < 0 || code >= known.size()) {
            return Optional.empty();
        }
        return Optional.of(known.get(code.intValue()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SatModel)) {
            return false;
        }
        return values.equals(((SatModel) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Long> entry : values.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(" = ").append(entry.getValue());
            first = false;
        }
        return sb.append("}").toString();
    }
}
