package org.legalis.symbolic;

import lombok.Getter;
import org.legalis.expressions.conditions.Condition;

import java.util.Objects;

/**
 * simplify 的结果：化简后的条件以及是否发生了变化。
 */
@Getter
public final class SimplificationResult {

    private final Condition condition;
    private final boolean changed;

    SimplificationResult(Condition condition, boolean changed) {
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null.");
        this.changed = changed;
    }

    @Override
    public String toString() {
        return (changed ? "simplified: " : "unchanged: ") + condition;
    }
}
