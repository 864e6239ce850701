package org.legalis.symbolic;

import lombok.Getter;
import org.legalis.expressions.conditions.Condition;

/**
 * 翻译器遇到无法编码的条件构造，拒绝近似处理。
 */
@Getter
public class UnsupportedConditionException extends VerifierException {

    private final transient Condition condition;

    public UnsupportedConditionException(Condition condition) {
        super("Cannot translate condition of type " + condition.getClass().getName() + ": " + condition);
        this.condition = condition;
    }
}
