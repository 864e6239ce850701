package org.legalis.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 条件中使用的比较运算符。
 * 所有比较都在精确整数上进行。
 */
public enum ComparisonOp {

    EQ("=="),   // Equal
    NE("!="),   // Not Equal
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">=");   // Greater Equal

    private static final Logger logger = LoggerFactory.getLogger(ComparisonOp.class);

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此运算符的逻辑否定。
     * 例如：LT 的否定是 GE，EQ 的否定是 NE。
     */
    public ComparisonOp negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    /**
     * 返回交换操作数后的等价运算符。
     * 例如：(a < b) 等价于 (b > a)。
     */
    public ComparisonOp flip() {
        return switch (this) {
            case EQ -> EQ;
            case NE -> NE;
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
        };
    }

    /**
     * 对两个整数直接求值，供不需要求解器的场合使用。
     */
    public boolean test(long left, long right) {
        return switch (this) {
            case EQ -> left == right;
            case NE -> left != right;
            case LT -> left < right;
            case LE -> left <= right;
            case GT -> left > right;
            case GE -> left >= right;
        };
    }

    /**
     * 按符号解析运算符，接受 DSL 中出现的 "=" 作为 "==" 的别名。
     * @param symbol 运算符符号。
     * @return 对应的 ComparisonOp。
     * @throws IllegalArgumentException 如果符号未知。
     */
    public static ComparisonOp fromSymbol(String symbol) {
        if ("=".equals(symbol)) {
            return EQ;
        }
        for (ComparisonOp op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        logger.error("ComparisonOp.fromSymbol: 未知运算符 {}", symbol);
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
