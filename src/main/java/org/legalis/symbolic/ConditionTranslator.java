package org.legalis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import org.legalis.core.ComparisonOp;
import org.legalis.expressions.conditions.AndCondition;
import org.legalis.expressions.conditions.AttributeEqualsCondition;
import org.legalis.expressions.conditions.Condition;
import org.legalis.expressions.conditions.CustomCondition;
import org.legalis.expressions.conditions.DateRangeCondition;
import org.legalis.expressions.conditions.EntityRelationshipCondition;
import org.legalis.expressions.conditions.GeographicCondition;
import org.legalis.expressions.conditions.HasAttributeCondition;
import org.legalis.expressions.conditions.NotCondition;
import org.legalis.expressions.conditions.NumericComparisonCondition;
import org.legalis.expressions.conditions.OrCondition;
import org.legalis.expressions.conditions.PatternCondition;
import org.legalis.expressions.conditions.SetMembershipCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把 Condition 树翻译为 Z3 布尔公式。
 * 所有变量都经由 VariableRegistry 获取，所以同一会话中的重复翻译使用相同的变量。
 * 遇到无法编码的条件时抛出 UnsupportedConditionException，不做近似。
 */
public class ConditionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionTranslator.class);

    private final Context ctx;
    private final VariableRegistry registry;

    public ConditionTranslator(VariableRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "VariableRegistry cannot be null.");
        this.ctx = registry.getCtx();
    }

    public BoolExpr translate(Condition condition) throws UnsupportedConditionException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        logger.debug("翻译条件: {}", condition);
        return switch (condition.getKind()) {
            case AGE, INCOME, RESIDENCY_DURATION, DURATION, PERCENTAGE ->
                    translateNumeric((NumericComparisonCondition) condition);
            case HAS_ATTRIBUTE -> registry.getOrCreateBool("has_" + ((HasAttributeCondition) condition).getKey());
            case ATTRIBUTE_EQUALS -> translateAttributeEquals((AttributeEqualsCondition) condition);
            case DATE_RANGE -> translateDateRange((DateRangeCondition) condition);
            case GEOGRAPHIC -> {
                GeographicCondition geo = (GeographicCondition) condition;
                yield registry.getOrCreateBool("in_region_" + geo.getRegionType() + "=" + geo.getRegionId());
            }
            case ENTITY_RELATIONSHIP -> {
                EntityRelationshipCondition rel = (EntityRelationshipCondition) condition;
                yield registry.getOrCreateBool(relationshipAtom(rel));
            }
            case CUSTOM -> registry.getOrCreateBool("custom:" + ((CustomCondition) condition).getDescription());
            case SET_MEMBERSHIP -> translateSetMembership((SetMembershipCondition) condition);
            case PATTERN -> {
                PatternCondition pattern = (PatternCondition) condition;
                BoolExpr atom = registry.getOrCreateBool(patternAtom(pattern));
                yield pattern.isNegated() ? ctx.mkNot(atom) : atom;
            }
            case AND -> {
                AndCondition and = (AndCondition) condition;
                yield ctx.mkAnd(translate(and.getLeft()), translate(and.getRight()));
            }
            case OR -> {
                OrCondition or = (OrCondition) condition;
                yield ctx.mkOr(translate(or.getLeft()), translate(or.getRight()));
            }
            case NOT -> ctx.mkNot(translate(((NotCondition) condition).getInner()));
            case EXTENSION -> {
                logger.error("ConditionTranslator: 不支持的条件类型 {}", condition.getClass().getName());
                throw new UnsupportedConditionException(condition);
            }
        };
    }

    /**
     * 枚举名中不含 '=' 和 '#'，因此 "rel_{TYPE}#"（任意对象）与 "rel_{TYPE}={target}" 不会重名。
     */
    static String relationshipAtom(EntityRelationshipCondition rel) {
        return rel.getTargetEntityId()
                .map(target -> "rel_" + rel.getRelationshipType() + "=" + target)
                .orElse("rel_" + rel.getRelationshipType() + "#");
    }

    /**
     * 属性名带长度前缀，属性名或模式中含有 ':' 时也能唯一拆分。
     */
    static String patternAtom(PatternCondition pattern) {
        String attribute = pattern.getAttribute();
        return "pattern:" + attribute.length() + ":" + attribute + ":" + pattern.getPattern();
    }

    private BoolExpr translateNumeric(NumericComparisonCondition condition) {
        IntExpr variable = registry.getOrCreateInt(condition.getVariableName());
        return compare(variable, condition.getOperator(), condition.getNormalizedValue());
    }

    private BoolExpr translateAttributeEquals(AttributeEqualsCondition condition) {
        IntExpr variable = registry.getOrCreateInt("attr_" + condition.getKey());
        long code = registry.internValue(condition.getKey(), condition.getValue());
        return ctx.mkEq(variable, ctx.mkInt(code));
    }

    private BoolExpr translateDateRange(DateRangeCondition condition) {
        IntExpr date = registry.getOrCreateInt(DateRangeCondition.VARIABLE);
        List<BoolExpr> bounds = new ArrayList<>(2);
        condition.getStart().ifPresent(start -> bounds.add(ctx.mkGe(date, dateValue(start))));
        condition.getEnd().ifPresent(end -> bounds.add(ctx.mkLe(date, dateValue(end))));
        if (bounds.isEmpty()) {
            return ctx.mkTrue();
        }
        return ctx.mkAnd(bounds.toArray(new BoolExpr[0]));
    }

    private BoolExpr translateSetMembership(SetMembershipCondition condition) {
        IntExpr variable = registry.getOrCreateInt("attr_" + condition.getAttribute());
        List<BoolExpr> alternatives = new ArrayList<>(condition.getValues().size());
        for (String value : condition.getValues()) {
            long code = registry.internValue(condition.getAttribute(), value);
            alternatives.add(ctx.mkEq(variable, ctx.mkInt(code)));
        }
        // 空析取为 false
        BoolExpr membership = alternatives.isEmpty()
                ? ctx.mkFalse()
                : ctx.mkOr(alternatives.toArray(new BoolExpr[0]));
        return condition.isNegated() ? ctx.mkNot(membership) : membership;
    }

    private IntNum dateValue(LocalDate date) {
        // 相对 1970-01-01 的天数
        return ctx.mkInt(date.toEpochDay());
    }

    private BoolExpr compare(IntExpr left, ComparisonOp op, long value) {
        IntNum right = ctx.mkInt(value);
        return switch (op) {
            case EQ -> ctx.mkEq(left, right);
            case NE -> ctx.mkNot(ctx.mkEq(left, right));
            case LT -> ctx.mkLt(left, right);
            case LE -> ctx.mkLe(left, right);
            case GT -> ctx.mkGt(left, right);
            case GE -> ctx.mkGe(left, right);
        };
    }
}
