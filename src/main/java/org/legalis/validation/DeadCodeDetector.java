package org.legalis.validation;

import org.legalis.statute.ast.ConditionNode;
import org.legalis.statute.ast.EffectNode;
import org.legalis.statute.ast.LegalDocument;
import org.legalis.statute.ast.StatuteNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * 不依赖求解器的死代码检查。
 * <p>
 * 报告三类问题：条件在语法上就永远不成立的法规，没有被其他法规通过 requires/supersedes/修订引用的法规，
 * 以及因为依赖的法规永远不成立而无法产生的效果。
 * 这里只识别数值区间为空和同一字段上下界冲突这几种模式，完整的可满足性判断交给 SmtVerifier。
 * @author Ayalyt
 */
public class DeadCodeDetector {

    private static final Logger logger = LoggerFactory.getLogger(DeadCodeDetector.class);

    static final String ALWAYS_FALSE_REASON = "Statute contains contradictory conditions that are always false";
    static final String UNREFERENCED_REASON = "Statute is never referenced by other statutes";

    public List<ValidationError> detect(LegalDocument document) {
        Objects.requireNonNull(document, "Document cannot be null.");
        ValidationContext context = new ValidationContext(document);
        List<ValidationError> errors = new ArrayList<>();
        for (StatuteNode statute : document.getStatutes()) {
            if (hasAlwaysFalseCondition(statute)) {
                errors.add(ValidationError.deadCode(statute.getId(), ALWAYS_FALSE_REASON));
            }
            if (!isReferenced(statute, document)) {
                errors.add(ValidationError.deadCode(statute.getId(), UNREFERENCED_REASON));
            }
            errors.addAll(findUnreachableEffects(statute, context));
        }
        logger.info("死代码检查完成: {} 条法规, {} 个问题", document.getStatutes().size(), errors.size());
        return errors;
    }

    /**
     * 其他法规（不含自身）的 requires、supersedes 或修订目标中是否出现该法规。
     */
    boolean isReferenced(StatuteNode statute, LegalDocument document) {
        String id = statute.getId();
        for (StatuteNode other : document.getStatutes()) {
            if (other.getId().equals(id)) {
                continue;
            }
            if (other.getRequires().contains(id) || other.getSupersedes().contains(id)) {
                return true;
            }
            if (other.getAmendments().stream().anyMatch(amendment -> amendment.getTargetId().equals(id))) {
                return true;
            }
        }
        return false;
    }

    boolean hasAlwaysFalseCondition(StatuteNode statute) {
        return statute.getConditions().stream().anyMatch(this::isAlwaysFalse);
    }

    /**
     * 每个依赖的法规若永远不成立，本法规的每个效果各报告一次。
     */
    private List<ValidationError> findUnreachableEffects(StatuteNode statute, ValidationContext context) {
        List<ValidationError> errors = new ArrayList<>();
        for (String requiredId : statute.getRequires()) {
            StatuteNode required = context.getStatute(requiredId).orElse(null);
            if (required == null || !hasAlwaysFalseCondition(required)) {
                continue;
            }
            for (EffectNode effect : statute.getEffects()) {
                logger.debug("法规 {} 的效果 {} 不可达，依赖 {} 永远不成立", statute.getId(), effect, requiredId);
                errors.add(ValidationError.unreachableEffect(statute.getId(), String.format(
                        "Effect '%s' is unreachable because required statute '%s' has contradictory conditions",
                        effect.getDescription(), requiredId)));
            }
        }
        return errors;
    }

    /**
     * 按整数语义判断条件是否必然为假。只识别：
     * 空的 BETWEEN / IN 区间，任一侧必然为假或两侧对同一字段给出冲突上下界的 AND，两侧都必然为假的 OR。
     */
    boolean isAlwaysFalse(ConditionNode condition) {
        if (condition instanceof ConditionNode.Between) {
            ConditionNode.Between between = (ConditionNode.Between) condition;
            return Bounds.of(between.getMin().asNumber(), true, between.getMax().asNumber(), true).isEmpty();
        }
        if (condition instanceof ConditionNode.InRange) {
            ConditionNode.InRange range = (ConditionNode.InRange) condition;
            return Bounds.of(range.getMin().asNumber(), range.isInclusiveMin(),
                    range.getMax().asNumber(), range.isInclusiveMax()).isEmpty();
        }
        if (condition instanceof ConditionNode.And) {
            ConditionNode.And and = (ConditionNode.And) condition;
            return isAlwaysFalse(and.getLeft()) || isAlwaysFalse(and.getRight())
                    || areContradictory(and.getLeft(), and.getRight());
        }
        if (condition instanceof ConditionNode.Or) {
            ConditionNode.Or or = (ConditionNode.Or) condition;
            return isAlwaysFalse(or.getLeft()) && isAlwaysFalse(or.getRight());
        }
        return false;
    }

    /**
     * 两个针对同一字段的数值比较，例如 x > 5 AND x < 3。
     */
    private boolean areContradictory(ConditionNode left, ConditionNode right) {
        if (!(left instanceof ConditionNode.Comparison) || !(right instanceof ConditionNode.Comparison)) {
            return false;
        }
        ConditionNode.Comparison first = (ConditionNode.Comparison) left;
        ConditionNode.Comparison second = (ConditionNode.Comparison) right;
        if (!first.getField().equals(second.getField())) {
            return false;
        }
        Bounds a = Bounds.ofComparison(first);
        Bounds b = Bounds.ofComparison(second);
        if (a == null || b == null) {
            return false;
        }
        return a.intersect(b).isEmpty();
    }

    /**
     * 闭整数区间 [lower, upper]。
     */
    private static final class Bounds {
        private final long lower;
        private final long upper;
        private final boolean empty;

        private Bounds(long lower, long upper, boolean empty) {
            this.lower = lower;
            this.upper = upper;
            this.empty = empty || lower > upper;
        }

        static Bounds of(OptionalLong min, boolean inclusiveMin, OptionalLong max, boolean inclusiveMax) {
            long lower = Long.MIN_VALUE;
            long upper = Long.MAX_VALUE;
            boolean empty = false;
            if (min.isPresent()) {
                long lo = min.getAsLong();
                empty = !inclusiveMin && lo == Long.MAX_VALUE;
                lower = inclusiveMin || empty ? lo : lo + 1;
            }
            if (max.isPresent()) {
                long hi = max.getAsLong();
                boolean emptyUpper = !inclusiveMax && hi == Long.MIN_VALUE;
                empty = empty || emptyUpper;
                upper = inclusiveMax || emptyUpper ? hi : hi - 1;
            }
            return new Bounds(lower, upper, empty);
        }

        /**
         * 运算符或取值不是整数比较时返回 null。
         */
        static Bounds ofComparison(ConditionNode.Comparison comparison) {
            OptionalLong value = comparison.getValue().asNumber();
            if (value.isEmpty()) {
                return null;
            }
            OptionalLong none = OptionalLong.empty();
            switch (comparison.getOperator()) {
                case ">":
                    return of(value, false, none, true);
                case ">=":
                    return of(value, true, none, true);
                case "<":
                    return of(none, true, value, false);
                case "<=":
                    return of(none, true, value, true);
                case "=":
                case "==":
                    return of(value, true, value, true);
                default:
                    return null;
            }
        }

        Bounds intersect(Bounds other) {
            return new Bounds(Math.max(lower, other.lower), Math.min(upper, other.upper), empty || other.empty);
        }

        boolean isEmpty() {
            return empty;
        }
    }
}
