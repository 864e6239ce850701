package org.legalis.validation;

import org.legalis.statute.ast.AmendmentNode;
import org.legalis.statute.ast.ConditionNode;
import org.legalis.statute.ast.ConditionValue;
import org.legalis.statute.ast.ExceptionNode;
import org.legalis.statute.ast.LegalDocument;
import org.legalis.statute.ast.StatuteNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * 不依赖求解器的文档语义校验。
 * <p>
 * 检查内容：重复 id、生效/失效日期、数值区间、requires/supersedes 引用、修订目标以及 requires 图中的循环依赖。
 * 所有能发现的错误都会被收集，不会在第一个错误处停止。
 * 校验器本身无状态，可以被多个线程同时使用。
 * @author Ayalyt
 */
public class SemanticValidator {

    private static final Logger logger = LoggerFactory.getLogger(SemanticValidator.class);

    private final boolean strict;

    public SemanticValidator() {
        this(false);
    }

    private SemanticValidator(boolean strict) {
        this.strict = strict;
    }

    /**
     * 严格模式：有警告时报告也不通过。
     */
    public static SemanticValidator strict() {
        return new SemanticValidator(true);
    }

    public boolean isStrict() {
        return strict;
    }

    public ValidationReport validateDocument(LegalDocument document) {
        ValidationContext context = new ValidationContext(Objects.requireNonNull(document, "Document cannot be null."));
        List<ValidationError> errors = validateDocument(document, context);
        ValidationReport report = new ValidationReport(errors, context.getWarnings(), strict);
        logger.info("文档校验完成: {} 条法规, {}", document.getStatutes().size(), report);
        return report;
    }

    /**
     * 校验文档，警告写入调用方提供的 context。
     * @return 全部错误，按发现顺序。
     */
    public List<ValidationError> validateDocument(LegalDocument document, ValidationContext context) {
        Objects.requireNonNull(document, "Document cannot be null.");
        Objects.requireNonNull(context, "ValidationContext cannot be null.");
        List<ValidationError> errors = new ArrayList<>(checkDuplicateIds(document));
        for (StatuteNode statute : document.getStatutes()) {
            errors.addAll(validateStatute(statute, context));
        }
        errors.addAll(findCircularDependencies(document, context));
        return errors;
    }

    /**
     * 每个重复的 id 只报告一次。
     */
    private List<ValidationError> checkDuplicateIds(LegalDocument document) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new LinkedHashSet<>();
        for (StatuteNode statute : document.getStatutes()) {
            if (!seen.add(statute.getId())) {
                reported.add(statute.getId());
            }
        }
        return reported.stream().<ValidationError>map(ValidationError::duplicateStatuteId).toList();
    }

    private List<ValidationError> validateStatute(StatuteNode statute, ValidationContext context) {
        List<ValidationError> errors = new ArrayList<>();
        String id = statute.getId();

        if (statute.getEffectiveDate() != null && statute.getExpiryDate() != null
                && statute.getEffectiveDate().isAfter(statute.getExpiryDate())) {
            errors.add(ValidationError.invalidDateRange(id, statute.getEffectiveDate(), statute.getExpiryDate()));
        }

        for (ConditionNode condition : statute.getConditions()) {
            validateCondition(condition, id, errors);
        }

        for (String requiredId : statute.getRequires()) {
            if (requiredId.equals(id)) {
                errors.add(ValidationError.selfReference(id));
            } else if (!context.statuteExists(requiredId)) {
                errors.add(ValidationError.undefinedReference(id, requiredId));
            }
        }

        for (String supersededId : statute.getSupersedes()) {
            if (supersededId.equals(id)) {
                errors.add(ValidationError.selfReference(id));
            } else if (!context.statuteExists(supersededId)) {
                String warning = String.format("Statute '%s' supersedes '%s' which does not exist (may be intentional)",
                        id, supersededId);
                logger.warn("{}", warning);
                context.addWarning(warning);
            }
        }

        for (AmendmentNode amendment : statute.getAmendments()) {
            validateAmendment(amendment, id, context, errors);
        }

        for (ExceptionNode exception : statute.getExceptions()) {
            for (ConditionNode condition : exception.getConditions()) {
                validateCondition(condition, id, errors);
            }
        }
        return errors;
    }

    /**
     * 数值区间检查，递归进入 AND / OR / NOT。只有上下界都是数字时才检查。
     * BETWEEN 要求 min < max；IN 区间两端闭时要求 min < max，两端开时要求区间内至少有一个整数。
     */
    private void validateCondition(ConditionNode condition, String statuteId, List<ValidationError> errors) {
        if (condition instanceof ConditionNode.Between) {
            ConditionNode.Between between = (ConditionNode.Between) condition;
            checkRange(between.getMin(), between.getMax(), true, true, statuteId, errors);
        } else if (condition instanceof ConditionNode.InRange) {
            ConditionNode.InRange range = (ConditionNode.InRange) condition;
            checkRange(range.getMin(), range.getMax(), range.isInclusiveMin(), range.isInclusiveMax(), statuteId, errors);
        } else if (condition instanceof ConditionNode.And) {
            ConditionNode.And and = (ConditionNode.And) condition;
            validateCondition(and.getLeft(), statuteId, errors);
            validateCondition(and.getRight(), statuteId, errors);
        } else if (condition instanceof ConditionNode.Or) {
            ConditionNode.Or or = (ConditionNode.Or) condition;
            validateCondition(or.getLeft(), statuteId, errors);
            validateCondition(or.getRight(), statuteId, errors);
        } else if (condition instanceof ConditionNode.Not) {
            validateCondition(((ConditionNode.Not) condition).getInner(), statuteId, errors);
        }
    }

    private void checkRange(ConditionValue minValue, ConditionValue maxValue, boolean inclusiveMin, boolean inclusiveMax,
                            String statuteId, List<ValidationError> errors) {
        OptionalLong min = minValue.asNumber();
        OptionalLong max = maxValue.asNumber();
        if (min.isEmpty() || max.isEmpty()) {
            return;
        }
        long lo = min.getAsLong();
        long hi = max.getAsLong();
        boolean invalid;
        if (inclusiveMin && inclusiveMax) {
            invalid = lo >= hi;
        } else if (!inclusiveMin && !inclusiveMax) {
            // (lo, hi) 中没有整数
            invalid = hi == Long.MIN_VALUE || lo >= hi - 1;
        } else {
            // 半开区间不检查
            invalid = false;
        }
        if (invalid) {
            logger.debug("法规 {} 的数值区间非法: min={}, max={}", statuteId, lo, hi);
            errors.add(ValidationError.invalidNumericRange(statuteId, lo, hi));
        }
    }

    private void validateAmendment(AmendmentNode amendment, String statuteId, ValidationContext context,
                                   List<ValidationError> errors) {
        if (!context.statuteExists(amendment.getTargetId())) {
            errors.add(ValidationError.invalidAmendment(statuteId, amendment.getTargetId()));
            return;
        }
        if (amendment.getDate() != null) {
            try {
                LocalDate.parse(amendment.getDate());
            } catch (DateTimeParseException e) {
                String warning = String.format("Amendment of '%s' in statute '%s' has invalid date '%s' (expected yyyy-MM-dd)",
                        amendment.getTargetId(), statuteId, amendment.getDate());
                logger.warn("{}", warning);
                context.addWarning(warning);
            }
        }
    }

    /**
     * 从每条法规出发对 requires 图做深度优先搜索，当前路径上的节点被再次访问即为一个环。
     * 同一个有向环（不论从哪个节点进入）只报告一次；自引用边和指向不存在法规的边不参与搜索。
     */
    private List<ValidationError> findCircularDependencies(LegalDocument document, ValidationContext context) {
        List<ValidationError> errors = new ArrayList<>();
        Set<List<String>> reportedCycles = new HashSet<>();
        for (StatuteNode statute : document.getStatutes()) {
            walk(statute.getId(), context, new LinkedHashSet<>(), reportedCycles, errors);
        }
        return errors;
    }

    private void walk(String statuteId, ValidationContext context, LinkedHashSet<String> path,
                      Set<List<String>> reportedCycles, List<ValidationError> errors) {
        if (path.contains(statuteId)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String id : path) {
                inCycle = inCycle || id.equals(statuteId);
                if (inCycle) {
                    cycle.add(id);
                }
            }
            cycle.add(statuteId);
            if (reportedCycles.add(canonicalRotation(cycle))) {
                logger.debug("发现循环依赖: {}", String.join(" -> ", cycle));
                errors.add(ValidationError.circularDependency(statuteId, cycle));
            }
            return;
        }
        StatuteNode statute = context.getStatute(statuteId).orElse(null);
        if (statute == null) {
            return;
        }
        path.add(statuteId);
        for (String requiredId : statute.getRequires()) {
            if (!requiredId.equals(statuteId)) {
                walk(requiredId, context, path, reportedCycles, errors);
            }
        }
        path.remove(statuteId);
    }

    /**
     * 去掉闭合路径末尾的重复节点，并旋转到以最小 id 开头，保持方向。
     */
    static List<String> canonicalRotation(List<String> closedCycle) {
        List<String> open = closedCycle.subList(0, closedCycle.size() - 1);
        int start = open.indexOf(Collections.min(open));
        List<String> rotated = new ArrayList<>(open.size());
        rotated.addAll(open.subList(start, open.size()));
        rotated.addAll(open.subList(0, start));
        return List.copyOf(rotated);
    }
}
