package org.legalis.verification;

import org.apache.commons.lang3.tuple.Pair;
import org.legalis.expressions.conditions.Condition;
import org.legalis.statute.model.Statute;
import org.legalis.symbolic.SmtVerifier;
import org.legalis.symbolic.VerifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于同一个 SmtVerifier 会话的法规语料一致性检查。
 * 所有法规共享一个会话，因此不同法规中的同名属性对应同一个变量，跨法规的矛盾可以被发现。
 * 检查器不拥有 verifier，调用方负责关闭它。
 * 求解器 UNKNOWN 以 SolverUnknownException 抛出，不会被当作“没有问题”。
 * @author Ayalyt
 */
public class StatuteConsistencyChecker {

    private static final Logger logger = LoggerFactory.getLogger(StatuteConsistencyChecker.class);

    private final SmtVerifier verifier;

    public StatuteConsistencyChecker(SmtVerifier verifier) {
        this.verifier = Objects.requireNonNull(verifier, "SmtVerifier cannot be null.");
    }

    /**
     * 前提条件永远不能同时成立的法规。没有前提条件的法规不会是死法规。
     */
    public List<String> findDeadStatutes(List<Statute> statutes) throws VerifierException {
        List<String> dead = new ArrayList<>();
        for (Statute statute : statutes) {
            Optional<Condition> preconditions = statute.combinedPreconditions();
            if (preconditions.isPresent() && !verifier.isSatisfiable(preconditions.get())) {
                logger.debug("法规 {} 的前提条件不可满足", statute.getId());
                dead.add(statute.getId());
            }
        }
        return dead;
    }

    /**
     * 前提条件互相矛盾的无序法规对。
     * 没有前提条件的法规和死法规不参与比较（后者已由 findDeadStatutes 报告）。
     */
    public List<Pair<String, String>> findContradictoryPairs(List<Statute> statutes) throws VerifierException {
        Set<String> dead = new HashSet<>(findDeadStatutes(statutes));
        List<Pair<String, String>> pairs = new ArrayList<>();
        for (int i = 0; i < statutes.size(); i++) {
            Statute first = statutes.get(i);
            Optional<Condition> firstPre = first.combinedPreconditions();
            if (firstPre.isEmpty() || dead.contains(first.getId())) {
                continue;
            }
            for (int j = i + 1; j < statutes.size(); j++) {
                Statute second = statutes.get(j);
                Optional<Condition> secondPre = second.combinedPreconditions();
                if (secondPre.isEmpty() || dead.contains(second.getId())) {
                    continue;
                }
                if (verifier.contradict(firstPre.get(), secondPre.get())) {
                    logger.debug("法规 {} 与 {} 的前提条件矛盾", first.getId(), second.getId());
                    pairs.add(Pair.of(first.getId(), second.getId()));
                }
            }
        }
        return pairs;
    }

    /**
     * 前提条件可以同时成立、效果却互相冲突（授予/撤销，义务/禁止）的法规对。
     */
    public List<Pair<String, String>> findEffectConflicts(List<Statute> statutes) throws VerifierException {
        List<Pair<String, String>> conflicts = new ArrayList<>();
        for (int i = 0; i < statutes.size(); i++) {
            Statute first = statutes.get(i);
            for (int j = i + 1; j < statutes.size(); j++) {
                Statute second = statutes.get(j);
                if (!first.getEffect().getType().conflictsWith(second.getEffect().getType())) {
                    continue;
                }
                if (canApplyTogether(first, second)) {
                    logger.debug("法规 {} 与 {} 的效果冲突", first.getId(), second.getId());
                    conflicts.add(Pair.of(first.getId(), second.getId()));
                }
            }
        }
        return conflicts;
    }

    /**
     * 被同一法规中另一个前提条件蕴含的前提条件下标。
     * 两个条件等价时只报告下标较大的那个。
     */
    public List<Integer> findRedundantPreconditions(Statute statute) throws VerifierException {
        List<Condition> preconditions = statute.getPreconditions();
        List<Integer> redundant = new ArrayList<>();
        for (int i = 0; i < preconditions.size(); i++) {
            for (int j = 0; j < preconditions.size(); j++) {
                if (i == j) {
                    continue;
                }
                Condition candidate = preconditions.get(i);
                Condition stronger = preconditions.get(j);
                if (verifier.implies(stronger, candidate)
                        && (j < i || !verifier.implies(candidate, stronger))) {
                    logger.debug("法规 {} 的前提条件 [{}] {} 被 [{}] {} 蕴含",
                            statute.getId(), i, candidate, j, stronger);
                    redundant.add(i);
                    break;
                }
            }
        }
        return redundant;
    }

    /**
     * 执行全部检查并汇总为报告。
     */
    public ConsistencyReport check(List<Statute> statutes) throws VerifierException {
        Objects.requireNonNull(statutes, "Statutes cannot be null.");
        List<ConsistencyIssue> issues = new ArrayList<>();

        for (String id : findDeadStatutes(statutes)) {
            issues.add(new ConsistencyIssue(ConsistencyIssue.Kind.DEAD_STATUTE, List.of(id),
                    "Statute '" + id + "' has preconditions that can never be satisfied"));
        }
        for (Pair<String, String> pair : findContradictoryPairs(statutes)) {
            issues.add(new ConsistencyIssue(ConsistencyIssue.Kind.CONTRADICTORY_PRECONDITIONS,
                    List.of(pair.getLeft(), pair.getRight()),
                    "Statutes '" + pair.getLeft() + "' and '" + pair.getRight() + "' have contradictory preconditions"));
        }
        for (Pair<String, String> pair : findEffectConflicts(statutes)) {
            issues.add(new ConsistencyIssue(ConsistencyIssue.Kind.EFFECT_CONFLICT,
                    List.of(pair.getLeft(), pair.getRight()),
                    "Statutes '" + pair.getLeft() + "' and '" + pair.getRight()
                            + "' can apply together but have conflicting effects"));
        }
        for (Statute statute : statutes) {
            for (int index : findRedundantPreconditions(statute)) {
                issues.add(new ConsistencyIssue(ConsistencyIssue.Kind.REDUNDANT_PRECONDITION, List.of(statute.getId()),
                        "Precondition [" + index + "] '" + statute.getPreconditions().get(index)
                                + "' of statute '" + statute.getId() + "' is implied by another precondition"));
            }
        }

        ConsistencyReport report = new ConsistencyReport(issues);
        logger.info("一致性检查完成: {} 条法规, {} 个问题", statutes.size(), issues.size());
        return report;
    }

    private boolean canApplyTogether(Statute first, Statute second) throws VerifierException {
        Optional<Condition> firstPre = first.combinedPreconditions();
        Optional<Condition> secondPre = second.combinedPreconditions();
        if (firstPre.isPresent() && secondPre.isPresent()) {
            return !verifier.contradict(firstPre.get(), secondPre.get());
        }
        if (firstPre.isPresent()) {
            return verifier.isSatisfiable(firstPre.get());
        }
        if (secondPre.isPresent()) {
            return verifier.isSatisfiable(secondPre.get());
        }
        return true;
    }
}
