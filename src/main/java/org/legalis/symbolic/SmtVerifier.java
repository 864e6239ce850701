package org.legalis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.legalis.expressions.conditions.AndCondition;
import org.legalis.expressions.conditions.Condition;
import org.legalis.expressions.conditions.NotCondition;
import org.legalis.expressions.conditions.OrCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 条件的判定过程：可满足性、永真、矛盾、蕴含以及模型提取。
 * <p>
 * 每个实例独占一个 Z3 Context、一个求解器会话和一个 VariableRegistry。
 * 每次查询前清空断言，但变量声明在整个会话期间保留，
 * 因此不同法规中引用同一属性的条件共享同一个变量。
 * <p>
 * 实例不能被多个线程同时使用，也不能在查询中重入；违反时抛出 IllegalStateException。
 * 求解器返回 UNKNOWN（包括超时）时抛出 SolverUnknownException，绝不当作确定答案。
 * @author Ayalyt
 */
public class SmtVerifier implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SmtVerifier.class);

    @Getter
    private final VerifierSettings settings;
    private final Context ctx;
    @Getter
    private final VariableRegistry registry;
    private final ConditionTranslator translator;
    private final SolverSession session;
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private volatile boolean closed;
    private long trackerCounter;

    @FunctionalInterface
    private interface Query<T> {
        T run() throws VerifierException;
    }

    public SmtVerifier(VerifierSettings settings, SolverSessionFactory sessionFactory) {
        this.settings = Objects.requireNonNull(settings, "VerifierSettings cannot be null.");
        Objects.requireNonNull(sessionFactory, "SolverSessionFactory cannot be null.");
        this.ctx = new Context();
        this.registry = new VariableRegistry(ctx);
        this.translator = new ConditionTranslator(registry);
        this.session = sessionFactory.open(ctx, settings);
        logger.info("SmtVerifier 会话已打开: {}", settings);
    }

    public static SmtVerifier create() {
        return create(VerifierSettings.defaults());
    }

    public static SmtVerifier create(VerifierSettings settings) {
        return new SmtVerifier(settings, Z3SolverSession::new);
    }

    // === 基本查询 ===

    /**
     * 条件是否存在满足赋值。
     * @throws SolverUnknownException 求解器无法判定。
     * @throws UnsupportedConditionException 条件中含有无法编码的构造。
     */
    public boolean isSatisfiable(Condition condition) throws VerifierException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        return runQuery(() -> {
            session.add(translator.translate(condition));
            boolean result = decide("isSatisfiable") == SolverStatus.SAT;
            logger.debug("isSatisfiable({}) = {}", condition, result);
            return result;
        });
    }

    /**
     * 与 isSatisfiable 相同，但 UNKNOWN 作为结果返回而不是抛出。
     */
    public VerificationResult check(Condition condition) throws UnsupportedConditionException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        try {
            return runQuery(() -> {
                session.add(translator.translate(condition));
                SolverStatus status = session.check();
                return switch (status) {
                    case SAT -> VerificationResult.satisfiable(readModel());
                    case UNSAT -> VerificationResult.unsatisfiable();
                    case UNKNOWN -> {
                        String reason = session.getReasonUnknown();
                        logger.warn("check({}): 求解器返回 UNKNOWN ({})", condition, reason);
                        yield VerificationResult.unknown(reason);
                    }
                };
            });
        } catch (UnsupportedConditionException e) {
            throw e;
        } catch (VerifierException e) {
            // check 内部不会抛出 SolverUnknownException
            throw new IllegalStateException("Unexpected verifier failure in check()", e);
        }
    }

    /**
     * 条件在所有赋值下都成立，即其否定不可满足。
     */
    public boolean isTautology(Condition condition) throws VerifierException {
        return tautologyCounterexample(condition).isEmpty();
    }

    /**
     * 返回使条件不成立的一个赋值；条件为永真式时为空。
     */
    public Optional<SatModel> tautologyCounterexample(Condition condition) throws VerifierException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        return runQuery(() -> {
            session.add(ctx.mkNot(translator.translate(condition)));
            Optional<SatModel> counterexample = decide("isTautology") == SolverStatus.SAT
                    ? Optional.of(readModel())
                    : Optional.empty();
            logger.debug("isTautology({}) = {}", condition, counterexample.isEmpty());
            return counterexample;
        });
    }

    /**
     * 两个条件永远不能同时成立。
     */
    public boolean contradict(Condition first, Condition second) throws VerifierException {
        Objects.requireNonNull(first, "First condition cannot be null.");
        Objects.requireNonNull(second, "Second condition cannot be null.");
        return runQuery(() -> {
            session.add(translator.translate(first));
            session.add(translator.translate(second));
            boolean result = decide("contradict") == SolverStatus.UNSAT;
            logger.debug("contradict({}, {}) = {}", first, second, result);
            return result;
        });
    }

    /**
     * premise 是否在所有赋值下蕴含 conclusion（反证：premise ∧ ¬conclusion 不可满足）。
     */
    public boolean implies(Condition premise, Condition conclusion) throws VerifierException {
        return implicationCounterexample(premise, conclusion).isEmpty();
    }

    /**
     * 返回 premise 成立而 conclusion 不成立的一个赋值；蕴含成立时为空。
     */
    public Optional<SatModel> implicationCounterexample(Condition premise, Condition conclusion) throws VerifierException {
        Objects.requireNonNull(premise, "Premise cannot be null.");
        Objects.requireNonNull(conclusion, "Conclusion cannot be null.");
        return runQuery(() -> {
            session.add(translator.translate(premise));
            session.add(ctx.mkNot(translator.translate(conclusion)));
            Optional<SatModel> counterexample = decide("implies") == SolverStatus.SAT
                    ? Optional.of(readModel())
                    : Optional.empty();
            logger.debug("implies({}, {}) = {}", premise, conclusion, counterexample.isEmpty());
            return counterexample;
        });
    }

    public boolean equivalent(Condition first, Condition second) throws VerifierException {
        return implies(first, second) && implies(second, first);
    }

    /**
     * 求一个满足赋值，包含会话中所有已注册的整数变量。不可满足时为空。
     */
    public Optional<SatModel> getModel(Condition condition) throws VerifierException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        return runQuery(() -> {
            session.add(translator.translate(condition));
            if (decide("getModel") == SolverStatus.SAT) {
                return Optional.of(readModel());
            }
            return Optional.empty();
        });
    }

    // === Unsat core ===

    /**
     * 找出一组不能同时成立的条件中导致冲突的那些条件的下标。
     * 求解器给出空 core 时返回全部下标。
     * @throws IllegalArgumentException 条件列表为空，或这些条件可以同时成立。
     */
    public List<Integer> findUnsatCore(List<? extends Condition> conditions) throws VerifierException {
        Objects.requireNonNull(conditions, "Conditions cannot be null.");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("No conditions provided");
        }
        return runQuery(() -> {
            Map<String, Integer> trackerIndex = new HashMap<>();
            for (int i = 0; i < conditions.size(); i++) {
                String trackerName = "__track_" + (trackerCounter++);
                BoolExpr tracker = ctx.mkBoolConst(trackerName);
                session.addTracked(translator.translate(conditions.get(i)), tracker);
                trackerIndex.put(trackerName, i);
            }
            if (decide("findUnsatCore") == SolverStatus.SAT) {
                throw new IllegalArgumentException("Conditions are satisfiable, no unsat core exists");
            }
            List<Integer> core = new ArrayList<>();
            for (BoolExpr tracker : session.getUnsatCore()) {
                Integer index = trackerIndex.get(tracker.toString());
                if (index != null) {
                    core.add(index);
                }
            }
            if (core.isEmpty()) {
                for (int i = 0; i < conditions.size(); i++) {
                    core.add(i);
                }
            }
            core.sort(null);
            logger.debug("findUnsatCore: {} 个条件中 {} 个构成 core: {}", conditions.size(), core.size(), core);
            return List.copyOf(core);
        });
    }

    /**
     * 以可读文本说明为什么这组条件不能同时成立。
     */
    public String explainUnsat(List<? extends Condition> conditions) throws VerifierException {
        List<Integer> core = findUnsatCore(conditions);
        StringBuilder sb = new StringBuilder();
        sb.append("Unsatisfiability Explanation:\n\n");
        sb.append("Total conditions: ").append(conditions.size()).append('\n');
        sb.append("Core conditions causing unsatisfiability: ").append(core.size()).append("\n\n");
        sb.append("The following conditions cannot be satisfied together:\n");
        for (int index : core) {
            sb.append("  [").append(index).append("] ").append(conditions.get(index)).append('\n');
        }
        return sb.toString();
    }

    // === 化简 ===

    /**
     * 消去双重否定，并删去 AND/OR 中被另一侧蕴含的冗余分支。
     * 结果与原条件逻辑等价。
     */
    public SimplificationResult simplify(Condition condition) throws VerifierException {
        Objects.requireNonNull(condition, "Condition cannot be null.");
        Condition simplified = simplifyNode(condition);
        boolean changed = !simplified.equals(condition);
        if (changed) {
            logger.debug("simplify: {} => {}", condition, simplified);
        }
        return new SimplificationResult(simplified, changed);
    }

    private Condition simplifyNode(Condition condition) throws VerifierException {
        switch (condition.getKind()) {
            case NOT: {
                Condition inner = ((NotCondition) condition).getInner();
                if (inner instanceof NotCondition) {
                    return simplifyNode(((NotCondition) inner).getInner());
                }
                Condition simplifiedInner = simplifyNode(inner);
                return simplifiedInner.equals(inner) ? condition : NotCondition.of(simplifiedInner);
            }
            case AND: {
                AndCondition and = (AndCondition) condition;
                Condition left = simplifyNode(and.getLeft());
                Condition right = simplifyNode(and.getRight());
                if (implies(left, right)) {
                    return left;
                }
                if (implies(right, left)) {
                    return right;
                }
                return left.equals(and.getLeft()) && right.equals(and.getRight()) ? condition : AndCondition.of(left, right);
            }
            case OR: {
                OrCondition or = (OrCondition) condition;
                Condition left = simplifyNode(or.getLeft());
                Condition right = simplifyNode(or.getRight());
                if (implies(left, right)) {
                    return right;
                }
                if (implies(right, left)) {
                    return left;
                }
                return left.equals(or.getLeft()) && right.equals(or.getRight()) ? condition : OrCondition.of(left, right);
            }
            default:
                return condition;
        }
    }

    // === 会话管理 ===

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        // 先占用 busy，关闭期间不会有查询开始
        if (!busy.compareAndSet(false, true)) {
            logger.error("SmtVerifier.close: 查询进行中，不能关闭");
            throw new IllegalStateException("Cannot close SmtVerifier while a query is running");
        }
        try {
            if (closed) {
                return;
            }
            closed = true;
            session.close();
            ctx.close();
            logger.info("SmtVerifier 会话已关闭，共注册 {} 个变量", registry.size());
        } finally {
            busy.set(false);
        }
    }

    private <T> T runQuery(Query<T> query) throws VerifierException {
        if (closed) {
            throw new IllegalStateException("SmtVerifier is closed");
        }
        if (!busy.compareAndSet(false, true)) {
            logger.error("SmtVerifier: 检测到并发或重入查询");
            throw new IllegalStateException("SmtVerifier is already running a query; a verifier session must not be shared");
        }
        try {
            // 占用 busy 之后再确认一次，close 可能在两步之间完成
            if (closed) {
                throw new IllegalStateException("SmtVerifier is closed");
            }
            session.reset();
            return query.run();
        } finally {
            busy.set(false);
        }
    }

    /**
     * 执行 check；UNKNOWN 时抛出 SolverUnknownException。
     */
    private SolverStatus decide(String queryName) throws SolverUnknownException {
        SolverStatus status = session.check();
        if (status == SolverStatus.UNKNOWN) {
            String reason = session.getReasonUnknown();
            logger.warn("{}: 求解器返回 UNKNOWN ({})", queryName, reason);
            throw new SolverUnknownException(reason);
        }
        return status;
    }

    private SatModel readModel() {
        Map<String, Long> values = new LinkedHashMap<>();
        for (String name : registry.getIntVariableNames()) {
            IntExpr variable = registry.getOrCreateInt(name);
            session.evaluate(variable, settings.isModelCompletion()).ifPresent(value -> values.put(name, value));
        }
        return new SatModel(values, registry.snapshotInternedValues());
    }
}
