package org.legalis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 Z3 Solver 的会话实现。超时在构造时固定，reset 之后重新应用。
 * Context 由调用方（SmtVerifier）拥有和关闭。
 */
public class Z3SolverSession implements SolverSession {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverSession.class);

    private final Context ctx;
    private final Solver solver;
    private final Params params;
    private Status lastStatus;
    private Model model;

    public Z3SolverSession(Context ctx, VerifierSettings settings) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        Objects.requireNonNull(settings, "VerifierSettings cannot be null.");
        this.solver = ctx.mkSolver(settings.getLogic());
        this.params = ctx.mkParams();
        this.params.add("timeout", settings.getTimeoutMillis());
        this.solver.setParameters(params);
        logger.debug("Z3SolverSession 已创建: logic={}, timeout={}ms", settings.getLogic(), settings.getTimeoutMillis());
    }

    @Override
    public void reset() {
        solver.reset();
        solver.setParameters(params);
        lastStatus = null;
        model = null;
    }

    @Override
    public void add(BoolExpr formula) {
        solver.add(formula);
    }

    @Override
    public void addTracked(BoolExpr formula, BoolExpr tracker) {
        solver.assertAndTrack(formula, tracker);
    }

    @Override
    public SolverStatus check() {
        model = null;
        lastStatus = solver.check();
        logger.debug("Z3 check 结果: {}", lastStatus);
        return SolverStatus.fromZ3(lastStatus);
    }

    @Override
    public Optional<Long> evaluate(IntExpr variable, boolean completion) {
        if (lastStatus != Status.SATISFIABLE) {
            return Optional.empty();
        }
        if (model == null) {
            model = solver.getModel();
        }
        Expr<?> value = model.eval(variable, completion);
        if (value instanceof IntNum) {
            return Optional.of(((IntNum) value).getBigInteger().longValueExact());
        }
        return Optional.empty();
    }

    @Override
    public List<BoolExpr> getUnsatCore() {
        if (lastStatus != Status.UNSATISFIABLE) {
            return List.of();
        }
        return Arrays.asList(solver.getUnsatCore());
    }

    @Override
    public String getReasonUnknown() {
        return solver.getReasonUnknown();
    }

    @Override
    public void close() {
        // Solver 的原生对象随 Context 一起释放
        model = null;
        lastStatus = null;
        logger.debug("Z3SolverSession 已关闭");
    }
}
