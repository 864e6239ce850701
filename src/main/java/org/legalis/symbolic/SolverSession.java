package org.legalis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.IntExpr;

import java.util.List;
import java.util.Optional;

/**
 * 验证器所用的最小求解器接口。
 * 一个会话只属于一个 SmtVerifier，不要求线程安全。
 */
public interface SolverSession extends AutoCloseable {

    /**
     * 清空所有断言。已声明的变量不受影响。
     */
    void reset();

    void add(BoolExpr formula);

    /**
     * 断言 formula，并用布尔字面量 tracker 跟踪它，供 unsat core 使用。
     */
    void addTracked(BoolExpr formula, BoolExpr tracker);

    SolverStatus check();

    /**
     * 在最近一次 SAT 的模型下求整数变量的值。
     * @param variable 整数变量。
     * @param completion 是否为模型中未出现的变量补全一个值。
     * @return 变量的值；没有模型或（不补全时）变量未被赋值则为空。
     */
    Optional<Long> evaluate(IntExpr variable, boolean completion);

    /**
     * 最近一次 UNSAT 的 unsat core，元素是 addTracked 时给出的 tracker。
     */
    List<BoolExpr> getUnsatCore();

    /**
     * 最近一次 UNKNOWN 的原因描述。
     */
    String getReasonUnknown();

    @Override
    void close();
}
