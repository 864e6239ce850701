package org.legalis.symbolic;

import com.microsoft.z3.Context;

/**
 * 在给定的 Z3 Context 上打开一个求解器会话。
 */
@FunctionalInterface
public interface SolverSessionFactory {

    SolverSession open(Context ctx, VerifierSettings settings);
}
