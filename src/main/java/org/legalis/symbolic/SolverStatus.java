package org.legalis.symbolic;

import com.microsoft.z3.Status;

/**
 * 一次 check 的结果。
 */
public enum SolverStatus {
    SAT,
    UNSAT,
    UNKNOWN;

    public static SolverStatus fromZ3(Status status) {
        return switch (status) {
            case SATISFIABLE -> SAT;
            case UNSATISFIABLE -> UNSAT;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
