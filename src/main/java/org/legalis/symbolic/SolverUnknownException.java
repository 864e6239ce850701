package org.legalis.symbolic;

import lombok.Getter;

/**
 * 求解器返回 UNKNOWN（超时、被取消或超出理论能力）。
 * 调用方不能把它当作 SAT 或 UNSAT 处理。
 */
@Getter
public class SolverUnknownException extends VerifierException {

    private final String reason;

    public SolverUnknownException(String reason) {
        super("Solver returned UNKNOWN: " + reason);
        this.reason = reason;
    }
}
