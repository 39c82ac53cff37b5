package org.nextstate.symbolic;

/**
 * 求解器无法给出 SAT/UNSAT 结论：内部错误、超时或返回 UNKNOWN。
 * 与"不存在赋值策略"不同，后者用空结果表示。
 */
public class SolverUnavailableException extends RuntimeException {

    public SolverUnavailableException(String message) {
        super(message);
    }

    public SolverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
