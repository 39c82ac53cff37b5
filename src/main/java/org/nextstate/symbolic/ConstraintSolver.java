package org.nextstate.symbolic;

/**
 * 外部约束求解器的边界。提交一个 SMT 问题，得到一个模型或不可满足的结论。
 */
@FunctionalInterface
public interface ConstraintSolver {

    /**
     * @param spec 待求解的问题。
     * @return 不可满足，或一个模型；模型中每个一元函数都在 {@link SmtSpec#getLeafIds()} 上求值。
     * @throws SolverUnavailableException 如果求解器无法给出结论。
     */
    SolverResult solve(SmtSpec spec);
}
