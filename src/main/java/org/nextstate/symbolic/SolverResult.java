package org.nextstate.symbolic;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 约束求解器的一次回答：不可满足，或一个模型。
 * 模型由每个布尔常量的取值和模型中出现的全部一元函数组成。
 * 此类是不可变的。
 */
@Getter
public final class SolverResult {

    public enum Status {
        UNSATISFIABLE,
        SATISFIABLE
    }

    private static final SolverResult UNSAT = new SolverResult(Status.UNSATISFIABLE, Collections.emptyMap(), Collections.emptyList());

    private final Status status;
    private final Map<String, Boolean> constants;
    private final List<RankFunction> functions;

    private SolverResult(Status status, Map<String, Boolean> constants, List<RankFunction> functions) {
        this.status = status;
        this.constants = constants;
        this.functions = functions;
    }

    public static SolverResult unsatisfiable() {
        return UNSAT;
    }

    /**
     * @param constants 布尔常量名到取值的映射。
     * @param functions 模型中的函数解释，正常情况下至多一个。
     */
    public static SolverResult model(Map<String, Boolean> constants, List<RankFunction> functions) {
        Objects.requireNonNull(constants, "Constants cannot be null.");
        Objects.requireNonNull(functions, "Functions cannot be null.");
        return new SolverResult(Status.SATISFIABLE,
                Collections.unmodifiableMap(new TreeMap<>(constants)),
                List.copyOf(functions));
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    @Override
    public String toString() {
        if (!isSatisfiable()) {
            return "UNSAT";
        }
        return "SAT(constants=" + constants + ", functions=" + functions + ")";
    }
}
