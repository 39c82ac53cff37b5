package org.nextstate.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.nextstate.core.SolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于 Z3 的约束求解器。
 * 每次调用创建并关闭一个独立的 Z3 Context，实例本身不持有可变状态，可在线程间共享。
 */
public final class Z3ConstraintSolver implements ConstraintSolver {

    private static final Logger logger = LoggerFactory.getLogger(Z3ConstraintSolver.class);

    private final SolverConfig config;

    public Z3ConstraintSolver() {
        this(SolverConfig.DEFAULT);
    }

    public Z3ConstraintSolver(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "Solver config cannot be null.");
    }

    @Override
    public SolverResult solve(SmtSpec spec) {
        Objects.requireNonNull(spec, "SMT spec cannot be null.");
        try (Context ctx = new Context()) {
            Solver solver = ctx.mkSolver();
            if (config.getTimeoutMillis() > 0) {
                Params params = ctx.mkParams();
                params.add("timeout", (int) Math.min(Integer.MAX_VALUE, config.getTimeoutMillis()));
                solver.setParameters(params);
            }

            BoolExpr[] assertions = ctx.parseSMTLIB2String(spec.getBody(), null, null, null, null);
            solver.add(assertions);
            logger.debug("向 Z3 提交 {} 条断言", assertions.length);

            Status status = solver.check();
            logger.debug("Z3 结果: {}", status);
            switch (status) {
                case UNSATISFIABLE:
                    return SolverResult.unsatisfiable();
                case SATISFIABLE:
                    return readModel(ctx, solver.getModel(), spec);
                default:
                    throw new SolverUnavailableException("Z3 returned UNKNOWN: " + solver.getReasonUnknown());
            }
        } catch (Z3Exception e) {
            throw new SolverUnavailableException("Z3 failed: " + e.getMessage(), e);
        }
    }

    /**
     * 读取模型：所有布尔常量的取值，以及每个一元函数在叶子 id 上的值。
     */
    private SolverResult readModel(Context ctx, Model model, SmtSpec spec) {
        Map<String, Boolean> constants = new HashMap<>();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            Expr<?> value = model.getConstInterp(decl);
            if (value.isTrue()) {
                constants.put(decl.getName().toString(), Boolean.TRUE);
            } else if (value.isFalse()) {
                constants.put(decl.getName().toString(), Boolean.FALSE);
            }
        }

        List<RankFunction> functions = new ArrayList<>();
        for (FuncDecl<?> decl : model.getFuncDecls()) {
            if (decl.getDomainSize() != 1) {
                logger.warn("模型中出现非一元函数 {}，忽略", decl.getName());
                continue;
            }
            Map<Integer, Integer> values = new HashMap<>();
            for (Integer leafId : spec.getLeafIds()) {
                Expr<?> value = model.eval(ctx.mkApp(decl, ctx.mkInt(leafId)), true);
                if (!(value instanceof IntNum)) {
                    throw new SolverUnavailableException(
                            "Function " + decl.getName() + " has no integer value at " + leafId + ": " + value);
                }
                values.put(leafId, ((IntNum) value).getInt());
            }
            functions.add(new RankFunction(decl.getName().toString(), values));
        }
        logger.debug("模型: {} 个常量, {} 个函数", constants.size(), functions.size());
        return SolverResult.model(constants, functions);
    }
}
