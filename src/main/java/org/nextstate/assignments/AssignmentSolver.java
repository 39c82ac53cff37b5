package org.nextstate.assignments;

import lombok.Getter;
import org.nextstate.core.SolverConfig;
import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.TlaEx;
import org.nextstate.symbolic.ConstraintSolver;
import org.nextstate.symbolic.SmtSpec;
import org.nextstate.symbolic.SolverResult;
import org.nextstate.symbolic.Z3ConstraintSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 赋值问题求解的入口。
 * <ol>
 *   <li>从 next 公式和状态变量集合得到 SMT 问题 ({@link #makeSpec})。</li>
 *   <li>交给约束求解器，取得一个好的赋值策略 ({@link #getStrategy})。</li>
 *   <li>按策略把公式拆成若干符号迁移 ({@link #getSymbNexts}, {@link #getSymbolicTransitions})。</li>
 * </ol>
 * 每次调用都是独立的纯计算，实例不持有跨调用的可变状态。
 */
@Getter
public final class AssignmentSolver {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSolver.class);

    private final ConstraintSolver solver;
    private final SolverConfig config;
    private final SmtEncoder encoder;
    private final StrategyExtractor extractor;

    /**
     * 使用 classpath 上的 {@value SolverConfig#DEFAULT_RESOURCE} 配置和 Z3。
     */
    public AssignmentSolver() {
        this(SolverConfig.load(SolverConfig.DEFAULT_RESOURCE));
    }

    public AssignmentSolver(SolverConfig config) {
        this(new Z3ConstraintSolver(config), config);
    }

    public AssignmentSolver(ConstraintSolver solver, SolverConfig config) {
        this.solver = Objects.requireNonNull(solver, "Constraint solver cannot be null.");
        this.config = Objects.requireNonNull(config, "Solver config cannot be null.");
        this.encoder = new SmtEncoder(config);
        this.extractor = new StrategyExtractor(config);
    }

    /**
     * 生成 SMT 问题，可满足当且仅当该公式的赋值问题有解。
     */
    public SmtSpec makeSpec(Set<String> variables, TlaEx phi) {
        return encoder.encode(variables, phi);
    }

    /**
     * 同 {@link #makeSpec(Set, TlaEx)}，并把完整的 SMT 文件写到 file。
     */
    public SmtSpec makeSpec(Set<String> variables, TlaEx phi, Path file) {
        return encoder.encode(variables, phi, file);
    }

    /**
     * @param spec 由 {@link #makeSpec} 得到的问题。
     * @return 无解时为空；否则为按秩升序排列的叶子 id。
     */
    public Optional<List<Integer>> getStrategy(SmtSpec spec) {
        SolverResult result = solver.solve(spec);
        return extractor.extract(result);
    }

    public Optional<List<Integer>> getStrategy(Set<String> variables, TlaEx phi) {
        return getStrategy(makeSpec(variables, phi));
    }

    public Optional<List<Integer>> getStrategy(Set<String> variables, TlaEx phi, Path file) {
        return getStrategy(makeSpec(variables, phi, file));
    }

    /**
     * 按给定策略把公式拆成符号迁移：标记、枚举分支、重建守卫。
     * @param phi      next 公式。
     * @param strategy 好的赋值策略。
     * @return 每条分支一个符号迁移。
     */
    public List<SymbolicTransition> getSymbNexts(TlaEx phi, List<Integer> strategy) {
        Objects.requireNonNull(phi, "Formula cannot be null.");
        Objects.requireNonNull(strategy, "Strategy cannot be null.");
        Set<Integer> strategySet = new HashSet<>(strategy);
        LabelMap labels = TreeLabeler.label(phi, strategySet);
        List<Set<Integer>> branches = BranchEnumerator.enumerate(phi, labels, strategy, ExprIndex.of(phi));

        List<SymbolicTransition> transitions = new ArrayList<>(branches.size());
        for (Set<Integer> branch : branches) {
            transitions.add(TransitionReconstructor.reconstruct(phi, branch, strategy, labels));
        }
        logger.info("公式 {} 拆分为 {} 个符号迁移", phi.getId(), transitions.size());
        return transitions;
    }

    public Optional<List<SymbolicTransition>> getSymbolicTransitions(Set<String> variables, TlaEx phi) {
        return getStrategy(variables, phi).map(strategy -> getSymbNexts(phi, strategy));
    }
}
