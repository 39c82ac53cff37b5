package org.nextstate.assignments;

import org.apache.commons.lang3.tuple.Pair;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.TlaOper;
import org.nextstate.expressions.delta.BoolFormula;
import org.nextstate.expressions.delta.BoolFormulas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 对 next 公式做一次遍历，得到所有候选叶子、依赖/独立关系，以及每个状态变量的 delta 公式。
 * <p>
 * 只有布尔联结词、有界量词和 {@code v' \in S} 叶子有意义，其余形状一律返回无信息结果，
 * 其子树对赋值分析不可见。
 */
public final class DeltaBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DeltaBuilder.class);

    private DeltaBuilder() {
    }

    /**
     * @param phi       next 公式。
     * @param variables 状态变量名集合。
     * @return 叶子集合、依赖/独立关系和化简后的 delta 公式。
     */
    public static DeltaResult build(TlaEx phi, Set<String> variables) {
        Objects.requireNonNull(phi, "Formula cannot be null.");
        Objects.requireNonNull(variables, "Variables cannot be null.");
        Set<String> vars = new TreeSet<>(variables);
        DeltaResult raw = process(phi, vars);

        Map<String, BoolFormula> simplified = new TreeMap<>();
        raw.getDeltas().forEach((v, delta) -> simplified.put(v, BoolFormulas.simplify(delta)));
        logger.debug("delta 构造完成: {} 个叶子, {} 个依赖对", raw.getSeen().size(), raw.getDependent().size());
        return new DeltaResult(raw.getSeen(), raw.getDependent(), raw.getIndependent(), simplified);
    }

    private static DeltaResult process(TlaEx ex, Set<String> vars) {
        if (!(ex instanceof OperEx)) {
            return DeltaResult.empty(vars);
        }
        OperEx oper = (OperEx) ex;
        return switch (oper.getOper()) {
            case AND, OR -> processJunction(oper, vars);
            case IN -> processLeaf(oper, vars);
            // 量词对赋值分析透明
            case EXISTS, FORALL -> process(oper.arg(2), vars);
            default -> DeltaResult.empty(vars);
        };
    }

    private static DeltaResult processLeaf(OperEx leaf, Set<String> vars) {
        Optional<String> assigned = Leaves.assignedVariable(leaf);
        if (assigned.isEmpty()) {
            logger.debug("{} 的左侧不是单个带撇变量，不作为赋值候选", leaf);
            return DeltaResult.empty(vars);
        }
        String name = assigned.get();
        if (!vars.contains(name)) {
            // 仍是叶子，只是不出现在任何状态变量的 delta 中
            logger.debug("{}' 不是状态变量，{} 的 delta 全为 false", name, leaf);
        }
        int id = leaf.getId();
        Map<String, BoolFormula> deltas = new TreeMap<>();
        for (String v : vars) {
            deltas.put(v, v.equals(name) ? BoolFormula.variable(id) : BoolFormula.FALSE);
        }
        return new DeltaResult(Set.of(id), Set.of(Pair.of(id, id)), Set.of(), deltas);
    }

    /**
     * 每个叶子对要么依赖要么独立。合取的所有子树在同一分支上可达，
     * 所以子节点尚未判定的对在合取处为依赖；析取的子树互斥，尚未判定的对为独立。
     * delta 在每一层翻转联结词。
     */
    private static DeltaResult processJunction(OperEx junction, Set<String> vars) {
        boolean isAnd = junction.getOper() == TlaOper.AND;
        List<DeltaResult> children = new ArrayList<>();
        for (TlaEx arg : junction.getArgs()) {
            children.add(process(arg, vars));
        }

        Set<Integer> seen = new TreeSet<>();
        Set<Pair<Integer, Integer>> dependent = new HashSet<>();
        Set<Pair<Integer, Integer>> independent = new HashSet<>();
        for (DeltaResult child : children) {
            seen.addAll(child.getSeen());
            dependent.addAll(child.getDependent());
            independent.addAll(child.getIndependent());
        }

        Map<String, BoolFormula> deltas = new TreeMap<>();
        for (String v : vars) {
            List<BoolFormula> childDeltas = new ArrayList<>();
            for (DeltaResult child : children) {
                childDeltas.add(child.deltaOf(v));
            }
            deltas.put(v, isAnd ? BoolFormula.or(childDeltas) : BoolFormula.and(childDeltas));
        }

        Set<Pair<Integer, Integer>> all = new HashSet<>();
        for (Integer x : seen) {
            for (Integer y : seen) {
                all.add(Pair.of(x, y));
            }
        }

        if (isAnd) {
            all.removeAll(independent);
            return new DeltaResult(seen, all, independent, deltas);
        } else {
            all.removeAll(dependent);
            return new DeltaResult(seen, dependent, all, deltas);
        }
    }
}
