package org.nextstate.assignments;

import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 枚举策略中能同时出现在一条求值分支上的叶子集合（"好"赋值集）。
 */
public final class BranchEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(BranchEnumerator.class);

    private BranchEnumerator() {
    }

    /**
     * 判断候选赋值集在节点 ex 处是否位于同一分支上。
     * <ul>
     *   <li>空集总是好的。</li>
     *   <li>候选集不被 ex 的标签包含时，ex 的子树无法见证它，不是好的。</li>
     *   <li>合取：所有子树同时可达，候选集可以任意分布，分别在各子树上检查与其标签的交集。</li>
     *   <li>析取：候选集必须整体落在同一个析取支中。</li>
     *   <li>量词：看量词体。</li>
     *   <li>其它节点：通过包含检查即为好。</li>
     * </ul>
     */
    public static boolean isGood(TlaEx ex, LabelMap labels, Set<Integer> candidate) {
        if (candidate.isEmpty()) {
            return true;
        }
        if (!labels.labelsAt(ex).containsAll(candidate)) {
            return false;
        }
        if (!(ex instanceof OperEx)) {
            return true;
        }
        OperEx oper = (OperEx) ex;
        switch (oper.getOper()) {
            case AND:
                for (TlaEx arg : oper.getArgs()) {
                    Set<Integer> restricted = new HashSet<>(candidate);
                    restricted.retainAll(labels.labelsAt(arg));
                    if (!isGood(arg, labels, restricted)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (TlaEx arg : oper.getArgs()) {
                    if (isGood(arg, labels, candidate)) {
                        return true;
                    }
                }
                return false;
            case EXISTS:
            case FORALL:
                return isGood(oper.arg(2), labels, candidate);
            default:
                return true;
        }
    }

    /**
     * 按变量分组后逐个变量扩展：从只含空集的列表出发，
     * 用该变量的每个候选叶子扩展已有的每个集合，只保留在根处仍是好的扩展。
     *
     * @param phi      公式树的根。
     * @param labels   标签。
     * @param strategy 赋值策略（有序）。
     * @param index    根为 phi 的查找表。
     * @return 每条分支一个赋值集。
     */
    public static List<Set<Integer>> enumerate(TlaEx phi, LabelMap labels, List<Integer> strategy, ExprIndex index) {
        Map<String, List<Integer>> byVariable = new TreeMap<>();
        for (Integer leafId : strategy) {
            String variable = Leaves.lvar(index, leafId)
                    .orElseThrow(() -> new IllegalArgumentException("Strategy element " + leafId + " is not an assignment candidate"));
            byVariable.computeIfAbsent(variable, v -> new ArrayList<>()).add(leafId);
        }

        List<Set<Integer>> current = List.of(Collections.emptySet());
        for (Map.Entry<String, List<Integer>> entry : byVariable.entrySet()) {
            List<Set<Integer>> next = new ArrayList<>();
            for (Integer leafId : entry.getValue()) {
                for (Set<Integer> partial : current) {
                    Set<Integer> extended = new LinkedHashSet<>(partial);
                    extended.add(leafId);
                    if (isGood(phi, labels, extended)) {
                        next.add(Collections.unmodifiableSet(extended));
                    }
                }
            }
            logger.debug("变量 {} 之后剩余 {} 个分支", entry.getKey(), next.size());
            current = next;
        }
        return current;
    }
}
