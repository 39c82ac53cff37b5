package org.nextstate.assignments;

import org.nextstate.expressions.LetInEx;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 自底向上地给公式树的每个节点打上标签：其子树中出现的策略叶子。
 */
public final class TreeLabeler {

    private static final Logger logger = LoggerFactory.getLogger(TreeLabeler.class);

    private TreeLabeler() {
    }

    /**
     * @param phi      公式树的根。
     * @param strategy 赋值策略（作为集合）。
     * @return 经过一致性检查的标签。
     */
    public static LabelMap label(TlaEx phi, Set<Integer> strategy) {
        Objects.requireNonNull(phi, "Formula cannot be null.");
        Objects.requireNonNull(strategy, "Strategy cannot be null.");
        Map<Integer, Set<Integer>> labels = new HashMap<>();
        labelNode(phi, strategy, labels);
        LabelMap labelMap = new LabelMap(labels);
        labelMap.verifyConsistency(phi, strategy);
        logger.debug("标记了 {} 个节点", labelMap.size());
        return labelMap;
    }

    private static Set<Integer> labelNode(TlaEx ex, Set<Integer> strategy, Map<Integer, Set<Integer>> labels) {
        if (Leaves.isLeaf(ex)) {
            if (strategy.contains(ex.getId())) {
                Set<Integer> own = Set.of(ex.getId());
                labels.put(ex.getId(), own);
                return own;
            }
            return Collections.emptySet();
        }
        if (ex instanceof OperEx || ex instanceof LetInEx) {
            Set<Integer> union = new HashSet<>();
            for (TlaEx child : ex.getChildren()) {
                union.addAll(labelNode(child, strategy, labels));
            }
            Set<Integer> label = Collections.unmodifiableSet(union);
            labels.put(ex.getId(), label);
            return label;
        }
        return Collections.emptySet();
    }
}
