package org.nextstate.assignments;

import org.nextstate.expressions.LetInEx;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 节点 id 到其子树中出现的策略叶子集合的映射。只对一个策略有效。
 * 此类是不可变的。
 */
public final class LabelMap {

    private final Map<Integer, Set<Integer>> labels;

    LabelMap(Map<Integer, Set<Integer>> labels) {
        this.labels = Collections.unmodifiableMap(Objects.requireNonNull(labels, "Labels cannot be null."));
    }

    /**
     * 节点的标签，未标记的节点返回空集。
     */
    public Set<Integer> labelsAt(TlaEx ex) {
        return labels.getOrDefault(ex.getId(), Collections.emptySet());
    }

    public boolean isLabeled(TlaEx ex) {
        return labels.containsKey(ex.getId());
    }

    public int size() {
        return labels.size();
    }

    /**
     * 检查 (公式, 策略, 标签) 三者是否一致，不一致时立即失败。
     * <ul>
     *   <li>运算符节点必须有标签，且等于其子节点标签的并集。</li>
     *   <li>属于策略的叶子标签恰为其自身 id 的单元素集合。</li>
     *   <li>其它节点不带标签。</li>
     * </ul>
     * @throws IllegalStateException 如果标签不一致。
     */
    public void verifyConsistency(TlaEx phi, Set<Integer> strategy) {
        if (strategy.contains(phi.getId())) {
            require(labelsAt(phi).equals(Set.of(phi.getId())) && isLabeled(phi), phi, "strategy leaf must carry its own id");
            return;
        }
        if (Leaves.isLeaf(phi)) {
            require(!isLabeled(phi), phi, "leaf outside the strategy must be unlabeled");
            return;
        }
        if (phi instanceof OperEx || phi instanceof LetInEx) {
            Set<Integer> union = new HashSet<>();
            for (TlaEx child : phi.getChildren()) {
                union.addAll(labelsAt(child));
            }
            require(isLabeled(phi) && labelsAt(phi).equals(union), phi, "label must equal the union of child labels " + union);
            for (TlaEx child : phi.getChildren()) {
                verifyConsistency(child, strategy);
            }
            return;
        }
        require(!isLabeled(phi), phi, "value or name node must be unlabeled");
    }

    private void require(boolean condition, TlaEx ex, String message) {
        if (!condition) {
            throw new IllegalStateException("Inconsistent labeling at node " + ex.getId() + " (" + ex + "), labels "
                    + labelsAt(ex) + ": " + message);
        }
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
