package org.nextstate.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 以某个根节点为范围的 ID 到节点的查找表。
 * 共享子表达式（同一 ID 被多次引用）只登记一次。
 * 此类是不可变的。
 */
public final class ExprIndex {

    private static final Logger logger = LoggerFactory.getLogger(ExprIndex.class);

    private final TlaEx root;
    private final Map<Integer, TlaEx> nodes;

    private ExprIndex(TlaEx root, Map<Integer, TlaEx> nodes) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    /**
     * 遍历以 root 为根的整棵树并建立索引。
     * @param root 公式树的根。
     * @return 查找表。
     */
    public static ExprIndex of(TlaEx root) {
        Objects.requireNonNull(root, "Root expression cannot be null.");
        Map<Integer, TlaEx> nodes = new HashMap<>();
        Deque<TlaEx> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TlaEx ex = stack.pop();
            if (nodes.putIfAbsent(ex.getId(), ex) != null) {
                continue;
            }
            for (TlaEx child : ex.getChildren()) {
                stack.push(child);
            }
        }
        logger.debug("为根节点 {} 建立索引，共 {} 个节点", root.getId(), nodes.size());
        return new ExprIndex(root, nodes);
    }

    public TlaEx getRoot() {
        return root;
    }

    public Optional<TlaEx> find(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * 按 ID 取节点，ID 不在此树中时抛出异常。
     */
    public TlaEx get(int id) {
        TlaEx ex = nodes.get(id);
        if (ex == null) {
            throw new IllegalArgumentException("No node with id " + id + " under root " + root.getId());
        }
        return ex;
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }
}
