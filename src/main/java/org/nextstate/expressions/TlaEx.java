package org.nextstate.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 公式树中的一个节点。
 * 变体是封闭的：{@link ValEx}、{@link NameEx}、{@link OperEx}、{@link LetInEx}。
 * 每个节点在构造时获得一个进程内唯一且不会被重用的 ID，节点一经创建不可修改。
 * 相等性基于 ID。
 */
public abstract class TlaEx {

    private static final Logger logger = LoggerFactory.getLogger(TlaEx.class);

    // AtomicInteger 保证唯一性和线程安全
    private static final AtomicInteger NEXT_ID = new AtomicInteger(1);

    @Getter
    private final int id;

    /**
     * 只允许本包内的子类，保证变体封闭。
     */
    TlaEx() {
        this.id = NEXT_ID.getAndIncrement();
        logger.trace("分配节点 ID {}", id);
    }

    /**
     * 直接子节点，按求值顺序排列。叶子返回空列表。
     */
    public List<TlaEx> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((TlaEx) o).id;
    }

    @Override
    public final int hashCode() {
        return Integer.hashCode(id);
    }
}
