package org.nextstate.symbolic;

import lombok.Getter;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 发送给约束求解器的 SMT-LIB v2 问题：声明与断言的文本，外加秩函数关心的定义域（叶子 id）。
 * 此类是不可变的。
 */
@Getter
public final class SmtSpec {

    private final String logic;
    /** 声明与断言，不含 set-logic / check-sat 等命令。 */
    private final String body;
    /** 所有被声明的叶子 id，也是秩函数的相关定义域。 */
    private final Set<Integer> leafIds;

    public SmtSpec(String logic, String body, Set<Integer> leafIds) {
        this.logic = Objects.requireNonNull(logic, "Logic cannot be null.");
        this.body = Objects.requireNonNull(body, "Body cannot be null.");
        this.leafIds = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNull(leafIds, "Leaf ids cannot be null.")));
    }

    /**
     * 完整的、可独立求解的 SMT 文件内容，包含 set-logic、check-sat、get-model 与 exit 命令。
     */
    public String toStandalone() {
        return "(set-logic " + logic + ")\n" + body + "\n(check-sat)\n(get-model)\n(exit)\n";
    }

    @Override
    public String toString() {
        return body;
    }
}
