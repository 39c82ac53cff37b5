package org.nextstate.expressions;

import lombok.Getter;

import java.util.Objects;

/**
 * 名字引用：状态变量、绑定变量或常量的名字。
 */
@Getter
public final class NameEx extends TlaEx {

    private final String name;

    public NameEx(String name) {
        this.name = Objects.requireNonNull(name, "Name cannot be null.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Name cannot be empty.");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
