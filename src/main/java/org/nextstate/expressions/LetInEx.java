package org.nextstate.expressions;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 作用域内的 LET 绑定：{@code LET name == definition IN body}。
 * 只支持零元定义。
 */
@Getter
public final class LetInEx extends TlaEx {

    private final String name;
    private final TlaEx definition;
    private final TlaEx body;

    public LetInEx(String name, TlaEx definition, TlaEx body) {
        this.name = Objects.requireNonNull(name, "Binding name cannot be null.");
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null.");
        this.body = Objects.requireNonNull(body, "Body cannot be null.");
    }

    @Override
    public List<TlaEx> getChildren() {
        return List.of(definition, body);
    }

    @Override
    public String toString() {
        return "LET " + name + " == " + definition + " IN " + body;
    }
}
