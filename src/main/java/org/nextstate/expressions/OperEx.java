package org.nextstate.expressions;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * n 元运算符应用。
 * 参数列表在构造时拷贝为不可变列表。
 */
@Getter
public final class OperEx extends TlaEx {

    private final TlaOper oper;
    private final List<TlaEx> args;

    public OperEx(TlaOper oper, List<? extends TlaEx> args) {
        this.oper = Objects.requireNonNull(oper, "Operator cannot be null.");
        this.args = List.copyOf(Objects.requireNonNull(args, "Arguments cannot be null."));
        if (!oper.acceptsArity(this.args.size())) {
            throw new IllegalArgumentException(
                    String.format("Operator %s expects %d arguments, got %d", oper, oper.getArity(), this.args.size()));
        }
    }

    public OperEx(TlaOper oper, TlaEx... args) {
        this(oper, Arrays.asList(args));
    }

    public TlaEx arg(int index) {
        return args.get(index);
    }

    @Override
    public List<TlaEx> getChildren() {
        return args;
    }

    /**
     * 用新的参数构造同一运算符的节点。参数与当前完全相同（逐个同一实例）时返回自身，不分配新 ID。
     */
    public OperEx withArgs(List<TlaEx> newArgs) {
        if (newArgs.size() == args.size()) {
            boolean same = true;
            for (int i = 0; i < args.size(); i++) {
                if (newArgs.get(i) != args.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return this;
            }
        }
        return new OperEx(oper, newArgs);
    }

    @Override
    public String toString() {
        return switch (oper) {
            case AND, OR -> "(" + args.stream()
                    .map(TlaEx::toString)
                    .collect(Collectors.joining(" " + oper.getSymbol() + " ")) + ")";
            case NOT -> "~" + args.get(0);
            case PRIME -> args.get(0) + "'";
            case EXISTS, FORALL -> "(" + oper.getSymbol() + " " + args.get(0) + " \\in " + args.get(1) + ": " + args.get(2) + ")";
            case ENUM_SET -> "{" + args.stream().map(TlaEx::toString).collect(Collectors.joining(", ")) + "}";
            default -> "(" + args.get(0) + " " + oper.getSymbol() + " " + args.get(1) + ")";
        };
    }
}
