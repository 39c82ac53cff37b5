package org.nextstate.expressions;

import java.util.Arrays;

/**
 * 构造公式树的静态工厂方法。
 */
public final class Tla {

    private Tla() {
    }

    public static NameEx name(String name) {
        return new NameEx(name);
    }

    public static ValEx bool(boolean value) {
        return ValEx.ofBool(value);
    }

    public static ValEx integer(long value) {
        return ValEx.ofInt(value);
    }

    public static OperEx prime(String variable) {
        return new OperEx(TlaOper.PRIME, name(variable));
    }

    public static OperEx prime(TlaEx ex) {
        return new OperEx(TlaOper.PRIME, ex);
    }

    public static OperEx and(TlaEx... args) {
        return new OperEx(TlaOper.AND, args);
    }

    public static OperEx or(TlaEx... args) {
        return new OperEx(TlaOper.OR, args);
    }

    public static OperEx not(TlaEx arg) {
        return new OperEx(TlaOper.NOT, arg);
    }

    public static OperEx in(TlaEx element, TlaEx set) {
        return new OperEx(TlaOper.IN, element, set);
    }

    /**
     * 赋值候选 {@code variable' \in set}。
     */
    public static OperEx primeIn(String variable, TlaEx set) {
        return in(prime(variable), set);
    }

    public static OperEx eq(TlaEx left, TlaEx right) {
        return new OperEx(TlaOper.EQ, left, right);
    }

    public static OperEx lt(TlaEx left, TlaEx right) {
        return new OperEx(TlaOper.LT, left, right);
    }

    public static OperEx plus(TlaEx left, TlaEx right) {
        return new OperEx(TlaOper.PLUS, left, right);
    }

    public static OperEx enumSet(TlaEx... elements) {
        return new OperEx(TlaOper.ENUM_SET, elements);
    }

    public static OperEx intSet(long... values) {
        return new OperEx(TlaOper.ENUM_SET, Arrays.stream(values).mapToObj(ValEx::ofInt).toArray(TlaEx[]::new));
    }

    public static OperEx exists(String variable, TlaEx domain, TlaEx body) {
        return new OperEx(TlaOper.EXISTS, name(variable), domain, body);
    }

    public static OperEx forall(String variable, TlaEx domain, TlaEx body) {
        return new OperEx(TlaOper.FORALL, name(variable), domain, body);
    }

    public static LetInEx letIn(String name, TlaEx definition, TlaEx body) {
        return new LetInEx(name, definition, body);
    }
}
