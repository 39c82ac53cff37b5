package org.nextstate.expressions;

/**
 * 公式树中可出现的运算符。
 * 只覆盖已通过片段检查的 next-state 公式会用到的运算符。
 */
public enum TlaOper {

    /**
     * 运算符枚举, arity 为 -1 表示任意元
     */
    AND("/\\", -1),
    OR("\\/", -1),
    NOT("~", 1),
    IMPLIES("=>", 2),
    EQUIV("<=>", 2),
    EXISTS("\\E", 3),     // \E x \in S : body
    FORALL("\\A", 3),     // \A x \in S : body
    IN("\\in", 2),
    NOTIN("\\notin", 2),
    PRIME("'", 1),
    EQ("=", 2),
    NE("/=", 2),
    LT("<", 2),
    LE("<=", 2),
    GT(">", 2),
    GE(">=", 2),
    PLUS("+", 2),
    MINUS("-", 2),
    ENUM_SET("{}", -1),
    INT_RANGE("..", 2),
    ASSIGN_IN(":\\in", 2);  // 被选中的赋值 x' :\in S

    private final String symbol;
    private final int arity;

    TlaOper(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    /**
     * 检查给定的参数个数是否符合此运算符的元数。
     */
    public boolean acceptsArity(int argCount) {
        return arity < 0 || arity == argCount;
    }

    /**
     * 是否为有界量词 (\E, \A)。
     */
    public boolean isQuantifier() {
        return this == EXISTS || this == FORALL;
    }

    /**
     * 是否为布尔联结词 (/\, \/)。
     */
    public boolean isJunction() {
        return this == AND || this == OR;
    }
}
