package org.nextstate.expressions.delta;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 赋值分析使用的布尔中间表示 (delta 公式)。
 * 变体是封闭的：构造函数私有，只能通过静态工厂创建。
 * 所有子类都不可变，相等性是结构相等。
 */
public abstract class BoolFormula {

    private BoolFormula() {
    }

    public static final False FALSE = new False();

    public static BoolFormula and(BoolFormula... args) {
        return new And(Arrays.asList(args));
    }

    public static BoolFormula and(List<BoolFormula> args) {
        return new And(args);
    }

    public static BoolFormula or(BoolFormula... args) {
        return new Or(Arrays.asList(args));
    }

    public static BoolFormula or(List<BoolFormula> args) {
        return new Or(args);
    }

    public static BoolFormula neg(BoolFormula arg) {
        return new Neg(arg);
    }

    public static BoolFormula implies(BoolFormula lhs, BoolFormula rhs) {
        return new Implies(lhs, rhs);
    }

    public static BoolFormula variable(int id) {
        return new Variable(id);
    }

    /** rank(i) < rank(j) */
    public static BoolFormula lt(int i, int j) {
        return new LtFns(i, j);
    }

    /** rank(i) != rank(j) */
    public static BoolFormula ne(int i, int j) {
        return new NeFns(i, j);
    }

    public static final class False extends BoolFormula {
        private False() {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof False;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "false";
        }
    }

    /**
     * n 元联结词的公共部分。
     */
    @Getter
    public abstract static class Junction extends BoolFormula {
        private final List<BoolFormula> args;

        private Junction(List<BoolFormula> args) {
            this.args = List.copyOf(Objects.requireNonNull(args, "Arguments cannot be null."));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return args.equals(((Junction) o).args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass().getSimpleName(), args);
        }

        protected String join(String symbol) {
            return "(" + args.stream().map(BoolFormula::toString).collect(Collectors.joining(" " + symbol + " ")) + ")";
        }
    }

    public static final class And extends Junction {
        private And(List<BoolFormula> args) {
            super(args);
        }

        @Override
        public String toString() {
            return join("&");
        }
    }

    public static final class Or extends Junction {
        private Or(List<BoolFormula> args) {
            super(args);
        }

        @Override
        public String toString() {
            return join("|");
        }
    }

    @Getter
    public static final class Neg extends BoolFormula {
        private final BoolFormula arg;

        private Neg(BoolFormula arg) {
            this.arg = Objects.requireNonNull(arg, "Argument cannot be null.");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Neg && arg.equals(((Neg) o).arg);
        }

        @Override
        public int hashCode() {
            return Objects.hash("neg", arg);
        }

        @Override
        public String toString() {
            return "!" + arg;
        }
    }

    @Getter
    public static final class Implies extends BoolFormula {
        private final BoolFormula lhs;
        private final BoolFormula rhs;

        private Implies(BoolFormula lhs, BoolFormula rhs) {
            this.lhs = Objects.requireNonNull(lhs, "LHS cannot be null.");
            this.rhs = Objects.requireNonNull(rhs, "RHS cannot be null.");
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Implies)) {
                return false;
            }
            Implies that = (Implies) o;
            return lhs.equals(that.lhs) && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash("implies", lhs, rhs);
        }

        @Override
        public String toString() {
            return "(" + lhs + " -> " + rhs + ")";
        }
    }

    /**
     * 命题原子：叶子 id 是否被选入赋值策略。
     */
    @Getter
    public static final class Variable extends BoolFormula {
        private final int id;

        private Variable(int id) {
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && id == ((Variable) o).id;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return "A" + id;
        }
    }

    /**
     * 二元秩关系的公共部分。
     */
    @Getter
    public abstract static class RankRelation extends BoolFormula {
        private final int i;
        private final int j;

        private RankRelation(int i, int j) {
            this.i = i;
            this.j = j;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            RankRelation that = (RankRelation) o;
            return i == that.i && j == that.j;
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass().getSimpleName(), i, j);
        }
    }

    public static final class LtFns extends RankRelation {
        private LtFns(int i, int j) {
            super(i, j);
        }

        @Override
        public String toString() {
            return "R(" + getI() + ") < R(" + getJ() + ")";
        }
    }

    public static final class NeFns extends RankRelation {
        private NeFns(int i, int j) {
            super(i, j);
        }

        @Override
        public String toString() {
            return "R(" + getI() + ") != R(" + getJ() + ")";
        }
    }
}
