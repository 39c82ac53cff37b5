package org.nextstate.assignments;

import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.NameEx;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.TlaOper;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 赋值候选叶子 {@code v' \in S} 的识别，以及 must-precede 关系。
 */
public final class Leaves {

    private Leaves() {
    }

    /**
     * 如果 ex 的形状是 {@code v' \in S}（左侧恰为单个带撇的名字），返回 v。
     * @param ex 任意表达式。
     * @return 被赋值的变量名；形状不符时为空。
     */
    public static Optional<String> assignedVariable(TlaEx ex) {
        if (ex instanceof OperEx) {
            OperEx in = (OperEx) ex;
            if (in.getOper() == TlaOper.IN && in.arg(0) instanceof OperEx) {
                OperEx prime = (OperEx) in.arg(0);
                if (prime.getOper() == TlaOper.PRIME && prime.arg(0) instanceof NameEx) {
                    return Optional.of(((NameEx) prime.arg(0)).getName());
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isLeaf(TlaEx ex) {
        return assignedVariable(ex).isPresent();
    }

    /**
     * 叶子的右侧集合表达式；不是叶子时为空。
     */
    public static Optional<TlaEx> rightHandSide(TlaEx ex) {
        return isLeaf(ex) ? Optional.of(((OperEx) ex).arg(1)) : Optional.empty();
    }

    /**
     * 收集表达式中所有带撇的变量名（不论嵌套深度），以不带撇的形式返回。
     */
    public static Set<String> findPrimes(TlaEx ex) {
        Set<String> names = new TreeSet<>();
        collectPrimes(ex, names);
        return names;
    }

    private static void collectPrimes(TlaEx ex, Set<String> acc) {
        if (ex instanceof OperEx && ((OperEx) ex).getOper() == TlaOper.PRIME && ((OperEx) ex).arg(0) instanceof NameEx) {
            acc.add(((NameEx) ((OperEx) ex).arg(0)).getName());
            return;
        }
        for (TlaEx child : ex.getChildren()) {
            collectPrimes(child, acc);
        }
    }

    /**
     * 叶子 id 的左侧变量。
     */
    public static Optional<String> lvar(ExprIndex index, int id) {
        return index.find(id).flatMap(Leaves::assignedVariable);
    }

    /**
     * 叶子 id 右侧出现的带撇变量。
     */
    public static Set<String> rvars(ExprIndex index, int id) {
        return index.find(id)
                .flatMap(Leaves::rightHandSide)
                .map(Leaves::findPrimes)
                .orElseGet(TreeSet::new);
    }

    /**
     * i 必须先于 j 求值：i 赋值的变量以带撇形式出现在 j 的右侧。
     */
    public static boolean mustPrecede(ExprIndex index, int i, int j) {
        Optional<String> assigned = lvar(index, i);
        return assigned.isPresent() && rvars(index, j).contains(assigned.get());
    }
}
