package org.nextstate.assignments;

import org.nextstate.expressions.LetInEx;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.TlaOper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 为一个分支赋值集重建 (有序赋值, 守卫) 对。
 */
public final class TransitionReconstructor {

    private TransitionReconstructor() {
    }

    public static SymbolicTransition reconstruct(TlaEx phi, Set<Integer> branch, List<Integer> strategy, LabelMap labels) {
        Objects.requireNonNull(phi, "Formula cannot be null.");
        Objects.requireNonNull(branch, "Branch cannot be null.");
        return new SymbolicTransition(order(branch, strategy), filterGuard(phi, branch, labels));
    }

    /**
     * 策略中属于该分支的元素，保持策略顺序。
     */
    public static List<Integer> order(Set<Integer> branch, List<Integer> strategy) {
        return strategy.stream().filter(branch::contains).collect(Collectors.toList());
    }

    /**
     * 自顶向下重建公式：每个析取节点若有子支带本分支的赋值，就替换为那唯一的子支；
     * 没有子支带赋值的析取保持原样。未改变的子树返回原节点实例。
     * <p>
     * 同一个叶子节点被两个析取支共享时（例如 {@code (l /\ y = 1) \/ (l /\ y = 2)}），
     * 两个子支都带有它的标签，无法确定保留哪一支，按多于一个子支处理。
     *
     * @throws IllegalStateException 如果某个析取有多于一个子支带本分支的赋值，包括上述共享叶子的情形。
     */
    public static TlaEx filterGuard(TlaEx ex, Set<Integer> branch, LabelMap labels) {
        if (ex instanceof OperEx) {
            OperEx oper = (OperEx) ex;
            if (oper.getOper() == TlaOper.OR) {
                List<TlaEx> carrying = oper.getArgs().stream()
                        .filter(arg -> !Collections.disjoint(labels.labelsAt(arg), branch))
                        .collect(Collectors.toList());
                if (carrying.size() > 1) {
                    throw new IllegalStateException("Branch " + branch + " is spread over " + carrying.size()
                            + " disjuncts of node " + oper.getId());
                }
                if (carrying.size() == 1) {
                    return filterGuard(carrying.get(0), branch, labels);
                }
                return oper;
            }
            List<TlaEx> newArgs = new ArrayList<>(oper.getArgs().size());
            for (TlaEx arg : oper.getArgs()) {
                newArgs.add(filterGuard(arg, branch, labels));
            }
            return oper.withArgs(newArgs);
        }
        if (ex instanceof LetInEx) {
            LetInEx letIn = (LetInEx) ex;
            TlaEx body = filterGuard(letIn.getBody(), branch, labels);
            return body == letIn.getBody() ? letIn : new LetInEx(letIn.getName(), letIn.getDefinition(), body);
        }
        return ex;
    }
}
