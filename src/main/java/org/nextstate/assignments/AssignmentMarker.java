package org.nextstate.assignments;

import org.nextstate.expressions.LetInEx;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.TlaOper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 在符号迁移的守卫中把被选中的叶子 {@code x' \in S} 改写为赋值 {@code x' :\in S}，
 * 其余叶子仍是成员测试。
 */
public final class AssignmentMarker {

    private AssignmentMarker() {
    }

    public static TlaEx mark(SymbolicTransition transition) {
        Objects.requireNonNull(transition, "Transition cannot be null.");
        return mark(transition.getGuard(), new HashSet<>(transition.getAssignments()));
    }

    public static TlaEx mark(TlaEx ex, Set<Integer> assignments) {
        if (assignments.contains(ex.getId()) && Leaves.isLeaf(ex)) {
            OperEx leaf = (OperEx) ex;
            return new OperEx(TlaOper.ASSIGN_IN, leaf.arg(0), leaf.arg(1));
        }
        if (ex instanceof OperEx) {
            OperEx oper = (OperEx) ex;
            List<TlaEx> newArgs = new ArrayList<>(oper.getArgs().size());
            for (TlaEx arg : oper.getArgs()) {
                newArgs.add(mark(arg, assignments));
            }
            return oper.withArgs(newArgs);
        }
        if (ex instanceof LetInEx) {
            LetInEx letIn = (LetInEx) ex;
            TlaEx body = mark(letIn.getBody(), assignments);
            return body == letIn.getBody() ? letIn : new LetInEx(letIn.getName(), letIn.getDefinition(), body);
        }
        return ex;
    }
}
