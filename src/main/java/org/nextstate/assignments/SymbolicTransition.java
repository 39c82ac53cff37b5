package org.nextstate.assignments;

import lombok.Getter;
import org.nextstate.expressions.TlaEx;

import java.util.List;
import java.util.Objects;

/**
 * 一条符号迁移：按求值顺序排列的赋值叶子，以及只保留本分支析取支的守卫公式。
 * 此类是不可变的。
 */
@Getter
public final class SymbolicTransition {

    private final List<Integer> assignments;
    private final TlaEx guard;

    public SymbolicTransition(List<Integer> assignments, TlaEx guard) {
        this.assignments = List.copyOf(Objects.requireNonNull(assignments, "Assignments cannot be null."));
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null.");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicTransition that = (SymbolicTransition) o;
        return assignments.equals(that.assignments) && guard.equals(that.guard);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignments, guard);
    }

    @Override
    public String toString() {
        return "SymbolicTransition(" + assignments + ", " + guard + ")";
    }
}
