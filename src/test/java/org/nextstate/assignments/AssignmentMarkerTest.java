package org.nextstate.assignments;

import org.junit.jupiter.api.Test;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.TlaOper;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.nextstate.expressions.Tla.*;

class AssignmentMarkerTest {

    @Test
    void testSelectedLeavesBecomeAssignments() {
        OperEx a = primeIn("x", intSet(1));
        OperEx b = primeIn("x", intSet(2));
        OperEx guard = and(a, b, lt(name("y"), integer(3)));

        TlaEx marked = AssignmentMarker.mark(new SymbolicTransition(List.of(a.getId()), guard));

        assertEquals("((x' :\\in {1}) /\\ (x' \\in {2}) /\\ (y < 3))", marked.toString());
        OperEx root = (OperEx) marked;
        assertAll("marked",
                () -> assertEquals(TlaOper.ASSIGN_IN, ((OperEx) root.arg(0)).getOper()),
                () -> assertSame(b, root.arg(1)),
                () -> assertSame(guard.arg(2), root.arg(2))
        );
    }

    @Test
    void testNothingSelected_SameTree() {
        OperEx guard = and(primeIn("x", intSet(1)), primeIn("y", intSet(2)));

        assertSame(guard, AssignmentMarker.mark(guard, Set.of()));
    }

    @Test
    void testMarkingUnderQuantifier() {
        OperEx a = primeIn("x", enumSet(name("t")));
        OperEx guard = exists("t", intSet(1, 2), a);

        TlaEx marked = AssignmentMarker.mark(guard, Set.of(a.getId()));

        assertEquals("(\\E t \\in {1, 2}: (x' :\\in {t}))", marked.toString());
        // 原树不变
        assertSame(a, guard.arg(2));
    }
}
