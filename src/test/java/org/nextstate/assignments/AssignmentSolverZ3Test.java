package org.nextstate.assignments;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.nextstate.core.SolverConfig;
import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.OperEx;
import org.nextstate.expressions.TlaEx;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.nextstate.expressions.Tla.*;

/**
 * 使用真实 Z3 的端到端测试。
 */
class AssignmentSolverZ3Test {

    private final AssignmentSolver solver = new AssignmentSolver(SolverConfig.builder().timeoutMillis(10_000L).build());

    @Test
    @DisplayName("单个赋值")
    void testSingleAssignment() {
        OperEx leaf = primeIn("x", intSet(1, 2, 3));

        assertEquals(Optional.of(List.of(leaf.getId())), solver.getStrategy(Set.of("x"), leaf));
    }

    @Test
    @DisplayName("两个析取支各自按依赖排序")
    void testOrderedDisjunction() {
        OperEx a = primeIn("x", intSet(0, 1));
        OperEx b = primeIn("y", enumSet(prime("x")));
        OperEx c = primeIn("y", intSet(0));
        OperEx d = primeIn("x", enumSet(prime("y")));
        OperEx left = and(a, b);
        OperEx right = and(c, d);
        OperEx phi = or(left, right);

        List<SymbolicTransition> transitions = solver.getSymbolicTransitions(Set.of("x", "y"), phi).orElseThrow();

        assertEquals(2, transitions.size());
        assertTrue(transitions.contains(new SymbolicTransition(List.of(a.getId(), b.getId()), left)), transitions::toString);
        assertTrue(transitions.contains(new SymbolicTransition(List.of(c.getId(), d.getId()), right)), transitions::toString);
    }

    @Test
    @DisplayName("右侧只读当前状态时没有排序约束，分支仍然正确")
    void testUnprimedRightHandSides_Unordered() {
        OperEx a = primeIn("x", intSet(0, 1));
        OperEx b = primeIn("y", enumSet(name("x")));
        OperEx c = primeIn("y", intSet(0));
        OperEx d = primeIn("x", enumSet(name("y")));
        OperEx left = and(a, b);
        OperEx right = and(c, d);
        OperEx phi = or(left, right);

        assertFalse(solver.makeSpec(Set.of("x", "y"), phi).getBody().contains("(<"), "no ranking constraint");

        List<SymbolicTransition> transitions = solver.getSymbolicTransitions(Set.of("x", "y"), phi).orElseThrow();

        assertEquals(2, transitions.size());
        for (SymbolicTransition transition : transitions) {
            Set<Integer> assigned = Set.copyOf(transition.getAssignments());
            if (assigned.equals(Set.of(a.getId(), b.getId()))) {
                assertSame(left, transition.getGuard());
            } else {
                assertEquals(Set.of(c.getId(), d.getId()), assigned, transition::toString);
                assertSame(right, transition.getGuard());
            }
        }
    }

    @Test
    @DisplayName("循环依赖无解")
    void testCyclicDependency_Unsatisfiable() {
        OperEx phi = and(primeIn("x", enumSet(prime("y"))), primeIn("y", enumSet(prime("x"))));

        assertEquals(Optional.empty(), solver.getStrategy(Set.of("x", "y"), phi));
    }

    @Test
    @DisplayName("变量没有候选叶子时无解")
    void testMissingVariable_Unsatisfiable() {
        OperEx phi = primeIn("x", intSet(1));

        assertEquals(Optional.empty(), solver.getSymbolicTransitions(Set.of("x", "z"), phi));
    }

    @Test
    @DisplayName("合取中的重复赋值：一个是赋值，另一个是守卫")
    void testRepeatedAssignmentInConjunction() {
        OperEx first = primeIn("x", intSet(1));
        OperEx second = primeIn("x", intSet(2));
        OperEx phi = and(first, second);

        List<SymbolicTransition> transitions = solver.getSymbolicTransitions(Set.of("x"), phi).orElseThrow();

        assertEquals(1, transitions.size());
        SymbolicTransition transition = transitions.get(0);
        assertEquals(1, transition.getAssignments().size());
        assertTrue(Set.of(first.getId(), second.getId()).contains(transition.getAssignments().get(0)));
        assertSame(phi, transition.getGuard());
    }

    @Nested
    class PropertyTests {

        private final TlaEx phi = or(
                and(primeIn("x", intSet(0, 1)), or(primeIn("y", enumSet(prime("x"))), primeIn("y", intSet(5)))),
                exists("t", intSet(1, 2), and(primeIn("y", enumSet(name("t"))), primeIn("x", enumSet(prime("y"))))),
                and(primeIn("x", intSet(7)), primeIn("x", intSet(8)), primeIn("y", intSet(9))));
        private final Set<String> variables = Set.of("x", "y");

        @Test
        @DisplayName("每条迁移对每个变量恰好赋值一次")
        void testEachTransitionAssignsEveryVariableOnce() {
            List<SymbolicTransition> transitions = solver.getSymbolicTransitions(variables, phi).orElseThrow();
            ExprIndex index = ExprIndex.of(phi);

            assertEquals(4, transitions.size(), transitions::toString);
            for (SymbolicTransition transition : transitions) {
                Set<String> assigned = new HashSet<>();
                for (Integer leafId : transition.getAssignments()) {
                    String variable = Leaves.lvar(index, leafId).orElseThrow();
                    assertTrue(assigned.add(variable), () -> variable + " assigned twice in " + transition);
                }
                assertEquals(variables, assigned, transition::toString);
            }
        }

        @Test
        @DisplayName("每条迁移内部满足依赖顺序")
        void testAssignmentsRespectDependencies() {
            List<Integer> strategy = solver.getStrategy(variables, phi).orElseThrow();
            List<SymbolicTransition> transitions = solver.getSymbNexts(phi, strategy);
            ExprIndex index = ExprIndex.of(phi);

            for (SymbolicTransition transition : transitions) {
                List<Integer> order = transition.getAssignments();
                for (int i = 0; i < order.size(); i++) {
                    for (int j = i + 1; j < order.size(); j++) {
                        // 排在后面的叶子不能是前面叶子的前驱
                        assertFalse(Leaves.mustPrecede(index, order.get(j), order.get(i)), transition::toString);
                    }
                }
            }
        }

        @Test
        @DisplayName("每个分支在根处都是好的")
        void testBranchesAreGood() {
            List<Integer> strategy = solver.getStrategy(variables, phi).orElseThrow();
            LabelMap labels = TreeLabeler.label(phi, new HashSet<>(strategy));

            for (SymbolicTransition transition : solver.getSymbNexts(phi, strategy)) {
                assertTrue(BranchEnumerator.isGood(phi, labels, new HashSet<>(transition.getAssignments())),
                        transition::toString);
            }
        }
    }
}
