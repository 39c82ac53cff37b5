package org.nextstate.assignments;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.OperEx;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.nextstate.expressions.Tla.*;

class BranchEnumeratorTest {

    private OperEx a;
    private OperEx b;
    private OperEx c;
    private OperEx d;
    private OperEx phi;
    private LabelMap labels;

    /**
     * (x' \in {0,1} /\ y' \in {x'}) \/ (y' \in {0} /\ x' \in {y'})
     */
    @BeforeEach
    void setUp() {
        a = primeIn("x", intSet(0, 1));
        b = primeIn("y", enumSet(prime("x")));
        c = primeIn("y", intSet(0));
        d = primeIn("x", enumSet(prime("y")));
        phi = or(and(a, b), and(c, d));
        labels = TreeLabeler.label(phi, Set.of(a.getId(), b.getId(), c.getId(), d.getId()));
    }

    @Nested
    class IsGoodTests {

        @Test
        void testEmptyCandidate_AlwaysGood() {
            assertTrue(BranchEnumerator.isGood(phi, labels, Set.of()));
            assertTrue(BranchEnumerator.isGood(name("x"), labels, Set.of()));
        }

        @Test
        @DisplayName("同一析取支内的叶子是好的")
        void testSameDisjunct() {
            assertTrue(BranchEnumerator.isGood(phi, labels, Set.of(a.getId(), b.getId())));
            assertTrue(BranchEnumerator.isGood(phi, labels, Set.of(c.getId(), d.getId())));
        }

        @Test
        @DisplayName("跨析取支的叶子不是好的")
        void testAcrossDisjuncts() {
            assertFalse(BranchEnumerator.isGood(phi, labels, Set.of(a.getId(), c.getId())));
            assertFalse(BranchEnumerator.isGood(phi, labels, Set.of(a.getId(), b.getId(), d.getId())));
        }

        @Test
        void testCandidateOutsideLabels() {
            assertFalse(BranchEnumerator.isGood(a, labels, Set.of(b.getId())));
        }

        @Test
        @DisplayName("合取的各子树分别检查")
        void testConjunctionSplitsCandidate() {
            OperEx x1 = primeIn("x", intSet(1));
            OperEx x2 = primeIn("x", intSet(2));
            OperEx y1 = primeIn("y", intSet(1));
            OperEx y2 = primeIn("y", intSet(2));
            OperEx tree = and(or(x1, x2), or(y1, y2));
            LabelMap treeLabels = TreeLabeler.label(tree, Set.of(x1.getId(), x2.getId(), y1.getId(), y2.getId()));

            assertTrue(BranchEnumerator.isGood(tree, treeLabels, Set.of(x1.getId(), y2.getId())));
            assertFalse(BranchEnumerator.isGood(tree, treeLabels, Set.of(x1.getId(), x2.getId())));
        }

        @Test
        void testQuantifierIsTransparent() {
            OperEx x1 = primeIn("x", enumSet(name("t")));
            OperEx x2 = primeIn("x", intSet(0));
            OperEx tree = exists("t", intSet(1, 2), or(x1, x2));
            LabelMap treeLabels = TreeLabeler.label(tree, Set.of(x1.getId(), x2.getId()));

            assertTrue(BranchEnumerator.isGood(tree, treeLabels, Set.of(x1.getId())));
            assertFalse(BranchEnumerator.isGood(tree, treeLabels, Set.of(x1.getId(), x2.getId())));
        }
    }

    @Nested
    class EnumerateTests {

        @Test
        @DisplayName("每个析取支一个分支")
        void testScenarioBranches() {
            List<Integer> strategy = List.of(a.getId(), b.getId(), c.getId(), d.getId());

            List<Set<Integer>> branches = BranchEnumerator.enumerate(phi, labels, strategy, ExprIndex.of(phi));

            assertEquals(List.of(Set.of(a.getId(), b.getId()), Set.of(d.getId(), c.getId())), branches);
        }

        @Test
        @DisplayName("析取的合取产生笛卡尔积")
        void testConjunctionOfDisjunctions() {
            OperEx x1 = primeIn("x", intSet(1));
            OperEx x2 = primeIn("x", intSet(2));
            OperEx y1 = primeIn("y", intSet(1));
            OperEx y2 = primeIn("y", intSet(2));
            OperEx tree = and(or(x1, x2), or(y1, y2));
            List<Integer> strategy = List.of(x1.getId(), x2.getId(), y1.getId(), y2.getId());
            LabelMap treeLabels = TreeLabeler.label(tree, new HashSet<>(strategy));

            List<Set<Integer>> branches = BranchEnumerator.enumerate(tree, treeLabels, strategy, ExprIndex.of(tree));

            assertEquals(List.of(
                    Set.of(x1.getId(), y1.getId()),
                    Set.of(x2.getId(), y1.getId()),
                    Set.of(x1.getId(), y2.getId()),
                    Set.of(x2.getId(), y2.getId())), branches);
        }

        @Test
        void testEmptyStrategy_SingleEmptyBranch() {
            LabelMap empty = TreeLabeler.label(phi, Set.of());

            assertEquals(List.of(Set.of()), BranchEnumerator.enumerate(phi, empty, List.of(), ExprIndex.of(phi)));
        }

        @Test
        void testEveryBranchIsGood() {
            List<Integer> strategy = List.of(a.getId(), b.getId(), c.getId(), d.getId());

            for (Set<Integer> branch : BranchEnumerator.enumerate(phi, labels, strategy, ExprIndex.of(phi))) {
                assertTrue(BranchEnumerator.isGood(phi, labels, branch), branch::toString);
            }
        }

        @Test
        void testNonCandidateInStrategy() {
            OperEx guard = lt(name("x"), integer(3));
            OperEx tree = and(a, guard);
            LabelMap treeLabels = TreeLabeler.label(tree, Set.of(a.getId()));

            assertThrows(IllegalArgumentException.class, () -> BranchEnumerator.enumerate(
                    tree, treeLabels, List.of(a.getId(), guard.getId()), ExprIndex.of(tree)));
        }
    }
}
