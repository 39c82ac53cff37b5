package org.nextstate.assignments;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.nextstate.expressions.delta.BoolFormula;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * delta 构造的结果：可达叶子、依赖/独立关系以及每个变量的 delta 公式。
 * 此类是不可变的。
 */
@Getter
public final class DeltaResult {

    private final SortedSet<Integer> seen;
    private final SortedSet<Pair<Integer, Integer>> dependent;
    private final SortedSet<Pair<Integer, Integer>> independent;
    private final SortedMap<String, BoolFormula> deltas;

    DeltaResult(Set<Integer> seen,
                Set<Pair<Integer, Integer>> dependent,
                Set<Pair<Integer, Integer>> independent,
                Map<String, BoolFormula> deltas) {
        this.seen = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(seen)));
        this.dependent = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(dependent)));
        this.independent = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(independent)));
        this.deltas = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(deltas)));
    }

    /**
     * 无信息的结果：空集合，每个变量的 delta 为 false。
     */
    static DeltaResult empty(Set<String> variables) {
        Map<String, BoolFormula> deltas = new TreeMap<>();
        for (String v : variables) {
            deltas.put(v, BoolFormula.FALSE);
        }
        return new DeltaResult(Collections.emptySet(), Collections.emptySet(), Collections.emptySet(), deltas);
    }

    public BoolFormula deltaOf(String variable) {
        BoolFormula delta = deltas.get(variable);
        if (delta == null) {
            throw new IllegalArgumentException("Unknown state variable: " + variable);
        }
        return delta;
    }

    public boolean isDependent(int i, int j) {
        return dependent.contains(Pair.of(i, j));
    }

    public boolean isIndependent(int i, int j) {
        return independent.contains(Pair.of(i, j));
    }

    @Override
    public String toString() {
        return "DeltaResult(seen=" + seen + ", deltas=" + deltas + ")";
    }
}
