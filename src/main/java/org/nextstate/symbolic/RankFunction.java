package org.nextstate.symbolic;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 模型中一元整数函数在相关定义域上的解释。
 * 此类是不可变的。
 */
public final class RankFunction {

    @Getter
    private final String name;
    private final Map<Integer, Integer> values;

    public RankFunction(String name, Map<Integer, Integer> values) {
        this.name = Objects.requireNonNull(name, "Function name cannot be null.");
        this.values = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(values, "Values cannot be null.")));
    }

    /**
     * @param leafId 定义域中的一个叶子 id。
     * @return 该叶子的秩。
     * @throws IllegalArgumentException 如果 leafId 不在已求值的定义域中。
     */
    public int rankOf(int leafId) {
        Integer rank = values.get(leafId);
        if (rank == null) {
            throw new IllegalArgumentException("Function " + name + " has no value for " + leafId);
        }
        return rank;
    }

    public Map<Integer, Integer> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RankFunction that = (RankFunction) o;
        return name.equals(that.name) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return name + values;
    }
}
