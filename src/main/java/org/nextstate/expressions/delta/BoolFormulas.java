package org.nextstate.expressions.delta;

import org.nextstate.expressions.delta.BoolFormula.And;
import org.nextstate.expressions.delta.BoolFormula.False;
import org.nextstate.expressions.delta.BoolFormula.Implies;
import org.nextstate.expressions.delta.BoolFormula.LtFns;
import org.nextstate.expressions.delta.BoolFormula.Neg;
import org.nextstate.expressions.delta.BoolFormula.NeFns;
import org.nextstate.expressions.delta.BoolFormula.Or;
import org.nextstate.expressions.delta.BoolFormula.Variable;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * delta 公式上的纯函数：化简、收集原子。
 */
public final class BoolFormulas {

    private BoolFormulas() {
    }

    /**
     * 去掉多余分支，得到逻辑等价但更小的公式。
     * 先递归化简子公式，否则 false 无法向上传播。
     * <ul>
     *   <li>合取：任一分支为 false 则整体为 false。</li>
     *   <li>析取：丢弃 false 分支；剩 0 个为 false，剩 1 个则取该分支。</li>
     * </ul>
     * @param phi 由 delta 构造得到的公式。
     * @return 化简后的公式。
     */
    public static BoolFormula simplify(BoolFormula phi) {
        if (phi instanceof And) {
            List<BoolFormula> args = ((And) phi).getArgs().stream()
                    .map(BoolFormulas::simplify)
                    .collect(Collectors.toList());
            if (args.contains(BoolFormula.FALSE)) {
                return BoolFormula.FALSE;
            }
            return BoolFormula.and(args);
        }
        if (phi instanceof Or) {
            List<BoolFormula> args = ((Or) phi).getArgs().stream()
                    .map(BoolFormulas::simplify)
                    .filter(arg -> !(arg instanceof False))
                    .collect(Collectors.toList());
            return switch (args.size()) {
                case 0 -> BoolFormula.FALSE;
                case 1 -> args.get(0);
                default -> BoolFormula.or(args);
            };
        }
        return phi;
    }

    /**
     * 收集公式中出现的所有命题原子的叶子 id。
     */
    public static Set<Integer> variables(BoolFormula phi) {
        Set<Integer> result = new TreeSet<>();
        collectVariables(phi, result);
        return result;
    }

    private static void collectVariables(BoolFormula phi, Set<Integer> acc) {
        if (phi instanceof Variable) {
            acc.add(((Variable) phi).getId());
        } else if (phi instanceof BoolFormula.Junction) {
            ((BoolFormula.Junction) phi).getArgs().forEach(arg -> collectVariables(arg, acc));
        } else if (phi instanceof Neg) {
            collectVariables(((Neg) phi).getArg(), acc);
        } else if (phi instanceof Implies) {
            collectVariables(((Implies) phi).getLhs(), acc);
            collectVariables(((Implies) phi).getRhs(), acc);
        } else if (!(phi instanceof False || phi instanceof LtFns || phi instanceof NeFns)) {
            throw new IllegalStateException("Unknown delta formula shape: " + phi.getClass().getName());
        }
    }
}
