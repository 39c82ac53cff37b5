package org.nextstate.expressions.delta;

import org.nextstate.expressions.delta.BoolFormula.And;
import org.nextstate.expressions.delta.BoolFormula.False;
import org.nextstate.expressions.delta.BoolFormula.Implies;
import org.nextstate.expressions.delta.BoolFormula.LtFns;
import org.nextstate.expressions.delta.BoolFormula.Neg;
import org.nextstate.expressions.delta.BoolFormula.NeFns;
import org.nextstate.expressions.delta.BoolFormula.Or;
import org.nextstate.expressions.delta.BoolFormula.Variable;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 将 delta 公式渲染为 SMT-LIB v2 项（不含 assert 命令）。
 */
public final class Smt2Renderer {

    private final String selectionSymbol;
    private final String rankSymbol;

    /**
     * @param selectionSymbol 布尔未知量的前缀，叶子 i 渲染为 {@code <prefix>_i}。
     * @param rankSymbol      秩函数名。
     */
    public Smt2Renderer(String selectionSymbol, String rankSymbol) {
        this.selectionSymbol = Objects.requireNonNull(selectionSymbol, "Selection symbol cannot be null.");
        this.rankSymbol = Objects.requireNonNull(rankSymbol, "Rank symbol cannot be null.");
    }

    /**
     * 叶子 id 对应的布尔常量名。
     */
    public String selectionName(int id) {
        return selectionSymbol + "_" + id;
    }

    public String rankApplication(int id) {
        return "(" + rankSymbol + " " + id + ")";
    }

    public String render(BoolFormula phi) {
        if (phi instanceof False) {
            return "false";
        }
        if (phi instanceof And) {
            And and = (And) phi;
            // 空合取为真
            return and.getArgs().isEmpty() ? "true" : "(and " + renderAll(and) + ")";
        }
        if (phi instanceof Or) {
            Or or = (Or) phi;
            return or.getArgs().isEmpty() ? "false" : "(or " + renderAll(or) + ")";
        }
        if (phi instanceof Neg) {
            return "(not " + render(((Neg) phi).getArg()) + ")";
        }
        if (phi instanceof Implies) {
            Implies implies = (Implies) phi;
            return "(=> " + render(implies.getLhs()) + " " + render(implies.getRhs()) + ")";
        }
        if (phi instanceof Variable) {
            return selectionName(((Variable) phi).getId());
        }
        if (phi instanceof LtFns) {
            LtFns lt = (LtFns) phi;
            return "(< " + rankApplication(lt.getI()) + " " + rankApplication(lt.getJ()) + ")";
        }
        if (phi instanceof NeFns) {
            NeFns ne = (NeFns) phi;
            return "(not (= " + rankApplication(ne.getI()) + " " + rankApplication(ne.getJ()) + "))";
        }
        throw new IllegalStateException("Unknown delta formula shape: " + phi.getClass().getName());
    }

    private String renderAll(BoolFormula.Junction junction) {
        return junction.getArgs().stream().map(this::render).collect(Collectors.joining(" "));
    }
}
