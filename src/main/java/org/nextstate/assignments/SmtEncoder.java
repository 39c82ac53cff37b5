package org.nextstate.assignments;

import org.apache.commons.lang3.tuple.Pair;
import org.nextstate.core.SolverConfig;
import org.nextstate.expressions.ExprIndex;
import org.nextstate.expressions.TlaEx;
import org.nextstate.expressions.delta.BoolFormula;
import org.nextstate.expressions.delta.Smt2Renderer;
import org.nextstate.symbolic.SmtSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 把赋值选择问题编码为 SMT-LIB v2 文本，其解即为合法的赋值策略。
 * <p>
 * 每个叶子 i 声明布尔未知量 {@code A_i}（是否被选入策略），另声明一个秩函数 {@code R : Int -> Int}。
 * 断言分四组：
 * <ol>
 *   <li>有效性：每个变量的 delta 公式。</li>
 *   <li>排序：依赖对 (i, j) 且 i 必须先于 j 时，{@code A_i /\ A_j => R(i) < R(j)}。</li>
 *   <li>单射：任意两个不同叶子 {@code R(i) != R(j)}。</li>
 *   <li>唯一性：赋值同一变量的依赖对不能同时被选。</li>
 * </ol>
 */
public final class SmtEncoder {

    private static final Logger logger = LoggerFactory.getLogger(SmtEncoder.class);

    private final SolverConfig config;
    private final Smt2Renderer renderer;

    public SmtEncoder(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "Solver config cannot be null.");
        this.renderer = new Smt2Renderer(config.getSelectionSymbol(), config.getRankSymbol());
    }

    /**
     * @param variables 状态变量。
     * @param phi       next 公式。
     * @return 声明与断言。
     */
    public SmtSpec encode(Set<String> variables, TlaEx phi) {
        return encode(DeltaBuilder.build(phi, variables), ExprIndex.of(phi));
    }

    /**
     * 编码，并额外把可独立求解的 SMT 文件写到 file。
     */
    public SmtSpec encode(Set<String> variables, TlaEx phi, Path file) {
        Objects.requireNonNull(file, "File cannot be null.");
        SmtSpec spec = encode(variables, phi);
        write(spec, file);
        return spec;
    }

    SmtSpec encode(DeltaResult delta, ExprIndex index) {
        List<BoolFormula> validity = new ArrayList<>(delta.getDeltas().values());

        List<BoolFormula> ranking = new ArrayList<>();
        List<BoolFormula> uniqueness = new ArrayList<>();
        for (Pair<Integer, Integer> pair : delta.getDependent()) {
            int i = pair.getLeft();
            int j = pair.getRight();
            if (Leaves.mustPrecede(index, i, j)) {
                ranking.add(BoolFormula.implies(
                        BoolFormula.and(BoolFormula.variable(i), BoolFormula.variable(j)),
                        BoolFormula.lt(i, j)));
            }
            if (i < j && Leaves.lvar(index, i).equals(Leaves.lvar(index, j))) {
                uniqueness.add(BoolFormula.neg(BoolFormula.and(BoolFormula.variable(i), BoolFormula.variable(j))));
            }
        }

        List<BoolFormula> injectivity = new ArrayList<>();
        for (Integer i : delta.getSeen()) {
            for (Integer j : delta.getSeen()) {
                if (i < j) {
                    injectivity.add(BoolFormula.ne(i, j));
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        for (Integer id : delta.getSeen()) {
            sb.append("(declare-fun ").append(renderer.selectionName(id)).append(" () Bool)\n");
        }
        sb.append("(declare-fun ").append(config.getRankSymbol()).append(" (Int) Int)\n");
        for (List<BoolFormula> group : List.of(validity, ranking, injectivity, uniqueness)) {
            for (BoolFormula constraint : group) {
                sb.append("(assert ").append(renderer.render(constraint)).append(")\n");
            }
        }

        logger.debug("SMT 编码: {} 个叶子, 有效性 {}, 排序 {}, 单射 {}, 唯一性 {}",
                delta.getSeen().size(), validity.size(), ranking.size(), injectivity.size(), uniqueness.size());
        return new SmtSpec(config.getLogic(), sb.toString(), delta.getSeen());
    }

    /**
     * 写出完整的 SMT 文件，供离线检查。
     */
    public void write(SmtSpec spec, Path path) {
        try {
            Files.writeString(path, spec.toStandalone(), StandardCharsets.UTF_8);
            logger.info("SMT 问题已写入 {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write SMT spec to " + path, e);
        }
    }
}
