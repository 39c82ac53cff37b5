package org.nextstate.assignments;

import org.nextstate.core.SolverConfig;
import org.nextstate.symbolic.RankFunction;
import org.nextstate.symbolic.SolverResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 从一个求解结果中取出赋值策略：被选中的叶子，按秩升序排列。
 */
public final class StrategyExtractor {

    private static final Logger logger = LoggerFactory.getLogger(StrategyExtractor.class);

    private final String selectionPrefix;

    public StrategyExtractor(SolverConfig config) {
        Objects.requireNonNull(config, "Solver config cannot be null.");
        this.selectionPrefix = config.getSelectionSymbol() + "_";
    }

    /**
     * @param result 求解器的回答。
     * @return 不可满足时为空；否则为按秩排序的叶子 id 序列。
     * @throws IllegalStateException 如果模型中有多于一个秩函数。
     */
    public Optional<List<Integer>> extract(SolverResult result) {
        Objects.requireNonNull(result, "Solver result cannot be null.");
        if (!result.isSatisfiable()) {
            logger.info("约束不可满足，不存在赋值策略");
            return Optional.empty();
        }

        List<Integer> selected = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : result.getConstants().entrySet()) {
            if (entry.getValue()) {
                parseLeafId(entry.getKey()).ifPresent(selected::add);
            }
        }

        List<RankFunction> functions = result.getFunctions();
        switch (functions.size()) {
            case 0:
                // 没有排序约束，任意顺序均可
                selected.sort(Comparator.naturalOrder());
                break;
            case 1:
                RankFunction rank = functions.get(0);
                selected.sort(Comparator.comparingInt(rank::rankOf));
                break;
            default:
                throw new IllegalStateException("Expected at most one rank function, found " + functions);
        }
        logger.info("赋值策略: {}", selected);
        return Optional.of(selected);
    }

    private Optional<Integer> parseLeafId(String constant) {
        if (!constant.startsWith(selectionPrefix)) {
            logger.warn("忽略未知常量 {}", constant);
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(constant.substring(selectionPrefix.length())));
        } catch (NumberFormatException e) {
            logger.warn("忽略无法解析的常量 {}", constant);
            return Optional.empty();
        }
    }
}
