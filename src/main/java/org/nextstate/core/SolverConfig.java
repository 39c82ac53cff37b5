package org.nextstate.core;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * 赋值求解器的配置：SMT 编码中使用的符号名、逻辑以及求解超时。
 * 此类是不可变的。
 */
@Getter
public final class SolverConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolverConfig.class);

    public static final String SELECTION_SYMBOL_KEY = "assignments.smt.selectionSymbol";
    public static final String RANK_SYMBOL_KEY = "assignments.smt.rankSymbol";
    public static final String LOGIC_KEY = "assignments.smt.logic";
    public static final String TIMEOUT_KEY = "assignments.solver.timeoutMillis";

    /** 默认的 classpath 配置资源。 */
    public static final String DEFAULT_RESOURCE = "assignment-solver.properties";

    // SMT-LIB simple symbol，且不以数字开头
    private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[A-Za-z~!@$%^&*+=<>.?/_\\-][A-Za-z0-9~!@$%^&*+=<>.?/_\\-]*");

    public static final SolverConfig DEFAULT = SolverConfig.builder().build();

    /** 叶子选择变量的前缀，叶子 i 对应 {@code A_i}。 */
    private final String selectionSymbol;
    /** 秩函数名。 */
    private final String rankSymbol;
    private final String logic;
    /** 求解超时 (毫秒)，0 表示不限。 */
    private final long timeoutMillis;

    @Builder(toBuilder = true)
    private SolverConfig(String selectionSymbol, String rankSymbol, String logic, Long timeoutMillis) {
        this.selectionSymbol = selectionSymbol == null ? "A" : selectionSymbol;
        this.rankSymbol = rankSymbol == null ? "R" : rankSymbol;
        this.logic = logic == null ? "QF_UFLIA" : logic;
        this.timeoutMillis = timeoutMillis == null ? 0L : timeoutMillis;

        requireSymbol(this.selectionSymbol, "selection symbol");
        requireSymbol(this.rankSymbol, "rank symbol");
        requireSymbol(this.logic, "logic");
        if (this.selectionSymbol.equals(this.rankSymbol)) {
            throw new IllegalArgumentException("Selection and rank symbols must differ: " + this.rankSymbol);
        }
        if (this.timeoutMillis < 0) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + this.timeoutMillis);
        }
    }

    private static void requireSymbol(String value, String what) {
        if (!SIMPLE_SYMBOL.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value + "'");
        }
    }

    /**
     * 从 Properties 读取配置，缺省的键取默认值。
     */
    public static SolverConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null.");
        String timeout = properties.getProperty(TIMEOUT_KEY);
        Long timeoutMillis;
        try {
            timeoutMillis = timeout == null ? null : Long.valueOf(timeout.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + TIMEOUT_KEY + ": '" + timeout + "'", e);
        }
        return SolverConfig.builder()
                .selectionSymbol(trimmed(properties.getProperty(SELECTION_SYMBOL_KEY)))
                .rankSymbol(trimmed(properties.getProperty(RANK_SYMBOL_KEY)))
                .logic(trimmed(properties.getProperty(LOGIC_KEY)))
                .timeoutMillis(timeoutMillis)
                .build();
    }

    /**
     * 从 classpath 资源加载配置。资源不存在时返回默认配置。
     * @param resource 资源名，例如 {@code assignment-solver.properties}。
     */
    public static SolverConfig load(String resource) {
        Objects.requireNonNull(resource, "Resource name cannot be null.");
        try (InputStream in = SolverConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("未找到配置资源 {}，使用默认配置", resource);
                return DEFAULT;
            }
            Properties properties = new Properties();
            properties.load(in);
            SolverConfig config = fromProperties(properties);
            logger.info("从 {} 加载配置: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration resource " + resource, e);
        }
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    @Override
    public String toString() {
        return "SolverConfig(selection=" + selectionSymbol + ", rank=" + rankSymbol
                + ", logic=" + logic + ", timeoutMillis=" + timeoutMillis + ")";
    }
}
