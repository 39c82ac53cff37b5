package org.nextstate.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SolverConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        SolverConfig config = SolverConfig.DEFAULT;
        assertAll("defaults",
                () -> assertEquals("A", config.getSelectionSymbol()),
                () -> assertEquals("R", config.getRankSymbol()),
                () -> assertEquals("QF_UFLIA", config.getLogic()),
                () -> assertEquals(0L, config.getTimeoutMillis())
        );
    }

    @Test
    @DisplayName("从 Properties 读取，缺省键取默认值")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(SolverConfig.RANK_SYMBOL_KEY, " Rank ");
        properties.setProperty(SolverConfig.TIMEOUT_KEY, "250");

        SolverConfig config = SolverConfig.fromProperties(properties);

        assertAll("properties",
                () -> assertEquals("A", config.getSelectionSymbol()),
                () -> assertEquals("Rank", config.getRankSymbol()),
                () -> assertEquals(250L, config.getTimeoutMillis())
        );
    }

    @Test
    @DisplayName("从 classpath 资源加载")
    void testLoad_FromClasspath() {
        SolverConfig config = SolverConfig.load("assignment-solver-test.properties");
        assertAll("resource",
                () -> assertEquals("Sel", config.getSelectionSymbol()),
                () -> assertEquals("Rank", config.getRankSymbol()),
                () -> assertEquals(5000L, config.getTimeoutMillis())
        );
        assertEquals("A", SolverConfig.load(SolverConfig.DEFAULT_RESOURCE).getSelectionSymbol());
    }

    @Test
    @DisplayName("资源不存在时使用默认配置")
    void testLoad_MissingResource_ReturnsDefault() {
        assertSame(SolverConfig.DEFAULT, SolverConfig.load("no-such-file.properties"));
    }

    @Test
    @DisplayName("含下划线的符号是合法的 SMT 符号")
    void testUnderscoreSymbols_AreAccepted() {
        assertEquals("QF_UFLIA", SolverConfig.builder().build().getLogic());
        SolverConfig config = SolverConfig.builder().selectionSymbol("Sel_x").rankSymbol("_rank").logic("QF_LIA").build();
        assertAll("underscore",
                () -> assertEquals("Sel_x", config.getSelectionSymbol()),
                () -> assertEquals("_rank", config.getRankSymbol()),
                () -> assertEquals("QF_LIA", config.getLogic())
        );
    }

    @Test
    @DisplayName("非法配置应抛出异常")
    void testInvalidConfig_ShouldThrow() {
        assertAll("invalid",
                () -> assertThrows(IllegalArgumentException.class,
                        () -> SolverConfig.builder().selectionSymbol("R").build(), "symbols must differ"),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> SolverConfig.builder().rankSymbol("1R").build(), "symbol cannot start with a digit"),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> SolverConfig.builder().selectionSymbol("A B").build()),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> SolverConfig.builder().timeoutMillis(-1L).build())
        );

        Properties properties = new Properties();
        properties.setProperty(SolverConfig.TIMEOUT_KEY, "soon");
        assertThrows(IllegalArgumentException.class, () -> SolverConfig.fromProperties(properties));
    }

    @Test
    @DisplayName("toBuilder 保留其它字段")
    void testToBuilder() {
        SolverConfig config = SolverConfig.DEFAULT.toBuilder().timeoutMillis(10L).build();
        assertEquals("A", config.getSelectionSymbol());
        assertEquals(10L, config.getTimeoutMillis());
    }
}
