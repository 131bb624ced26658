package org.repair.cfg;

import com.github.javaparser.ParserConfiguration;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置默认值与环境变量覆盖
 */
public class BuildOptionsTest {

    @Test
    public void testDefaults() {
        BuildOptions options = BuildOptions.fromMap(Map.of());
        assertEquals(BuildOptions.DEFAULT_MAX_BLOCKS, options.maxBlocks());
        assertEquals(BuildOptions.DEFAULT_MAX_CALL_DEPTH, options.maxCallDepth());
        assertEquals(ParserConfiguration.LanguageLevel.JAVA_17, options.javaLevel());
        assertTrue(options.expandCalls());
    }

    @Test
    public void testEnvironmentOverrides() {
        BuildOptions options = BuildOptions.fromMap(Map.of(
                "CFG_MAX_BLOCKS", " 12 ",
                "CFG_MAX_CALL_DEPTH", "3",
                "CFG_JAVA_LEVEL", "java_11",
                "CFG_EXPAND_CALLS", "false"));

        assertEquals(12, options.maxBlocks());
        assertEquals(3, options.maxCallDepth());
        assertEquals(ParserConfiguration.LanguageLevel.JAVA_11, options.javaLevel());
        assertFalse(options.expandCalls());
    }

    @Test
    public void testBlankValuesKeepDefaults() {
        BuildOptions options = BuildOptions.fromMap(Map.of("CFG_MAX_BLOCKS", "", "CFG_EXPAND_CALLS", " "));
        assertEquals(BuildOptions.DEFAULT_MAX_BLOCKS, options.maxBlocks());
        assertTrue(options.expandCalls());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.fromMap(Map.of("CFG_MAX_BLOCKS", "many")));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.fromMap(Map.of("CFG_MAX_CALL_DEPTH", "0")));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.fromMap(Map.of("CFG_JAVA_LEVEL", "JAVA_99")));
        assertThrows(IllegalArgumentException.class, () -> BuildOptions.defaults().withMaxBlocks(-1));
    }

    @Test
    public void testWithersLeaveOriginalUnchanged() {
        BuildOptions base = BuildOptions.defaults();
        BuildOptions changed = base.withMaxBlocks(7).withExpandCalls(false);
        assertEquals(7, changed.maxBlocks());
        assertFalse(changed.expandCalls());
        assertEquals(BuildOptions.DEFAULT_MAX_BLOCKS, base.maxBlocks());
        assertTrue(base.expandCalls());
    }
}
