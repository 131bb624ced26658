package org.repair.cfg;

import com.github.javaparser.ParserConfiguration;

import java.util.Locale;
import java.util.Map;

/**
 * 单次构建的配置。
 * <p>
 * 默认值可通过环境变量覆盖（见 {@link #fromEnvironment()}）：
 * <ul>
 *   <li>CFG_MAX_BLOCKS：单次构建允许的最大 block 数</li>
 *   <li>CFG_MAX_CALL_DEPTH：调用展开路径的最大长度</li>
 *   <li>CFG_JAVA_LEVEL：JavaParser 语言级别，如 JAVA_17</li>
 *   <li>CFG_EXPAND_CALLS：是否展开被调用过程 (true/false)</li>
 * </ul>
 */
public final class BuildOptions {

    public static final int DEFAULT_MAX_BLOCKS = 5000;
    public static final int DEFAULT_MAX_CALL_DEPTH = 32;

    private final int maxBlocks;
    private final int maxCallDepth;
    private final ParserConfiguration.LanguageLevel javaLevel;
    private final boolean expandCalls;

    private BuildOptions(int maxBlocks, int maxCallDepth,
                         ParserConfiguration.LanguageLevel javaLevel, boolean expandCalls) {
        if (maxBlocks <= 0 || maxCallDepth <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
        this.maxBlocks = maxBlocks;
        this.maxCallDepth = maxCallDepth;
        this.javaLevel = javaLevel;
        this.expandCalls = expandCalls;
    }

    public static BuildOptions defaults() {
        return new BuildOptions(DEFAULT_MAX_BLOCKS, DEFAULT_MAX_CALL_DEPTH,
                ParserConfiguration.LanguageLevel.JAVA_17, true);
    }

    public static BuildOptions fromEnvironment() {
        return fromMap(System.getenv());
    }

    static BuildOptions fromMap(Map<String, String> env) {
        BuildOptions d = defaults();
        int maxBlocks = intOrDefault(env.get("CFG_MAX_BLOCKS"), d.maxBlocks);
        int maxDepth = intOrDefault(env.get("CFG_MAX_CALL_DEPTH"), d.maxCallDepth);
        ParserConfiguration.LanguageLevel level = d.javaLevel;
        String levelValue = env.get("CFG_JAVA_LEVEL");
        if (levelValue != null && !levelValue.isBlank()) {
            level = ParserConfiguration.LanguageLevel.valueOf(levelValue.trim().toUpperCase(Locale.ROOT));
        }
        String expand = env.get("CFG_EXPAND_CALLS");
        boolean expandCalls = expand == null || expand.isBlank() ? d.expandCalls : Boolean.parseBoolean(expand.trim());
        return new BuildOptions(maxBlocks, maxDepth, level, expandCalls);
    }

    private static int intOrDefault(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an integer: " + value, e);
        }
    }

    public BuildOptions withMaxBlocks(int value) {
        return new BuildOptions(value, maxCallDepth, javaLevel, expandCalls);
    }

    public BuildOptions withMaxCallDepth(int value) {
        return new BuildOptions(maxBlocks, value, javaLevel, expandCalls);
    }

    public BuildOptions withJavaLevel(ParserConfiguration.LanguageLevel value) {
        return new BuildOptions(maxBlocks, maxCallDepth, value, expandCalls);
    }

    public BuildOptions withExpandCalls(boolean value) {
        return new BuildOptions(maxBlocks, maxCallDepth, javaLevel, value);
    }

    public int maxBlocks() {
        return maxBlocks;
    }

    public int maxCallDepth() {
        return maxCallDepth;
    }

    public ParserConfiguration.LanguageLevel javaLevel() {
        return javaLevel;
    }

    public boolean expandCalls() {
        return expandCalls;
    }
}
