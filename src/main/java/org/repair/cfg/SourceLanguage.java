package org.repair.cfg;

import java.util.Locale;

/**
 * 支持的源码语言，以及对应的语句树前端。
 */
public enum SourceLanguage {
    PYTHON,
    JAVA;

    public StatementTreeProvider provider(BuildOptions options) {
        return switch (this) {
            case PYTHON -> new PythonStatementProvider();
            case JAVA -> new JavaStatementProvider(options);
        };
    }

    /**
     * 根据文件扩展名推断语言；无法推断时返回 null。
     */
    public static SourceLanguage fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".py")) {
            return PYTHON;
        }
        if (lower.endsWith(".java")) {
            return JAVA;
        }
        return null;
    }

    public static SourceLanguage parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
