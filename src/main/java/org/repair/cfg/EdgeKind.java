package org.repair.cfg;

/**
 * 边的类型，以及序列化时使用的短语。
 * 带值的类型（条件、case 值）在标签中写作 {@code prefix:value}。
 */
public enum EdgeKind {
    SEQUENTIAL("sequential", "unconditional points to", false, true),
    CONDITION_TRUE("condition_true", "match case", true, false),
    CONDITION_FALSE("condition_false", "not match case", true, true),
    FOR_MATCH("for_match", "match case", true, false),
    FOR_NOT_MATCH("for_not_match", "not match case", true, true),
    LOOP_BACK("loop_back", "loop back to", false, true),
    CONTINUE("continue", "continue points to", false, false),
    BREAK_EXIT("break_exit", "break exit points to", false, false),
    EXCEPTION("exception", "exception points to", false, false),
    NO_EXCEPTION("no_exception", "no exception points to", false, true),
    FINALLY("finally", "finally points to", false, true),
    CALL("call", "function call points to", false, false),
    RETURN("return", "function return points to", false, false),
    CASE_MATCH("case_match", "case match", true, false),
    DEFAULT_CASE("default_case", "default case points to", false, true);

    private final String label;
    private final String phrase;
    private final boolean valued;
    private final boolean fallThrough;

    EdgeKind(String label, String phrase, boolean valued, boolean fallThrough) {
        this.label = label;
        this.phrase = phrase;
        this.valued = valued;
        this.fallThrough = fallThrough;
    }

    public String label() {
        return label;
    }

    public boolean valued() {
        return valued;
    }

    /**
     * 控制"落到下一处"的边：每个非终止 block 恰好有一条。
     */
    public boolean isFallThrough() {
        return fallThrough;
    }

    /**
     * @param value 条件或 case 值，无值类型忽略
     * @return 如 {@code match case "x > 0" points to}
     */
    public String phrase(String value) {
        if (!valued) {
            return phrase;
        }
        return phrase + " \"" + value + "\" points to";
    }
}
