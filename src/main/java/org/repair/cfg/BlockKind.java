package org.repair.cfg;

/**
 * Block 的类型：与语句类型一一对应，另加推导式展开产生的合成类型。
 */
public enum BlockKind {
    ASSIGNMENT,
    ANNOTATED_ASSIGNMENT,
    AUGMENTED_ASSIGNMENT,
    FOR,
    WHILE,
    DO_WHILE,
    IF,
    EXCEPT_HANDLER,
    WITH,
    SWITCH,
    SWITCH_CASE,
    RETURN,
    BREAK,
    CONTINUE,
    PASS,
    ASSERT,
    RAISE,
    DELETE,
    EXPRESSION,
    IMPORT,
    GLOBAL,
    NONLOCAL,
    NESTED_DEF,
    UNKNOWN,

    // 推导式展开
    DESUGARED_LOOP_HEADER,
    DESUGARED_FILTER,
    DESUGARED_COLLECT,
    DESUGARED_YIELD,
    DESUGARED_RETURN;

    /**
     * 终止类 block 没有 fall-through 边。
     */
    public boolean isTerminal() {
        return switch (this) {
            case RETURN, DESUGARED_RETURN, BREAK, CONTINUE, RAISE -> true;
            default -> false;
        };
    }

    public boolean isReturn() {
        return this == RETURN || this == DESUGARED_RETURN;
    }

    public boolean isLoopHeader() {
        return this == FOR || this == WHILE || this == DESUGARED_LOOP_HEADER;
    }

    public boolean isSynthetic() {
        return name().startsWith("DESUGARED_");
    }
}
