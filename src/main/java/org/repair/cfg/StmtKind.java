package org.repair.cfg;

/**
 * 语句树中的语句类型（封闭集合）。
 * <p>
 * 前端把源码中的每条语句映射到其中一种；无法识别的语句映射为 {@link #UNKNOWN}。
 * TRY 本身不产生 block，其余类型各对应一个 {@link BlockKind}。
 */
public enum StmtKind {
    ASSIGNMENT(BlockKind.ASSIGNMENT),
    ANNOTATED_ASSIGNMENT(BlockKind.ANNOTATED_ASSIGNMENT),
    AUGMENTED_ASSIGNMENT(BlockKind.AUGMENTED_ASSIGNMENT),
    FOR(BlockKind.FOR),
    WHILE(BlockKind.WHILE),
    DO_WHILE(BlockKind.DO_WHILE),
    IF(BlockKind.IF),
    TRY(null),
    EXCEPT_HANDLER(BlockKind.EXCEPT_HANDLER),
    WITH(BlockKind.WITH),
    SWITCH(BlockKind.SWITCH),
    SWITCH_CASE(BlockKind.SWITCH_CASE),
    RETURN(BlockKind.RETURN),
    BREAK(BlockKind.BREAK),
    CONTINUE(BlockKind.CONTINUE),
    PASS(BlockKind.PASS),
    ASSERT(BlockKind.ASSERT),
    RAISE(BlockKind.RAISE),
    DELETE(BlockKind.DELETE),
    EXPRESSION(BlockKind.EXPRESSION),
    IMPORT(BlockKind.IMPORT),
    GLOBAL(BlockKind.GLOBAL),
    NONLOCAL(BlockKind.NONLOCAL),
    NESTED_DEF(BlockKind.NESTED_DEF),
    UNKNOWN(BlockKind.UNKNOWN);

    private final BlockKind blockKind;

    StmtKind(BlockKind blockKind) {
        this.blockKind = blockKind;
    }

    /**
     * @return 该语句产生的 block 类型；TRY 返回 null
     */
    public BlockKind blockKind() {
        return blockKind;
    }

    public boolean isLoop() {
        return this == FOR || this == WHILE || this == DO_WHILE;
    }
}
