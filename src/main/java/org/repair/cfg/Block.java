package org.repair.cfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * CFG 中的一个节点：一条语句，或推导式展开出的一个合成步骤。
 * 创建后 kind 和 code 不再改变。
 */
public class Block {
    public final int id;            // 全图单调递增，创建顺序即文本顺序
    public final BlockKind kind;
    public final String code;       // 展示用源码文本
    public final String procedure;  // 所属过程名
    public final int line;

    // 控制表达式中引用的、已知过程的名字
    private final Set<String> calls;

    public Block(int id, BlockKind kind, String code, String procedure, int line, Set<String> calls) {
        this.id = id;
        this.kind = kind;
        this.code = code;
        this.procedure = procedure;
        this.line = line;
        this.calls = Collections.unmodifiableSet(new LinkedHashSet<>(calls));
    }

    public Set<String> calls() {
        return calls;
    }

    @Override
    public String toString() {
        return "Block " + id + " (" + kind + "): " + code;
    }
}
