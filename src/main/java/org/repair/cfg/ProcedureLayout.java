package org.repair.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 一个过程在图中的布局：语句下标到 block id 的映射，以及每条语句子树占用的 id 区间。
 * 由 {@link BlockBuilder} 填写，{@link EdgeResolver} 只读。
 */
public class ProcedureLayout {

    private final Procedure procedure;
    private final int[] blockOf;        // TRY 为 -1；带推导式的 return 为循环头
    private final int[] spanStart;      // 子树第一个 block id
    private final int[] spanEnd;        // 子树最后一个 block id + 1
    private final int[] jumpTarget;     // break/continue 跳转的循环或 switch 语句下标
    private final List<Integer> returns = new ArrayList<>();

    ProcedureLayout(Procedure procedure) {
        this.procedure = procedure;
        int n = procedure.size();
        this.blockOf = filled(n);
        this.spanStart = filled(n);
        this.spanEnd = filled(n);
        this.jumpTarget = filled(n);
    }

    private static int[] filled(int n) {
        int[] a = new int[n];
        Arrays.fill(a, -1);
        return a;
    }

    public Procedure procedure() {
        return procedure;
    }

    public int blockOf(Stmt s) {
        return blockOf[s.index()];
    }

    public int spanStart(Stmt s) {
        return spanStart[s.index()];
    }

    public int spanEnd(Stmt s) {
        return spanEnd[s.index()];
    }

    /**
     * @return 跳转目标语句，找不到目标时为 null
     */
    public Stmt jumpTarget(Stmt s) {
        int t = jumpTarget[s.index()];
        return t < 0 ? null : procedure.stmt(t);
    }

    public List<Integer> returns() {
        return Collections.unmodifiableList(returns);
    }

    /**
     * 构建期即可确定的入口 block。
     * TRY 没有自己的 block，入口是 try 体的入口；try 体为空时入口取决于后续语句，返回 -1。
     */
    public int localEntry(Stmt s) {
        switch (s.kind) {
            case TRY:
                return s.body.isEmpty() ? -1 : localEntry(s.body.get(0));
            case DO_WHILE:
                return s.body.isEmpty() ? blockOf(s) : localEntry(s.body.get(0));
            default:
                return blockOf(s);
        }
    }

    /**
     * @return 分支的构建期入口；分支为空或入口无法在构建期确定时为 -1
     */
    public int localEntry(List<Stmt> arm) {
        return arm.isEmpty() ? -1 : localEntry(arm.get(0));
    }

    void place(Stmt s, int block) {
        blockOf[s.index()] = block;
    }

    void openSpan(Stmt s, int start) {
        spanStart[s.index()] = start;
    }

    void closeSpan(Stmt s, int end) {
        spanEnd[s.index()] = end;
    }

    void jump(Stmt s, Stmt target) {
        jumpTarget[s.index()] = target.index();
    }

    void addReturn(int block) {
        returns.add(block);
    }
}
