package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * 在所有过程都生成 block 之后补全需要全局信息的边：
 * 隐式 else、循环出口与 loop back、break/continue、异常/else/finally、过程间 call/return。
 * <p>
 * 核心是 {@link #next(Stmt)}：求某语句执行完之后的下一处。有后继兄弟时取兄弟的入口，
 * 否则交给外层结构（{@link #afterArm}）决定，逐层向外冒泡，直到过程体结束。
 */
public class EdgeResolver {

    private static final Logger LOG = LogManager.getLogger(EdgeResolver.class);

    /**
     * 控制流去向的性质，决定 fall-through 边用什么标签
     */
    enum Flow {
        NORMAL,         // 普通后继，使用原本的标签
        LOOP_BACK,      // 回到循环头
        NO_EXCEPTION,   // try 体正常结束进入 else
        FINALLY,        // 进入 finally
        EXIT            // 过程体结束
    }

    /**
     * 一处控制流去向：目标 block 与去向性质。EXIT 时 target 无意义。
     */
    record Continuation(int target, Flow flow) {

        static final Continuation EXIT = new Continuation(-1, Flow.EXIT);

        static Continuation normal(int target) {
            return new Continuation(target, Flow.NORMAL);
        }
    }

    private final ControlFlowGraph graph;

    private Procedure procedure;
    private ProcedureLayout layout;
    private boolean root;

    public EdgeResolver(ControlFlowGraph graph) {
        this.graph = graph;
    }

    /**
     * 对图中所有已展开的过程补全边，然后连接过程间的 call/return。
     */
    public void resolve() {
        int terminal = 0;
        for (ProcedureLayout l : graph.layouts().values()) {
            procedure = l.procedure();
            layout = l;
            root = procedure.name().equals(graph.root());
            for (int i = 0; i < procedure.size(); i++) {
                if (resolve(procedure.stmt(i))) {
                    terminal++;
                }
            }
            if (root) {
                graph.setEntry(rootEntry());
            }
        }
        stitchCalls();
        LOG.debug("resolved {} edges over {} blocks, {} terminal statements",
                graph.edges().size(), graph.blocks().size(), terminal);
    }

    /**
     * 补全语句 s 自身 block 的出边。
     *
     * @return true 表示 s 是终止语句（return/raise/break/continue），没有 fall-through 边
     */
    private boolean resolve(Stmt s) {
        int b = layout.blockOf(s);
        return switch (s.kind) {
            case IF -> {
                armEdge(b, s, Stmt.Arm.BODY, EdgeKind.CONDITION_TRUE, s.condition, false);
                if (s.orElse.isEmpty()) {
                    fallThrough(b, next(s), EdgeKind.CONDITION_FALSE, s.condition);
                } else {
                    armEdge(b, s, Stmt.Arm.ELSE, EdgeKind.CONDITION_FALSE, s.condition, true);
                }
                yield false;
            }
            case FOR, WHILE -> {
                EdgeKind match = s.kind == StmtKind.FOR ? EdgeKind.FOR_MATCH : EdgeKind.CONDITION_TRUE;
                EdgeKind exhausted = s.kind == StmtKind.FOR ? EdgeKind.FOR_NOT_MATCH : EdgeKind.CONDITION_FALSE;
                armEdge(b, s, Stmt.Arm.BODY, match, s.condition, false);
                Continuation after = s.orElse.isEmpty() ? next(s) : entryOfArm(s, Stmt.Arm.ELSE);
                loopExit(b, after, exhausted, s.condition);
                yield false;
            }
            case DO_WHILE -> {
                armEdge(b, s, Stmt.Arm.BODY, EdgeKind.CONDITION_TRUE, s.condition, false);
                loopExit(b, next(s), EdgeKind.CONDITION_FALSE, s.condition);
                yield false;
            }
            case SWITCH -> {
                boolean hasDefault = s.body.stream().anyMatch(c -> c.condition == null);
                if (!hasDefault) {
                    fallThrough(b, next(s), EdgeKind.SEQUENTIAL, null);
                }
                yield false;
            }
            case SWITCH_CASE, EXCEPT_HANDLER, WITH -> {
                armEdge(b, s, Stmt.Arm.BODY, EdgeKind.SEQUENTIAL, null, true);
                yield false;
            }
            case TRY -> {
                exceptionEdges(s);
                yield false;
            }
            case BREAK -> {
                Stmt target = layout.jumpTarget(s);
                if (target != null) {
                    jumpEdge(b, next(target), EdgeKind.BREAK_EXIT);
                }
                yield true;
            }
            case CONTINUE -> {
                Stmt target = layout.jumpTarget(s);
                if (target != null) {
                    graph.addEdge(b, layout.blockOf(target), EdgeKind.CONTINUE);
                }
                yield true;
            }
            // 推导式内部的边已由构建器连好
            case RETURN, RAISE -> true;
            case ASSIGNMENT, ANNOTATED_ASSIGNMENT, AUGMENTED_ASSIGNMENT, PASS, ASSERT, DELETE, EXPRESSION,
                    IMPORT, GLOBAL, NONLOCAL, NESTED_DEF, UNKNOWN -> {
                fallThrough(b, next(s), EdgeKind.SEQUENTIAL, null);
                yield false;
            }
        };
    }

    // ---------------------------------------------------------------- 后继计算

    /**
     * @return 语句 s（含其所有子语句）执行完后的去向
     */
    Continuation next(Stmt s) {
        List<Stmt> siblings = procedure.siblingsOf(s);
        // except 子句之间不是顺序关系
        if (s.arm() != Stmt.Arm.HANDLER && s.position() + 1 < siblings.size()) {
            return entry(siblings.get(s.position() + 1));
        }
        if (s.parent() < 0) {
            return Continuation.EXIT;
        }
        return afterArm(procedure.stmt(s.parent()), s.arm());
    }

    /**
     * @return 外层语句 p 的某个分支执行完后的去向
     */
    Continuation afterArm(Stmt p, Stmt.Arm arm) {
        switch (p.kind) {
            case FOR:
            case WHILE:
                return arm == Stmt.Arm.BODY
                        ? new Continuation(layout.blockOf(p), Flow.LOOP_BACK)
                        : next(p);
            case DO_WHILE:
                return Continuation.normal(layout.blockOf(p));
            case SWITCH_CASE:
                return p.fallsThrough ? next(p) : next(procedure.stmt(p.parent()));
            case EXCEPT_HANDLER:
                return afterArm(procedure.stmt(p.parent()), Stmt.Arm.HANDLER);
            case TRY:
                switch (arm) {
                    case BODY:
                        if (!p.orElse.isEmpty()) {
                            return new Continuation(entry(p.orElse.get(0)).target(), Flow.NO_EXCEPTION);
                        }
                        return intoFinally(p);
                    case ELSE:
                    case HANDLER:
                        return intoFinally(p);
                    default:
                        return next(p);
                }
            default:
                return next(p);
        }
    }

    private Continuation intoFinally(Stmt tryStmt) {
        if (tryStmt.finalBody.isEmpty()) {
            return next(tryStmt);
        }
        return new Continuation(entry(tryStmt.finalBody.get(0)).target(), Flow.FINALLY);
    }

    /**
     * @return 进入语句 s 时的第一个 block
     */
    Continuation entry(Stmt s) {
        if (s.kind == StmtKind.TRY || s.kind == StmtKind.DO_WHILE) {
            Continuation c = entryOfArm(s, Stmt.Arm.BODY);
            if (c.flow() == Flow.NO_EXCEPTION || c.flow() == Flow.FINALLY) {
                return Continuation.normal(c.target());
            }
            return c;
        }
        return Continuation.normal(layout.blockOf(s));
    }

    Continuation entryOfArm(Stmt p, Stmt.Arm arm) {
        List<Stmt> stmts = p.arm(arm);
        return stmts.isEmpty() ? afterArm(p, arm) : entry(stmts.get(0));
    }

    // ---------------------------------------------------------------- 连边

    /**
     * 为 from 连唯一的 fall-through 边。标签由去向决定：回到循环头为 loop_back，
     * 进入 else/finally 的顺序流为 no_exception/finally，其余保持原标签。
     */
    private void fallThrough(int from, Continuation c, EdgeKind natural, String value) {
        switch (c.flow()) {
            case NORMAL -> graph.addEdge(from, c.target(), natural, value);
            case LOOP_BACK -> graph.addEdge(from, c.target(), EdgeKind.LOOP_BACK);
            case NO_EXCEPTION -> graph.addEdge(from, c.target(),
                    natural == EdgeKind.SEQUENTIAL ? EdgeKind.NO_EXCEPTION : natural, value);
            case FINALLY -> graph.addEdge(from, c.target(),
                    natural == EdgeKind.SEQUENTIAL ? EdgeKind.FINALLY : natural, value);
            case EXIT -> exit(from, natural, value);
        }
    }

    /**
     * 循环头的出口边。内层循环退出后回到外层循环头时仍保留 for_not_match/condition_false 标签。
     */
    private void loopExit(int from, Continuation c, EdgeKind exhausted, String condition) {
        if (c.flow() == Flow.LOOP_BACK) {
            graph.addEdge(from, c.target(), exhausted, condition);
        } else {
            fallThrough(from, c, exhausted, condition);
        }
    }

    /**
     * 非 fall-through 的跳转边（分支进入、break）：标签不随去向改变。
     */
    private void jumpEdge(int from, Continuation c, EdgeKind kind) {
        jumpEdge(from, c, kind, null);
    }

    private void jumpEdge(int from, Continuation c, EdgeKind kind, String value) {
        if (c.flow() == Flow.EXIT) {
            exit(from, kind, value);
        } else {
            graph.addEdge(from, c.target(), kind, value);
        }
    }

    private void exit(int from, EdgeKind kind, String value) {
        if (root) {
            graph.addEdge(from, graph.endId(), kind, value);
        } else {
            graph.markImplicitExit(from);
        }
    }

    /**
     * 头部到分支入口的边。构建器已连好的（入口在构建期可确定）跳过；
     * 分支为空或入口是空 try 时在这里补上。
     */
    private void armEdge(int from, Stmt s, Stmt.Arm arm, EdgeKind kind, String value, boolean isFallThrough) {
        List<Stmt> stmts = s.arm(arm);
        if (!stmts.isEmpty() && layout.localEntry(stmts) >= 0) {
            return;
        }
        Continuation c = entryOfArm(s, arm);
        if (isFallThrough) {
            fallThrough(from, c, kind, value);
        } else {
            jumpEdge(from, c, kind, value);
        }
    }

    /**
     * try 体中的每个 block 都可能抛出异常，各连一条 exception 边到每个 except 头。
     */
    private void exceptionEdges(Stmt tryStmt) {
        if (tryStmt.body.isEmpty() || tryStmt.handlers.isEmpty()) {
            return;
        }
        int start = layout.spanStart(tryStmt.body.get(0));
        int end = layout.spanEnd(tryStmt.body.get(tryStmt.body.size() - 1));
        for (int b = start; b < end; b++) {
            for (Stmt handler : tryStmt.handlers) {
                graph.addEdge(b, layout.blockOf(handler), EdgeKind.EXCEPTION);
            }
        }
    }

    // ---------------------------------------------------------------- 过程间

    /**
     * 调用方 block 连 call 边到被调过程入口；被调过程的每个 return block 连 return 边回到调用方 block。
     * 调用方自身的 fall-through 边表示"调用完成后继续"。
     */
    private void stitchCalls() {
        for (Block caller : graph.blocks()) {
            for (String name : caller.calls()) {
                ProcedureLayout callee = graph.layout(name);
                if (callee == null) {
                    continue;
                }
                int entry = procedureEntry(callee);
                if (entry < 0) {
                    continue;
                }
                graph.addEdge(caller.id, entry, EdgeKind.CALL);
                for (int ret : callee.returns()) {
                    graph.addEdge(ret, caller.id, EdgeKind.RETURN);
                }
            }
        }
    }

    /**
     * 根过程的入口：第一条非嵌套定义语句的入口（空 try 体时为 finally 或后继），没有时为 null。
     */
    private Integer rootEntry() {
        for (Stmt s : procedure.body()) {
            if (s.kind != StmtKind.NESTED_DEF) {
                Continuation c = entry(s);
                return c.flow() == Flow.EXIT ? null : c.target();
            }
        }
        return null;
    }

    private int procedureEntry(ProcedureLayout l) {
        List<Stmt> body = l.procedure().body();
        if (body.isEmpty()) {
            return -1;
        }
        procedure = l.procedure();
        layout = l;
        Continuation c = entry(body.get(0));
        return c.flow() == Flow.EXIT ? -1 : c.target();
    }
}
