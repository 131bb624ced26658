package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 对一个过程的语句树做递归下降，每条语句生成一个 block，并连上无需全局信息的局部边：
 * 头部到各分支第一个 block 的边、switch 到各 case 的边，以及推导式展开后的固定边。
 * <p>
 * 隐式 else、循环出口、loop back、break/continue 等边留给 {@link EdgeResolver}。
 * 循环/switch 上下文以 {@link JumpFrame} 参数向下传递，构建器本身不持有栈状态。
 */
public class BlockBuilder {

    private static final Logger LOG = LogManager.getLogger(BlockBuilder.class);

    private final ControlFlowGraph graph;
    private final ProcedureRegistry registry;

    public BlockBuilder(ControlFlowGraph graph, ProcedureRegistry registry) {
        this.graph = graph;
        this.registry = registry;
    }

    /**
     * 为过程生成全部 block 并登记布局。
     *
     * @return 过程布局，其中记录了语句到 block 的映射
     */
    public ProcedureLayout build(Procedure procedure) {
        ProcedureLayout layout = new ProcedureLayout(procedure);
        graph.putLayout(layout);
        int first = graph.nextId();
        buildArm(procedure.body(), procedure, layout, null);
        LOG.debug("built {} blocks for {}", graph.nextId() - first, procedure.signature());
        return layout;
    }

    /**
     * @return 分支的构建期入口 block，见 {@link ProcedureLayout#localEntry(List)}
     */
    private int buildArm(List<Stmt> arm, Procedure p, ProcedureLayout layout, JumpFrame frames) {
        int entry = -1;
        for (int i = 0; i < arm.size(); i++) {
            int e = build(arm.get(i), p, layout, frames);
            if (i == 0) {
                entry = e;
            }
        }
        return entry;
    }

    /**
     * @return 语句的构建期入口 block，与 {@link ProcedureLayout#localEntry(Stmt)} 一致
     */
    private int build(Stmt s, Procedure p, ProcedureLayout layout, JumpFrame frames) {
        layout.openSpan(s, graph.nextId());
        int entry = switch (s.kind) {
            case TRY -> {
                int bodyEntry = buildArm(s.body, p, layout, frames);
                for (Stmt handler : s.handlers) {
                    build(handler, p, layout, frames);
                }
                buildArm(s.orElse, p, layout, frames);
                buildArm(s.finalBody, p, layout, frames);
                yield bodyEntry;
            }
            case IF -> {
                int b = place(s, p, layout);
                link(b, buildArm(s.body, p, layout, frames), EdgeKind.CONDITION_TRUE, s.condition);
                link(b, buildArm(s.orElse, p, layout, frames), EdgeKind.CONDITION_FALSE, s.condition);
                yield b;
            }
            case FOR, WHILE -> {
                int b = place(s, p, layout);
                int bodyEntry = buildArm(s.body, p, layout, JumpFrame.push(frames, s));
                link(b, bodyEntry, s.kind == StmtKind.FOR ? EdgeKind.FOR_MATCH : EdgeKind.CONDITION_TRUE, s.condition);
                // 循环的 else 分支中的 break/continue 属于外层循环
                buildArm(s.orElse, p, layout, frames);
                yield b;
            }
            case DO_WHILE -> {
                int bodyEntry = buildArm(s.body, p, layout, JumpFrame.push(frames, s));
                int b = place(s, p, layout);
                link(b, bodyEntry, EdgeKind.CONDITION_TRUE, s.condition);
                yield s.body.isEmpty() ? b : bodyEntry;
            }
            case SWITCH -> {
                int b = place(s, p, layout);
                JumpFrame inner = JumpFrame.push(frames, s);
                for (Stmt c : s.body) {
                    int caseBlock = build(c, p, layout, inner);
                    if (c.condition == null) {
                        graph.addEdge(b, caseBlock, EdgeKind.DEFAULT_CASE);
                    } else {
                        graph.addEdge(b, caseBlock, EdgeKind.CASE_MATCH, c.condition);
                    }
                }
                yield b;
            }
            case SWITCH_CASE, EXCEPT_HANDLER, WITH -> {
                int b = place(s, p, layout);
                link(b, buildArm(s.body, p, layout, frames), EdgeKind.SEQUENTIAL, null);
                yield b;
            }
            case RETURN -> {
                if (s.comprehension != null) {
                    int header = desugar(s, p, layout);
                    layout.place(s, header);
                    yield header;
                }
                int b = place(s, p, layout);
                layout.addReturn(b);
                yield b;
            }
            case BREAK -> {
                int b = place(s, p, layout);
                Stmt target = JumpFrame.breakTarget(frames, s.jumpLabel);
                if (target == null) {
                    warn("break outside loop or switch at line " + s.line + " in " + p.name());
                } else {
                    layout.jump(s, target);
                }
                yield b;
            }
            case CONTINUE -> {
                int b = place(s, p, layout);
                Stmt target = JumpFrame.continueTarget(frames, s.jumpLabel);
                if (target == null) {
                    warn("continue outside loop at line " + s.line + " in " + p.name());
                } else {
                    layout.jump(s, target);
                }
                yield b;
            }
            case UNKNOWN -> {
                warn("unrecognized statement at line " + s.line + " in " + p.name() + ": " + s.code);
                yield place(s, p, layout);
            }
            case ASSIGNMENT, ANNOTATED_ASSIGNMENT, AUGMENTED_ASSIGNMENT, PASS, ASSERT, RAISE, DELETE,
                    EXPRESSION, IMPORT, GLOBAL, NONLOCAL, NESTED_DEF -> place(s, p, layout);
        };
        layout.closeSpan(s, graph.nextId());
        return entry;
    }

    private int place(Stmt s, Procedure p, ProcedureLayout layout) {
        Block block = graph.addBlock(s.kind.blockKind(), s.code, p.name(), s.line, knownCalls(s.headCalls));
        layout.place(s, block.id);
        return block.id;
    }

    private void link(int from, int to, EdgeKind kind, String value) {
        if (to >= 0) {
            graph.addEdge(from, to, kind, value);
        }
    }

    /**
     * return 中的推导式展开为：循环头、可选的过滤、收集（生成器另有一个求值块）、return。
     *
     * @return 循环头 block，作为该 return 语句的入口
     */
    private int desugar(Stmt s, Procedure p, ProcedureLayout layout) {
        Comprehension c = s.comprehension;
        String loop = c.loopCondition();
        String name = p.name();

        int header = graph.addBlock(BlockKind.DESUGARED_LOOP_HEADER, "for " + loop + ":", name, s.line,
                knownCalls(c.iterableCalls())).id;
        int filter = -1;
        if (c.filter() != null) {
            filter = graph.addBlock(BlockKind.DESUGARED_FILTER, "if " + c.filter() + ":", name, s.line,
                    knownCalls(c.filterCalls())).id;
        }
        int collect;
        int last;
        if (c.generator()) {
            collect = graph.addBlock(BlockKind.DESUGARED_COLLECT,
                    Comprehension.GENERATOR_ITEM + " = " + c.element(), name, s.line, knownCalls(c.elementCalls())).id;
            last = graph.addBlock(BlockKind.DESUGARED_YIELD,
                    "append(" + Comprehension.GENERATOR_ITEM + ")", name, s.line, Set.of()).id;
            graph.addEdge(collect, last, EdgeKind.SEQUENTIAL);
        } else {
            collect = graph.addBlock(BlockKind.DESUGARED_COLLECT,
                    "append(" + c.element() + ")", name, s.line, knownCalls(c.elementCalls())).id;
            last = collect;
        }
        int ret = graph.addBlock(BlockKind.DESUGARED_RETURN, c.returnText(), name, s.line, knownCalls(s.headCalls)).id;

        if (filter >= 0) {
            graph.addEdge(header, filter, EdgeKind.FOR_MATCH, loop);
            graph.addEdge(filter, collect, EdgeKind.CONDITION_TRUE, c.filter());
            graph.addEdge(filter, header, EdgeKind.LOOP_BACK);
        } else {
            graph.addEdge(header, collect, EdgeKind.FOR_MATCH, loop);
        }
        graph.addEdge(last, header, EdgeKind.LOOP_BACK);
        graph.addEdge(header, ret, EdgeKind.FOR_NOT_MATCH, loop);
        layout.addReturn(ret);
        return header;
    }

    private Set<String> knownCalls(Set<String> names) {
        Set<String> known = new LinkedHashSet<>();
        for (String n : names) {
            if (registry.contains(n)) {
                known.add(n);
            }
        }
        return known;
    }

    private void warn(String message) {
        LOG.warn(message);
        graph.warn(message);
    }
}
