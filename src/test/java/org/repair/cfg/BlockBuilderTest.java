package org.repair.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.repair.cfg.CfgFixtures.*;

/**
 * block 生成与局部边测试，包括推导式展开
 */
public class BlockBuilderTest {

    @Test
    public void testListComprehensionDesugaring() {
        ControlFlowGraph g = python("""
                def k(xs):
                    return [f(x) for x in xs if cond(x)]

                def f(x): return x

                def cond(x): return x > 0
                """);

        assertEquals(BlockKind.DESUGARED_LOOP_HEADER, g.block(0).kind);
        assertEquals("for x in xs:", g.block(0).code);
        assertEquals(BlockKind.DESUGARED_FILTER, g.block(1).kind);
        assertEquals("if cond(x):", g.block(1).code);
        assertEquals(BlockKind.DESUGARED_COLLECT, g.block(2).kind);
        assertEquals("append(f(x))", g.block(2).code);
        assertEquals(BlockKind.DESUGARED_RETURN, g.block(3).kind);
        assertEquals("return result", g.block(3).code);

        // 只有收集块带元素表达式中的调用
        assertEquals(Set.of("f"), g.block(2).calls());
        assertEquals(Set.of("cond"), g.block(1).calls());
        assertTrue(g.block(0).calls().isEmpty());

        assertEdge(g, 0, 1, "for_match:x in xs");
        assertEdge(g, 1, 2, "condition_true:cond(x)");
        assertEdge(g, 1, 0, "loop_back");
        assertEdge(g, 2, 0, "loop_back");
        assertEdge(g, 0, 3, "for_not_match:x in xs");
        assertEquals(List.of(3), g.rootReturns());

        // cond 在 f 之前被发现
        assertEquals("cond", g.block(4).procedure);
        assertEquals("f", g.block(5).procedure);
        assertEdge(g, 1, 4, "call");
        assertEdge(g, 4, 1, "return");
        assertEdge(g, 2, 5, "call");
        assertEdge(g, 5, 2, "return");
        assertEquals(9, g.edges().size());
        assertValid(g);
    }

    @Test
    public void testGeneratorExpressionDesugaring() {
        ControlFlowGraph g = python("""
                def gen(xs):
                    return list(g(x) for x in xs if x)

                def g(x):
                    return x
                """);

        assertEquals("for x in xs:", g.block(0).code);
        assertEquals("if x:", g.block(1).code);
        assertEquals("temp_result = g(x)", g.block(2).code);
        assertEquals(BlockKind.DESUGARED_YIELD, g.block(3).kind);
        assertEquals("append(temp_result)", g.block(3).code);
        assertEquals("return list(temp_list)", g.block(4).code);

        assertEdge(g, 0, 1, "for_match:x in xs");
        assertEdge(g, 1, 2, "condition_true:x");
        assertEdge(g, 1, 0, "loop_back");
        assertEdge(g, 2, 3, "sequential");
        assertEdge(g, 3, 0, "loop_back");
        assertEdge(g, 0, 4, "for_not_match:x in xs");
        assertEdge(g, 2, 5, "call");
        assertValid(g);
    }

    @Test
    public void testComprehensionWithoutFilter() {
        ControlFlowGraph g = python("""
                def sq(xs):
                    total = 0
                    return sorted([x * x for x in xs])
                """);

        int header = block(g, "for x in xs:");
        int collect = block(g, "append(x * x)");
        int ret = block(g, "return sorted(result)");
        assertEdge(g, block(g, "total = 0"), header, "sequential");
        assertEdge(g, header, collect, "for_match:x in xs");
        assertEdge(g, collect, header, "loop_back");
        assertEdge(g, header, ret, "for_not_match:x in xs");
        assertEquals(4, g.blocks().size());
        assertValid(g);
    }

    @Test
    public void testComprehensionInsideLoopIsReachedFromPreviousStatement() {
        ControlFlowGraph g = python("""
                def rows(m):
                    for r in m:
                        if not r:
                            continue
                        return [c for c in r]
                """);

        int cond = block(g, "if not r:");
        int header = block(g, "for c in r:");
        assertEdge(g, cond, header, "condition_false:not r");
        assertValid(g);
    }

    @Test
    public void testOneBlockPerStatementInTextualOrder() {
        ControlFlowGraph g = python("""
                def order(a):
                    x = a
                    if x:
                        y = 1
                    else:
                        y = 2
                    while y:
                        y -= 1
                    return y
                """);

        List<String> codes = g.blocks().stream().map(b -> b.code).toList();
        assertEquals(List.of("x = a", "if x:", "y = 1", "y = 2", "while y:", "y -= 1", "return y"), codes);
        assertEquals(BlockKind.AUGMENTED_ASSIGNMENT, g.block(5).kind);
        for (int i = 0; i < g.blocks().size(); i++) {
            assertEquals(i, g.block(i).id);
            assertEquals("order", g.block(i).procedure);
        }
    }

    @Test
    public void testUnknownStatementsAreKeptWithWarning() {
        ControlFlowGraph g = python("""
                def m(cmd):
                    match cmd:
                        case "go":
                            move()
                    return cmd
                """);

        assertEquals(BlockKind.UNKNOWN, g.block(0).kind);
        assertEquals("match cmd:", g.block(0).code);
        assertEdge(g, 0, 1, "sequential");
        assertTrue(g.warnings().stream().anyMatch(w -> w.contains("unrecognized statement")), g.warnings().toString());
        assertValid(g);
    }

    @Test
    public void testBreakOutsideLoopIsWarned() {
        ControlFlowGraph g = python("""
                def bad():
                    break
                """);

        assertEquals(BlockKind.BREAK, g.block(0).kind);
        assertTrue(edgesFrom(g, 0).isEmpty());
        assertTrue(g.warnings().stream().anyMatch(w -> w.contains("break outside loop")));
    }

    @Test
    public void testLayoutSpans() {
        ProcedureRegistry registry = new PythonStatementProvider().load("""
                def p(xs):
                    for x in xs:
                        if x:
                            y = x
                    return y
                """, null, null);
        Procedure proc = registry.target();
        ControlFlowGraph g = new ControlFlowGraph(proc.signature(), proc.name(), 100);
        ProcedureLayout layout = new BlockBuilder(g, registry).build(proc);

        Stmt loop = proc.body().get(0);
        assertEquals(0, layout.blockOf(loop));
        assertEquals(0, layout.spanStart(loop));
        assertEquals(3, layout.spanEnd(loop));
        assertEquals(1, layout.blockOf(loop.body.get(0)));
        assertEquals(List.of(3), layout.returns());
        // 构建器只连局部边
        assertEquals(2, g.edges().size());
    }
}
