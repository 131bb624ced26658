package org.repair.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.repair.cfg.CfgFixtures.*;

/**
 * 调用图展开测试：call/return 缝合、递归保护、上限与幂等性
 */
public class CfgDriverTest {

    private static final String EVEN_ODD = """
            def even(n):
                if n == 0:
                    return True
                return odd(n - 1)

            def odd(n):
                if n == 0:
                    return False
                return even(n - 1)
            """;

    @Test
    public void testCallReturnStitching() {
        ControlFlowGraph g = java("""
                class Calc {
                    int twice(int x) {
                        return helper(x) * 2;
                    }

                    private int helper(int x) {
                        return x + x;
                    }
                }
                """, "twice");

        assertEquals("Calc.twice(x)", g.signature());
        assertEquals(2, g.blocks().size());
        assertEquals("helper", g.block(1).procedure);
        assertEdge(g, 0, 1, "call");
        assertEdge(g, 1, 0, "return");
        assertEquals(List.of(0), g.rootReturns(), "callee returns do not go to END");
        assertValid(g);
    }

    @Test
    public void testDirectRecursionTerminates() {
        ControlFlowGraph g = python("""
                def fact(n):
                    if n <= 1:
                        return 1
                    return n * fact(n - 1)
                """);

        assertEquals(3, g.blocks().size(), "fact is expanded once");
        assertEdge(g, 2, 0, "call");
        assertEdge(g, 1, 2, "return");
        assertEdge(g, 2, 2, "return");
        assertTrue(g.warnings().stream().anyMatch(w -> w.contains("recursive call to fact")), g.warnings().toString());
        assertValid(g);
    }

    @Test
    public void testMutualRecursionTerminates() {
        ControlFlowGraph g = python(EVEN_ODD);

        assertEquals(6, g.blocks().size());
        int callOdd = block(g, "return odd(n - 1)");
        int callEven = block(g, "return even(n - 1)");
        assertEdge(g, callOdd, 3, "call");
        assertEdge(g, callEven, 0, "call");
        assertEdge(g, block(g, "return False"), callOdd, "return");
        assertEdge(g, block(g, "return True"), callEven, "return");
        assertEquals(1, g.edges().stream().filter(e -> e.from() == callEven && e.kind() == EdgeKind.CALL).count());
        assertEquals(List.of(1, 2), g.rootReturns());
        assertValid(g);
    }

    @Test
    public void testCalleeWithoutReturnHasNoFallThrough() {
        ControlFlowGraph g = python("""
                def main(n):
                    helper(n)
                    return n

                def helper(n):
                    print(n)
                """);

        assertEdge(g, 0, 1, "sequential");
        assertEdge(g, 0, 2, "call");
        assertTrue(edgesFrom(g, 2).isEmpty(), "no fall-through out of a non-root procedure");
        assertTrue(g.implicitExits().contains(2));
        assertValid(g);
    }

    @Test
    public void testCalleesExpandedInBlockOrder() {
        ControlFlowGraph g = python("""
                def root():
                    a()
                    b()

                def b():
                    return 2

                def a():
                    return 1
                """);

        assertEquals("a", g.block(2).procedure);
        assertEquals("b", g.block(3).procedure);
    }

    @Test
    public void testIdempotence() {
        String first = GraphSerializer.serialize(python(EVEN_ODD));
        String second = GraphSerializer.serialize(python(EVEN_ODD));
        assertEquals(first, second);
    }

    @Test
    public void testBlockLimit() {
        BuildOptions options = BuildOptions.defaults().withMaxBlocks(2);
        assertThrows(BuildLimitExceededException.class, () -> CfgDriver.analyze(EVEN_ODD,
                SourceLanguage.PYTHON, "even", null, options));
    }

    @Test
    public void testCallDepthLimit() {
        BuildOptions options = BuildOptions.defaults().withMaxCallDepth(1);
        ControlFlowGraph g = CfgDriver.analyze(EVEN_ODD, SourceLanguage.PYTHON, "even", null, options);

        assertEquals(3, g.blocks().size());
        assertTrue(edgesFrom(g, 2).isEmpty(), "odd was not expanded, so there is no call edge");
        assertTrue(g.warnings().stream().anyMatch(w -> w.contains("call depth limit")), g.warnings().toString());
        assertValid(g);
    }

    @Test
    public void testExpandCallsDisabled() {
        BuildOptions options = BuildOptions.defaults().withExpandCalls(false);
        ControlFlowGraph g = CfgDriver.analyze(EVEN_ODD, SourceLanguage.PYTHON, "odd", null, options);

        assertEquals(3, g.blocks().size());
        assertEquals("odd(n)", g.signature());
        assertEquals(Integer.valueOf(0), g.entry());
    }

    @Test
    public void testTargetNotFound() {
        assertThrows(ProcedureNotFoundException.class, () -> python(EVEN_ODD, "missing"));
        assertThrows(ProcedureNotFoundException.class, () -> python("x = 1\n"));
        assertThrows(ProcedureNotFoundException.class,
                () -> CfgDriver.analyze(EVEN_ODD, SourceLanguage.PYTHON, null, "Nope", BuildOptions.defaults()));
    }

    @Test
    public void testDriverIsSingleUse() {
        ProcedureRegistry registry = new PythonStatementProvider().load(EVEN_ODD, null, null);
        CfgDriver driver = new CfgDriver(registry, BuildOptions.defaults());
        driver.expand(registry.target());
        assertThrows(IllegalStateException.class, () -> driver.expand(registry.target()));
    }
}
