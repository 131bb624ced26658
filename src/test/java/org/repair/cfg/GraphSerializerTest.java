package org.repair.cfg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.repair.cfg.CfgFixtures.*;

/**
 * 文本输出格式测试
 */
public class GraphSerializerTest {

    @Test
    public void testIfElseReturnsText() {
        ControlFlowGraph g = python("""
                def f(x):
                    if x > 0:
                        return x
                    else:
                        return -x
                """);

        String expected = """
                G describes a control flow graph of Function `f(x)`
                In this graph:
                Entry Point: Block 0 represents code snippet: if x > 0:.
                END Block: Block 3 represents code snippet: END.
                Block 0 represents code snippet: if x > 0:.
                Block 1 represents code snippet: return x.
                Block 2 represents code snippet: return -x.
                Block 3 represents code snippet: END.
                Block 0 match case "x > 0" points to Block 1.
                Block 0 not match case "x > 0" points to Block 2.
                Block 1 unconditional points to Block 3.
                Block 2 unconditional points to Block 3.""";
        assertEquals(expected, GraphSerializer.serialize(g));
    }

    @Test
    public void testLoopPhrasesAndEdgeOrder() {
        ControlFlowGraph g = python("""
                def g(xs):
                    for x in xs:
                        if x:
                            break
                        y = x
                    return 0
                """);

        String text = GraphSerializer.serialize(g);
        assertTrue(text.contains("Block 0 match case \"x in xs\" points to Block 1."), text);
        assertTrue(text.contains("Block 0 not match case \"x in xs\" points to Block 4."), text);
        assertTrue(text.contains("Block 2 break exit points to Block 4."), text);
        assertTrue(text.contains("Block 3 loop back to Block 0."), text);
        assertTrue(text.contains("Block 4 unconditional points to Block 5."), text);
        // 边按 (from, to) 排序输出
        assertTrue(text.indexOf("Block 0 match case") < text.indexOf("Block 0 not match case"));
        assertTrue(text.indexOf("Block 2 break exit") < text.indexOf("Block 3 loop back"));
        assertFalse(text.endsWith("\n"));
    }

    @Test
    public void testCallAndReturnPhrases() {
        ControlFlowGraph g = python("""
                def main(a):
                    b = helper(a)
                    return b

                def helper(v):
                    return v + 1
                """);

        String text = GraphSerializer.serialize(g);
        assertTrue(text.contains("Block 0 function call points to Block 2."), text);
        assertTrue(text.contains("Block 2 function return points to Block 0."), text);
        assertTrue(text.contains("Block 1 unconditional points to Block 3."), text);
        // 被调用过程的 return 不连到 END
        assertFalse(text.contains("Block 2 unconditional points to Block 3."), text);
    }

    @Test
    public void testTryPhrases() {
        ControlFlowGraph g = python("""
                def t():
                    try:
                        risky()
                    except E:
                        handle()
                    else:
                        ok()
                    finally:
                        done()
                """);

        String text = GraphSerializer.serialize(g);
        assertTrue(text.contains("Block 0 exception points to Block 1."), text);
        assertTrue(text.contains("Block 0 no exception points to Block 3."), text);
        assertTrue(text.contains("Block 2 finally points to Block 4."), text);
        assertTrue(text.contains("Block 3 finally points to Block 4."), text);
    }

    @Test
    public void testJavaSwitchPhrases() {
        ControlFlowGraph g = java("""
                class S {
                    int f(int k) {
                        switch (k) {
                            case 1:
                                return 1;
                            default:
                                return 0;
                        }
                    }
                }
                """, "f");

        String text = GraphSerializer.serialize(g);
        assertTrue(text.startsWith("G describes a control flow graph of Function `S.f(k)`"), text);
        assertTrue(text.contains("Block 0 case match \"1\" points to Block 1."), text);
        assertTrue(text.contains("Block 0 default case points to Block 3."), text);
    }

    @Test
    public void testSerializationIsDeterministic() {
        String src = """
                def d(n):
                    while n:
                        n -= 1
                    return n
                """;
        assertEquals(GraphSerializer.serialize(python(src)), GraphSerializer.serialize(python(src)));
    }

    @Test
    public void testEmptyBodyEntersAtEnd() {
        ControlFlowGraph g = python("""
                def empty():
                    \"\"\"Nothing to do.\"\"\"
                """);

        assertTrue(g.blocks().isEmpty());
        assertNull(g.entry());
        assertEquals("""
                G describes a control flow graph of Function `empty()`
                In this graph:
                Entry Point: Block 0 represents code snippet: END.
                END Block: Block 0 represents code snippet: END.
                Block 0 represents code snippet: END.""", GraphSerializer.serialize(g));
    }

    @Test
    public void testNewlinesInCodeAreEscaped() {
        assertEquals("a\\nb", GraphSerializer.escape("a\nb"));
    }

    @Test
    public void testDuplicateLabelsCollapse() {
        ControlFlowGraph g = new ControlFlowGraph("f()", "f", 10);
        g.addBlock(BlockKind.EXPRESSION, "a()", "f", 1, java.util.Set.of());
        g.addBlock(BlockKind.EXPRESSION, "b()", "f", 2, java.util.Set.of());
        g.addEdge(1, 0, EdgeKind.SEQUENTIAL);
        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);
        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);

        assertEquals(2, GraphSerializer.sortedEdges(g).size());
        assertEquals(0, GraphSerializer.sortedEdges(g).get(0).from());
    }
}
