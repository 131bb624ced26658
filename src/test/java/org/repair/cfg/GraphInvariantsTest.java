package org.repair.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.repair.cfg.CfgFixtures.*;

/**
 * 结构性质检查：对构建结果应全部满足，对手工构造的坏图应报出
 */
public class GraphInvariantsTest {

    @Test
    public void testBuiltGraphsSatisfyInvariants() {
        assertValid(python("""
                def busy(xs, n):
                    total = 0
                    for x in xs:
                        while n > 0:
                            if x == n:
                                break
                            elif x < 0:
                                continue
                            n -= 1
                        else:
                            total += 1
                    try:
                        with open(xs) as fh:
                            fh.read()
                    except OSError:
                        raise
                    else:
                        total = 1
                    finally:
                        n = 0
                    return [v for v in xs if v]
                """));
    }

    @Test
    public void testMissingFallThroughIsReported() {
        ControlFlowGraph g = new ControlFlowGraph("f()", "f", 10);
        g.addBlock(BlockKind.ASSIGNMENT, "a = 1", "f", 2, Set.of());
        g.addBlock(BlockKind.RETURN, "return a", "f", 3, Set.of());

        List<String> violations = GraphInvariants.check(g);
        assertEquals(List.of("block 0 has 0 fall-through edges"), violations);

        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);
        assertTrue(GraphInvariants.check(g).isEmpty());
    }

    @Test
    public void testTwoFallThroughEdgesAreReported() {
        ControlFlowGraph g = new ControlFlowGraph("f()", "f", 10);
        g.addBlock(BlockKind.ASSIGNMENT, "a = 1", "f", 2, Set.of());
        g.addBlock(BlockKind.RETURN, "return a", "f", 3, Set.of());
        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);
        g.addEdge(0, 2, EdgeKind.SEQUENTIAL);

        assertEquals(List.of("block 0 has 2 fall-through edges"), GraphInvariants.check(g));
    }

    @Test
    public void testTerminalBlockWithFallThroughIsReported() {
        ControlFlowGraph g = new ControlFlowGraph("f()", "f", 10);
        g.addBlock(BlockKind.RETURN, "return 1", "f", 2, Set.of());
        g.addBlock(BlockKind.PASS, "pass", "f", 3, Set.of());
        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);
        g.addEdge(1, 2, EdgeKind.SEQUENTIAL);

        assertEquals(List.of("terminal block 0 has 1 fall-through edges"), GraphInvariants.check(g));
    }

    @Test
    public void testLoopBackToNonHeaderIsReported() {
        ControlFlowGraph g = new ControlFlowGraph("f()", "f", 10);
        g.addBlock(BlockKind.ASSIGNMENT, "a = 1", "f", 2, Set.of());
        g.addBlock(BlockKind.ASSIGNMENT, "b = 2", "f", 3, Set.of());
        g.addEdge(1, 0, EdgeKind.LOOP_BACK);
        g.addEdge(0, 1, EdgeKind.SEQUENTIAL);

        List<String> violations = GraphInvariants.check(g);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("does not target a loop header"), violations.toString());
    }

    @Test
    public void testLoopBackFromOutsideTheLoopIsReported() {
        ControlFlowGraph g = python("""
                def w(n):
                    while n:
                        n -= 1
                    n = 5
                """);
        int after = block(g, "n = 5");
        g.addEdge(after, 0, EdgeKind.LOOP_BACK);

        List<String> violations = GraphInvariants.check(g);
        assertTrue(violations.stream().anyMatch(v -> v.contains("does not come from inside the loop")), violations.toString());
    }

    @Test
    public void testImplicitExitOfCalleeIsAllowed() {
        ControlFlowGraph g = python("""
                def caller():
                    work()
                    return 1

                def work():
                    x = 1
                """);

        int x = block(g, "x = 1");
        assertTrue(g.implicitExits().contains(x));
        assertTrue(edgesFrom(g, x).isEmpty());
        assertValid(g);
    }
}
