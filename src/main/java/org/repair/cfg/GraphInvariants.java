package org.repair.cfg;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 检查构建完成的图是否满足结构性质：
 * <ol>
 *   <li>每个非终止 block 恰有一条 fall-through 边（非根过程的隐式结束除外）</li>
 *   <li>(from, to, label) 不重复</li>
 *   <li>loop_back 只从非终止 block 指向同一过程中包含它的循环头</li>
 * </ol>
 */
public final class GraphInvariants {

    private GraphInvariants() {
    }

    /**
     * @return 违反项的描述，空列表表示全部满足
     */
    public static List<String> check(ControlFlowGraph graph) {
        List<String> violations = new ArrayList<>();
        checkUnique(graph, violations);
        checkFallThrough(graph, violations);
        checkLoopBacks(graph, violations);
        return violations;
    }

    private static void checkUnique(ControlFlowGraph graph, List<String> violations) {
        Set<String> seen = new HashSet<>();
        for (Edge e : graph.edges()) {
            if (!seen.add(e.from() + "|" + e.to() + "|" + e.label())) {
                violations.add("duplicate edge " + e);
            }
        }
    }

    private static void checkFallThrough(ControlFlowGraph graph, List<String> violations) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (Edge e : graph.edges()) {
            if (e.kind().isFallThrough()) {
                counts.merge(e.from(), 1, Integer::sum);
            }
        }
        for (Block b : graph.blocks()) {
            int n = counts.getOrDefault(b.id, 0);
            if (b.kind.isTerminal()) {
                if (n > 0) {
                    violations.add("terminal block " + b.id + " has " + n + " fall-through edges");
                }
            } else if (n == 0 && graph.implicitExits().contains(b.id)) {
                continue;
            } else if (n != 1) {
                violations.add("block " + b.id + " has " + n + " fall-through edges");
            }
        }
    }

    private static void checkLoopBacks(ControlFlowGraph graph, List<String> violations) {
        Map<Integer, Integer> headerSpanEnd = new HashMap<>();
        for (ProcedureLayout layout : graph.layouts().values()) {
            Procedure p = layout.procedure();
            for (int i = 0; i < p.size(); i++) {
                Stmt s = p.stmt(i);
                int b = layout.blockOf(s);
                if (b >= 0 && graph.block(b).kind.isLoopHeader()) {
                    headerSpanEnd.put(b, layout.spanEnd(s));
                }
            }
        }
        for (Edge e : graph.edges()) {
            if (e.kind() != EdgeKind.LOOP_BACK) {
                continue;
            }
            Block from = graph.block(e.from());
            Integer spanEnd = headerSpanEnd.get(e.to());
            if (spanEnd == null) {
                violations.add("loop_back " + e + " does not target a loop header");
            } else if (from.kind.isTerminal()) {
                violations.add("loop_back " + e + " leaves a terminal block");
            } else if (!from.procedure.equals(graph.block(e.to()).procedure)) {
                violations.add("loop_back " + e + " crosses procedures");
            } else if (e.from() <= e.to() || e.from() >= spanEnd) {
                violations.add("loop_back " + e + " does not come from inside the loop");
            }
        }
    }
}
