package org.repair.cfg;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把构建完成的图渲染为规范文本形式。输出只依赖图的内容，相同的图得到逐字节相同的文本。
 */
public final class GraphSerializer {

    private GraphSerializer() {
    }

    public static String serialize(ControlFlowGraph graph) {
        int end = graph.endId();
        List<String> lines = new ArrayList<>();
        lines.add("G describes a control flow graph of Function `" + graph.signature() + "`");
        lines.add("In this graph:");

        // 过程体为空时从 END 开始
        Integer entry = graph.entry();
        if (entry == null) {
            lines.add("Entry Point: Block " + end + " represents code snippet: END.");
        } else {
            lines.add("Entry Point: Block " + entry + " represents code snippet: "
                    + escape(graph.block(entry).code) + ".");
        }
        lines.add("END Block: Block " + end + " represents code snippet: END.");

        for (Block block : graph.blocks()) {
            lines.add("Block " + block.id + " represents code snippet: " + escape(block.code) + ".");
        }
        lines.add("Block " + end + " represents code snippet: END.");

        for (Edge edge : sortedEdges(graph)) {
            lines.add("Block " + edge.from() + " " + edge.kind().phrase(escapeOrNull(edge.value()))
                    + " Block " + edge.to() + ".");
        }
        for (int ret : graph.rootReturns()) {
            lines.add("Block " + ret + " " + EdgeKind.SEQUENTIAL.phrase(null) + " Block " + end + ".");
        }
        return String.join("\n", lines);
    }

    /**
     * 按 (from, to) 稳定排序，并按 (from, to, label) 去重。
     */
    static List<Edge> sortedEdges(ControlFlowGraph graph) {
        List<Edge> sorted = new ArrayList<>(graph.edges());
        sorted.sort(Edge.BY_ENDPOINTS);
        Set<String> seen = new LinkedHashSet<>();
        List<Edge> unique = new ArrayList<>();
        for (Edge e : sorted) {
            if (seen.add(e.from() + "|" + e.to() + "|" + e.label())) {
                unique.add(e);
            }
        }
        return unique;
    }

    static String escape(String text) {
        return text.replace("\n", "\\n");
    }

    private static String escapeOrNull(String text) {
        return text == null ? null : escape(text);
    }
}
