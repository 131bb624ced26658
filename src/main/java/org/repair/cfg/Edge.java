package org.repair.cfg;

import java.util.Comparator;
import java.util.Objects;

/**
 * 有向边 (from, to, label)。两条边相等当且仅当三元组相等。
 *
 * @param value 条件或 case 值；无值类型为 null
 */
public record Edge(int from, int to, EdgeKind kind, String value) {

    /** 序列化顺序：(from, to)，相同时保持插入顺序（需配合稳定排序） */
    public static final Comparator<Edge> BY_ENDPOINTS =
            Comparator.comparingInt(Edge::from).thenComparingInt(Edge::to);

    public Edge {
        Objects.requireNonNull(kind, "kind");
        if (kind.valued()) {
            Objects.requireNonNull(value, "value of " + kind.label());
        } else {
            value = null;
        }
    }

    public String label() {
        return value == null ? kind.label() : kind.label() + ":" + value;
    }

    @Override
    public String toString() {
        return from + " -[" + label() + "]-> " + to;
    }
}
