package org.repair.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次构建的全部产物：根过程及其传递调用到的所有过程的 block 与边。
 * <p>
 * block 只能追加，边集合在加入时去重。END block 不存放在 {@link #blocks()} 中，
 * 其 id 恒为 block 总数。
 */
public class ControlFlowGraph {

    private final String signature;         // 根过程签名
    private final String root;              // 根过程名
    private Integer entry;                  // 根过程入口 block，没有时为 null
    private int end;

    private final List<Block> blocks = new ArrayList<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final List<String> warnings = new ArrayList<>();

    // 以下仅在构建期使用，不输出 JSON
    private final transient int maxBlocks;
    private final transient Map<String, ProcedureLayout> layouts = new LinkedHashMap<>();
    private final transient Set<Integer> implicitExits = new LinkedHashSet<>();

    public ControlFlowGraph(String signature, String root, int maxBlocks) {
        this.signature = signature;
        this.root = root;
        this.maxBlocks = maxBlocks;
    }

    /**
     * 追加一个 block，id 为当前 block 数。
     *
     * @throws BuildLimitExceededException 超过 block 上限
     */
    public Block addBlock(BlockKind kind, String code, String procedure, int line, Set<String> calls) {
        if (blocks.size() >= maxBlocks) {
            throw new BuildLimitExceededException(maxBlocks);
        }
        Block block = new Block(blocks.size(), kind, code, procedure, line, calls);
        blocks.add(block);
        end = blocks.size();
        return block;
    }

    /**
     * @return false 表示相同的 (from, to, label) 已存在
     */
    public boolean addEdge(Edge edge) {
        if (edge.from() < 0 || edge.from() > blocks.size() || edge.to() < 0 || edge.to() > blocks.size()) {
            throw new IllegalArgumentException("edge endpoint out of range: " + edge);
        }
        return edges.add(edge);
    }

    public boolean addEdge(int from, int to, EdgeKind kind, String value) {
        return addEdge(new Edge(from, to, kind, value));
    }

    public boolean addEdge(int from, int to, EdgeKind kind) {
        return addEdge(new Edge(from, to, kind, null));
    }

    public int nextId() {
        return blocks.size();
    }

    public Block block(int id) {
        return blocks.get(id);
    }

    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return 按插入顺序的边
     */
    public Set<Edge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public String signature() {
        return signature;
    }

    public String root() {
        return root;
    }

    /**
     * @return 根过程开始执行时到达的第一个 block（跳过嵌套函数定义），由边补全阶段确定；没有时为 null
     */
    public Integer entry() {
        return entry;
    }

    void setEntry(Integer entry) {
        this.entry = entry;
    }

    public int endId() {
        return end;
    }

    /**
     * @return 根过程中的 return block（含推导式展开的 return），按 id 升序
     */
    public List<Integer> rootReturns() {
        ProcedureLayout layout = layouts.get(root);
        return layout == null ? List.of() : layout.returns();
    }

    public void warn(String message) {
        warnings.add(message);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    void putLayout(ProcedureLayout layout) {
        layouts.put(layout.procedure().name(), layout);
    }

    public ProcedureLayout layout(String procedure) {
        return layouts.get(procedure);
    }

    public Map<String, ProcedureLayout> layouts() {
        return Collections.unmodifiableMap(layouts);
    }

    void markImplicitExit(int block) {
        implicitExits.add(block);
    }

    /**
     * @return 非根过程中执行到过程体末尾（无显式 return）的 block
     */
    public Set<Integer> implicitExits() {
        return Collections.unmodifiableSet(implicitExits);
    }
}
