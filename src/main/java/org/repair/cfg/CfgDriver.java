package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 构建流程的入口：选定根过程，沿调用图递归展开被调过程，最后统一补全边。
 * <p>
 * 每个过程在一次构建中最多展开一次；正在展开路径上的过程再次被调用时（递归）只记录警告，
 * call 边在补全阶段照常连上。一个 driver 实例对应一次构建，不可复用。
 */
public class CfgDriver {

    private static final Logger LOG = LogManager.getLogger(CfgDriver.class);

    private final ProcedureRegistry registry;
    private final BuildOptions options;
    private final Deque<String> activePath = new ArrayDeque<>();
    private ControlFlowGraph graph;
    private BlockBuilder builder;

    public CfgDriver(ProcedureRegistry registry, BuildOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * 解析源码并为目标过程构建 CFG。
     *
     * @param targetName      目标过程，null 表示第一个声明的过程
     * @param targetContainer 目标类，null 表示不限定
     */
    public static ControlFlowGraph analyze(String source, SourceLanguage language,
                                           String targetName, String targetContainer, BuildOptions options) {
        ProcedureRegistry registry = language.provider(options).load(source, targetName, targetContainer);
        return new CfgDriver(registry, options).expand(registry.target());
    }

    public static ControlFlowGraph analyze(String source, SourceLanguage language, String targetName) {
        return analyze(source, language, targetName, null, BuildOptions.defaults());
    }

    /**
     * 以 root 为根构建完整的图。
     */
    public ControlFlowGraph expand(Procedure root) {
        if (graph != null) {
            throw new IllegalStateException("driver already used");
        }
        graph = new ControlFlowGraph(root.signature(), root.name(), options.maxBlocks());
        registry.warnings().forEach(graph::warn);
        builder = new BlockBuilder(graph, registry);

        LOG.info("building control flow graph of {}", root.signature());
        expandProcedure(root);
        new EdgeResolver(graph).resolve();
        LOG.info("built {} blocks and {} edges for {}",
                graph.blocks().size(), graph.edges().size(), root.signature());
        return graph;
    }

    private void expandProcedure(Procedure procedure) {
        activePath.push(procedure.name());
        int first = graph.nextId();
        builder.build(procedure);
        int end = graph.nextId();
        if (options.expandCalls()) {
            // 按 block id 顺序深度优先展开；被调过程的 block 追加在 end 之后
            for (int id = first; id < end; id++) {
                for (String callee : graph.block(id).calls()) {
                    expandCallee(procedure, callee);
                }
            }
        }
        activePath.pop();
    }

    private void expandCallee(Procedure caller, String name) {
        if (activePath.contains(name)) {
            warn("recursive call to " + name + " from " + caller.name() + ", not expanded again");
            return;
        }
        if (graph.layout(name) != null) {
            return;
        }
        if (activePath.size() >= options.maxCallDepth()) {
            warn("call depth limit " + options.maxCallDepth() + " reached at " + name + ", not expanded");
            return;
        }
        Procedure callee = registry.find(name);
        if (callee != null) {
            expandProcedure(callee);
        }
    }

    private void warn(String message) {
        LOG.warn(message);
        graph.warn(message);
    }
}
