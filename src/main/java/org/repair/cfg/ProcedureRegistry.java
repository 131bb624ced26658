package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按名字索引一份源码中发现的所有过程。
 * <p>
 * 同名过程只保留第一次声明的那个（Java 重载、Python 重定义），其余记录一条警告。
 * 注册顺序即声明顺序，决定未指定目标时的默认过程。
 */
public class ProcedureRegistry {

    private static final Logger LOG = LogManager.getLogger(ProcedureRegistry.class);

    private final Map<String, Procedure> byName = new LinkedHashMap<>();
    private final List<String> containers = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private Procedure target;

    /**
     * @return true 表示注册成功；同名过程已存在时返回 false
     */
    public boolean register(Procedure procedure) {
        Procedure existing = byName.get(procedure.name());
        if (existing != null) {
            warn("duplicate procedure '" + procedure.name() + "' at line " + procedure.line()
                    + " ignored, keeping the one at line " + existing.line());
            return false;
        }
        byName.put(procedure.name(), procedure);
        if (procedure.container() != null && !containers.contains(procedure.container())) {
            containers.add(procedure.container());
        }
        return true;
    }

    /**
     * 登记一个容器（类），即使它没有任何过程。
     */
    public void registerContainer(String container) {
        if (!containers.contains(container)) {
            containers.add(container);
        }
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * @return 对应过程，不存在时返回 null
     */
    public Procedure find(String name) {
        return byName.get(name);
    }

    public Collection<Procedure> all() {
        return Collections.unmodifiableCollection(byName.values());
    }

    public List<String> containers() {
        return Collections.unmodifiableList(containers);
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /**
     * 确定目标过程。
     *
     * @param name      过程名，null 表示取（容器内）第一个声明的过程
     * @param container 类名，null 表示不限定
     * @throws ProcedureNotFoundException 名字或类不存在，或没有任何过程
     */
    public Procedure resolveTarget(String name, String container) {
        if (byName.isEmpty()) {
            throw new ProcedureNotFoundException("no procedures found in source");
        }
        if (container != null && !containers.contains(container)) {
            throw new ProcedureNotFoundException("class '" + container + "' not found");
        }
        if (name != null) {
            Procedure p = byName.get(name);
            if (p == null || (container != null && !container.equals(p.container()))) {
                throw new ProcedureNotFoundException(container == null
                        ? "procedure '" + name + "' not found"
                        : "procedure '" + name + "' not found in class '" + container + "'");
            }
            return p;
        }
        for (Procedure p : byName.values()) {
            if (container == null || container.equals(p.container())) {
                return p;
            }
        }
        throw new ProcedureNotFoundException("class '" + container + "' declares no procedures");
    }

    /**
     * 解析并记住目标过程，供 {@link #target()} 使用。
     */
    public Procedure selectTarget(String name, String container) {
        target = resolveTarget(name, container);
        return target;
    }

    public Procedure target() {
        if (target == null) {
            throw new IllegalStateException("target procedure not selected");
        }
        return target;
    }

    void warn(String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    /**
     * @return 前端在解析和注册阶段记录的警告
     */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
