package org.repair.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个可调用过程（Python 函数 / Java 方法）及其语句树。
 * <p>
 * 构造时按先序遍历给每条语句分配 arena 下标，注册后不再修改。
 */
public class Procedure {

    private final String name;
    private final String container;     // 所在类名，可为 null
    private final List<String> parameters;
    private final List<Stmt> body;
    private final List<Stmt> arena = new ArrayList<>();
    private final SourceLanguage language;
    private final int line;

    public Procedure(String name, String container, List<String> parameters, List<Stmt> body,
                     SourceLanguage language, int line) {
        this.name = name;
        this.container = container;
        this.parameters = List.copyOf(parameters);
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.language = language;
        this.line = line;
        index(this.body, -1, Stmt.Arm.BODY);
    }

    private void index(List<Stmt> seq, int parent, Stmt.Arm arm) {
        for (int i = 0; i < seq.size(); i++) {
            Stmt s = seq.get(i);
            if (s.index >= 0) {
                throw new IllegalArgumentException("statement registered twice: " + s);
            }
            s.index = arena.size();
            s.parent = parent;
            s.arm = arm;
            s.position = i;
            arena.add(s);
            for (Stmt.Arm child : Stmt.Arm.values()) {
                index(s.arm(child), s.index, child);
            }
        }
    }

    public String name() {
        return name;
    }

    public String container() {
        return container;
    }

    public List<String> parameters() {
        return parameters;
    }

    public List<Stmt> body() {
        return body;
    }

    public SourceLanguage language() {
        return language;
    }

    public int line() {
        return line;
    }

    public int size() {
        return arena.size();
    }

    public Stmt stmt(int index) {
        return arena.get(index);
    }

    /**
     * @return 语句所在的序列（父语句的某个 arm，或过程体）
     */
    public List<Stmt> siblingsOf(Stmt s) {
        return s.parent < 0 ? body : arena.get(s.parent).arm(s.arm);
    }

    /**
     * 图标题中使用的签名：Python 为 {@code f(a, b)}，Java 为 {@code Cls.f(a, b)}。
     */
    public String signature() {
        String params = String.join(", ", parameters);
        if (language == SourceLanguage.JAVA && container != null) {
            return container + "." + name + "(" + params + ")";
        }
        return name + "(" + params + ")";
    }

    @Override
    public String toString() {
        return signature();
    }
}
