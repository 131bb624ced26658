package org.repair.cfg;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 语句树节点（与前端无关）。
 * <p>
 * 前端负责填充 kind / code / 条件 / 子语句序列；注册到 {@link Procedure} 时
 * 每个节点会被分配一个稳定的 arena 下标，以及父节点下标、所在分支 (arm) 和分支内位置。
 * 之后所有"某语句的下一条是谁"的查询都基于这些下标，而不是对象比较。
 */
public class Stmt {

    /**
     * 子语句序列在父语句中的位置
     */
    public enum Arm {
        BODY,       // if 的 then、循环体、try 体、with 体、switch 的 case 列表、case/handler 体
        ELSE,       // if/for/while/try 的 else
        HANDLER,    // try 的 except/catch 列表
        FINALLY
    }

    public final StmtKind kind;
    public final String code;       // block 展示的源码文本
    public final int line;

    public String condition;        // if/while 条件；for 为 "target in iterable"；case 为标签值
    public String label;            // Java 语句标签 (label: while ...)
    public String jumpLabel;        // break label / continue label
    public boolean fallsThrough = true; // switch case 体结束后是否落入下一个 case

    public List<Stmt> body = new ArrayList<>();
    public List<Stmt> orElse = new ArrayList<>();
    public List<Stmt> handlers = new ArrayList<>();
    public List<Stmt> finalBody = new ArrayList<>();

    // 控制表达式中出现的调用名（未按已知过程过滤）
    public Set<String> headCalls = new LinkedHashSet<>();

    // 仅 RETURN：返回表达式中的第一个推导式
    public Comprehension comprehension;

    // arena 信息，由 Procedure 分配
    int index = -1;
    int parent = -1;
    Arm arm;
    int position = -1;

    public Stmt(StmtKind kind, String code, int line) {
        this.kind = kind;
        this.code = code;
        this.line = line;
    }

    public int index() {
        return index;
    }

    public int parent() {
        return parent;
    }

    public Arm arm() {
        return arm;
    }

    public int position() {
        return position;
    }

    public List<Stmt> arm(Arm which) {
        return switch (which) {
            case BODY -> body;
            case ELSE -> orElse;
            case HANDLER -> handlers;
            case FINALLY -> finalBody;
        };
    }

    @Override
    public String toString() {
        return kind + "#" + index + "[" + code + "]";
    }
}
