package org.repair.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.*;

import java.util.Set;

/**
 * 收集语句中决定控制流的那部分表达式里的方法调用名。
 * <p>
 * 复合语句只看条件/迭代/选择部分，不进入子语句；简单语句分析整棵子树。
 * 只记录无 scope 或 scope 为 this 的调用，它们才可能指向同一文件中的方法。
 */
public class JavaCallCollector {

    public static void collect(Node stmt, Set<String> calls) {

        if (stmt instanceof IfStmt ifStmt) {
            analyzeExpression(ifStmt.getCondition(), calls);
            return;
        }

        if (stmt instanceof ForStmt forStmt) {
            forStmt.getInitialization().forEach(init -> analyzeExpression(init, calls));
            forStmt.getCompare().ifPresent(c -> analyzeExpression(c, calls));
            forStmt.getUpdate().forEach(u -> analyzeExpression(u, calls));
            return;
        }

        if (stmt instanceof ForEachStmt forEachStmt) {
            analyzeExpression(forEachStmt.getIterable(), calls);
            return;
        }

        if (stmt instanceof WhileStmt whileStmt) {
            analyzeExpression(whileStmt.getCondition(), calls);
            return;
        }

        if (stmt instanceof DoStmt doStmt) {
            analyzeExpression(doStmt.getCondition(), calls);
            return;
        }

        if (stmt instanceof SwitchStmt switchStmt) {
            analyzeExpression(switchStmt.getSelector(), calls);
            return;
        }

        if (stmt instanceof TryStmt tryStmt) {
            tryStmt.getResources().forEach(r -> analyzeExpression(r, calls));
            return;
        }

        if (stmt instanceof SynchronizedStmt syncStmt) {
            analyzeExpression(syncStmt.getExpression(), calls);
            return;
        }

        // 局部类的方法体不属于当前语句
        if (stmt instanceof LocalClassDeclarationStmt || stmt instanceof LocalRecordDeclarationStmt) {
            return;
        }

        // 普通语句：整棵子树分析
        analyzeExpression(stmt, calls);
    }

    private static void analyzeExpression(Node node, Set<String> calls) {
        node.walk(MethodCallExpr.class, call -> {
            boolean local = call.getScope().map(s -> s.isThisExpr()).orElse(true);
            if (local) {
                calls.add(call.getNameAsString());
            }
        });
    }
}
