package org.repair.cfg;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Java 前端（基于 JavaParser，精确解析）。
 * <p>
 * 编译单元中每个类型声明的带方法体的方法都注册为过程，容器为类型名。
 * 方法体中的 BlockStmt 不产生节点，只展开其中的语句；带标签的循环/switch 把标签记在语句上。
 */
public class JavaStatementProvider implements StatementTreeProvider {

    private static final Logger LOG = LogManager.getLogger(JavaStatementProvider.class);

    private final BuildOptions options;
    private final DefaultPrettyPrinter printer = new DefaultPrettyPrinter(new DefaultPrinterConfiguration()
            .removeOption(new DefaultConfigurationOption(DefaultPrinterConfiguration.ConfigOption.PRINT_COMMENTS)));

    public JavaStatementProvider(BuildOptions options) {
        this.options = options;
    }

    @Override
    public ProcedureRegistry load(String source, String targetName, String targetContainer) {
        CompilationUnit cu = parse(source);
        ProcedureRegistry registry = new ProcedureRegistry();

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            String container = type.getNameAsString();
            registry.registerContainer(container);
            for (MethodDeclaration md : type.getMethods()) {
                if (md.getBody().isEmpty()) {
                    continue;
                }
                registry.register(toProcedure(md, container, registry));
            }
        }
        LOG.debug("found {} java methods in {} types", registry.all().size(), registry.containers().size());
        registry.selectTarget(targetName, targetContainer);
        return registry;
    }

    /**
     * @throws SourceParseException 编译单元无法解析，问题列表带行号
     */
    private CompilationUnit parse(String source) {
        JavaParser parser = new JavaParser(new ParserConfiguration().setLanguageLevel(options.javaLevel()));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        List<String> problems = result.getProblems().stream()
                .map(JavaStatementProvider::describe)
                .collect(Collectors.toList());
        throw new SourceParseException("cannot parse java source", problems);
    }

    static String describe(Problem p) {
        int line = p.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(-1); // 获取不到行号时为 -1
        return "Line " + line + ": " + p.getMessage();
    }

    private Procedure toProcedure(MethodDeclaration md, String container, ProcedureRegistry registry) {
        List<String> params = new ArrayList<>();
        for (Parameter p : md.getParameters()) {
            params.add(p.getNameAsString());
        }
        List<Stmt> body = new ArrayList<>();
        md.getBody().ifPresent(b -> b.getStatements().forEach(s -> collect(s, body, null, registry)));
        int line = md.getBegin().map(p -> p.line).orElse(-1);
        return new Procedure(md.getNameAsString(), container, params, body, SourceLanguage.JAVA, line);
    }

    /**
     * 把一条 JavaParser 语句转换后追加到 out；BlockStmt 只展开，不产生节点。
     */
    private void collect(Statement s, List<Stmt> out, String label, ProcedureRegistry registry) {
        if (s.isBlockStmt()) {
            if (label != null) {
                registry.warn("label '" + label + "' on a block is ignored at line " + line(s));
            }
            for (Statement child : s.asBlockStmt().getStatements()) {
                collect(child, out, null, registry);
            }
            return;
        }
        if (s.isLabeledStmt()) {
            LabeledStmt ls = s.asLabeledStmt();
            collect(ls.getStatement(), out, ls.getLabel().asString(), registry);
            return;
        }
        Stmt node = convert(s, registry);
        if (label != null) {
            if (node.kind.isLoop() || node.kind == StmtKind.SWITCH) {
                node.label = label;
            } else {
                registry.warn("label '" + label + "' on a non-loop statement is ignored at line " + line(s));
            }
        }
        out.add(node);
    }

    private List<Stmt> flatten(Statement s, ProcedureRegistry registry) {
        List<Stmt> out = new ArrayList<>();
        collect(s, out, null, registry);
        return out;
    }

    private Stmt convert(Statement s, ProcedureRegistry registry) {
        int line = line(s);

        if (s instanceof ExpressionStmt es) {
            Stmt node = new Stmt(expressionKind(es.getExpression()), text(s), line);
            JavaCallCollector.collect(s, node.headCalls);
            return node;
        }

        if (s instanceof IfStmt is) {
            String cond = text(is.getCondition());
            Stmt node = new Stmt(StmtKind.IF, "if (" + cond + ")", line);
            node.condition = cond;
            JavaCallCollector.collect(s, node.headCalls);
            node.body = flatten(is.getThenStmt(), registry);
            is.getElseStmt().ifPresent(e -> node.orElse = flatten(e, registry));
            return node;
        }

        if (s instanceof ForStmt fs) {
            String head = joined(fs.getInitialization()) + "; "
                    + fs.getCompare().map(this::text).orElse("") + "; "
                    + joined(fs.getUpdate());
            return loop(StmtKind.FOR, "for (" + head + ")", head, s, fs.getBody(), line, registry);
        }

        if (s instanceof ForEachStmt fe) {
            String head = text(fe.getVariable()) + " : " + text(fe.getIterable());
            return loop(StmtKind.FOR, "for (" + head + ")", head, s, fe.getBody(), line, registry);
        }

        if (s instanceof WhileStmt ws) {
            String cond = text(ws.getCondition());
            return loop(StmtKind.WHILE, "while (" + cond + ")", cond, s, ws.getBody(), line, registry);
        }

        if (s instanceof DoStmt ds) {
            String cond = text(ds.getCondition());
            // 条件 block 位于循环体之后，行号取条件所在行
            int condLine = ds.getCondition().getBegin().map(p -> p.line).orElse(line);
            return loop(StmtKind.DO_WHILE, "while (" + cond + ");", cond, s, ds.getBody(), condLine, registry);
        }

        if (s instanceof SwitchStmt ss) {
            String selector = text(ss.getSelector());
            Stmt node = new Stmt(StmtKind.SWITCH, "switch (" + selector + ")", line);
            node.condition = selector;
            JavaCallCollector.collect(s, node.headCalls);
            for (SwitchEntry entry : ss.getEntries()) {
                node.body.add(switchCase(entry, registry));
            }
            return node;
        }

        if (s instanceof TryStmt ts) {
            Stmt tryNode = new Stmt(StmtKind.TRY, "try", line);
            tryNode.body = flatten(ts.getTryBlock(), registry);
            for (CatchClause cc : ts.getCatchClauses()) {
                Stmt handler = new Stmt(StmtKind.EXCEPT_HANDLER, "catch (" + text(cc.getParameter()) + ")",
                        cc.getBegin().map(p -> p.line).orElse(line));
                handler.body = flatten(cc.getBody(), registry);
                tryNode.handlers.add(handler);
            }
            ts.getFinallyBlock().ifPresent(f -> tryNode.finalBody = flatten(f, registry));
            if (ts.getResources().isEmpty()) {
                return tryNode;
            }
            // try-with-resources：资源获取作为 with 头，try 本身作为其唯一子语句
            Stmt with = new Stmt(StmtKind.WITH, "try (" + joined(ts.getResources(), "; ") + ")", line);
            JavaCallCollector.collect(s, with.headCalls);
            with.body.add(tryNode);
            return with;
        }

        if (s instanceof SynchronizedStmt sy) {
            Stmt node = new Stmt(StmtKind.WITH, "synchronized (" + text(sy.getExpression()) + ")", line);
            JavaCallCollector.collect(s, node.headCalls);
            node.body = flatten(sy.getBody(), registry);
            return node;
        }

        if (s instanceof BreakStmt bs) {
            Stmt node = new Stmt(StmtKind.BREAK, text(s), line);
            node.jumpLabel = bs.getLabel().map(SimpleName::asString).orElse(null);
            return node;
        }

        if (s instanceof ContinueStmt cs) {
            Stmt node = new Stmt(StmtKind.CONTINUE, text(s), line);
            node.jumpLabel = cs.getLabel().map(SimpleName::asString).orElse(null);
            return node;
        }

        if (s instanceof LocalClassDeclarationStmt lc) {
            return new Stmt(StmtKind.NESTED_DEF, "class " + lc.getClassDeclaration().getNameAsString(), line);
        }

        if (s instanceof LocalRecordDeclarationStmt lr) {
            return new Stmt(StmtKind.NESTED_DEF, "record " + lr.getRecordDeclaration().getNameAsString(), line);
        }

        StmtKind kind;
        if (s.isReturnStmt()) {
            kind = StmtKind.RETURN;
        } else if (s.isThrowStmt()) {
            kind = StmtKind.RAISE;
        } else if (s.isAssertStmt()) {
            kind = StmtKind.ASSERT;
        } else if (s.isEmptyStmt()) {
            kind = StmtKind.PASS;
        } else if (s.isExplicitConstructorInvocationStmt()) {
            kind = StmtKind.EXPRESSION;
        } else {
            kind = StmtKind.UNKNOWN;
        }
        Stmt node = new Stmt(kind, text(s), line);
        JavaCallCollector.collect(s, node.headCalls);
        return node;
    }

    private Stmt loop(StmtKind kind, String code, String condition, Statement s, Statement body,
                      int line, ProcedureRegistry registry) {
        Stmt node = new Stmt(kind, code, line);
        node.condition = condition;
        JavaCallCollector.collect(s, node.headCalls);
        node.body = flatten(body, registry);
        return node;
    }

    /**
     * 标签为空的 entry 是 default；箭头形式的 entry 不会落入下一个 case。
     */
    private Stmt switchCase(SwitchEntry entry, ProcedureRegistry registry) {
        int line = line(entry);
        Stmt node;
        if (entry.getLabels().isEmpty()) {
            node = new Stmt(StmtKind.SWITCH_CASE, "default:", line);
        } else {
            String labels = joined(entry.getLabels());
            node = new Stmt(StmtKind.SWITCH_CASE, "case " + labels + ":", line);
            node.condition = labels;
        }
        node.fallsThrough = entry.getType() == SwitchEntry.Type.STATEMENT_GROUP;
        for (Statement child : entry.getStatements()) {
            collect(child, node.body, null, registry);
        }
        return node;
    }

    private static StmtKind expressionKind(Expression e) {
        if (e instanceof AssignExpr assign) {
            return assign.getOperator() == AssignExpr.Operator.ASSIGN
                    ? StmtKind.ASSIGNMENT : StmtKind.AUGMENTED_ASSIGNMENT;
        }
        if (e instanceof UnaryExpr unary) {
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT:
                case PREFIX_DECREMENT:
                case POSTFIX_INCREMENT:
                case POSTFIX_DECREMENT:
                    return StmtKind.AUGMENTED_ASSIGNMENT;
                default:
                    return StmtKind.EXPRESSION;
            }
        }
        if (e.isVariableDeclarationExpr()) {
            return StmtKind.ANNOTATED_ASSIGNMENT;
        }
        return StmtKind.EXPRESSION;
    }

    /**
     * 单行展示文本：不含注释，换行及其两侧空白折叠为一个空格。
     */
    private String text(Node n) {
        return printer.print(n).replaceAll("\\s*\\R\\s*", " ").strip();
    }

    private String joined(NodeList<? extends Node> nodes) {
        return joined(nodes, ", ");
    }

    private String joined(NodeList<? extends Node> nodes, String separator) {
        return nodes.stream().map(this::text).collect(Collectors.joining(separator));
    }

    private static int line(Node n) {
        return n.getBegin().map(p -> p.line).orElse(-1);
    }
}
