package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Python 前端（启发式）：按缩进和括号把源码切成逻辑行，再按行首关键字和顶层运算符识别语句。
 * <p>
 * 每个 def（含 async def、方法、嵌套函数）都注册为一个过程；方法的容器为其所在的 class。
 * 过程按 (嵌套深度, 文本顺序) 注册，未指定目标时取最外层的第一个函数。
 */
public class PythonStatementProvider implements StatementTreeProvider {

    private static final Logger LOG = LogManager.getLogger(PythonStatementProvider.class);

    @Override
    public ProcedureRegistry load(String source, String targetName, String targetContainer) {
        ProcedureRegistry registry = new ProcedureRegistry();
        Parser parser = new Parser(PythonLines.split(source), registry);
        parser.declarations(0, null, 0);

        parser.found.sort(Comparator.comparingInt(Found::depth).thenComparingInt(Found::order));
        for (Found f : parser.found) {
            registry.register(f.procedure());
        }
        LOG.debug("found {} python procedures", registry.all().size());
        registry.selectTarget(targetName, targetContainer);
        return registry;
    }

    private record Found(int depth, int order, Procedure procedure) {
    }

    /**
     * 逻辑行上的递归下降解析器。pos 指向下一条未处理的逻辑行。
     */
    private static final class Parser {

        private final List<PythonLines.LogicalLine> lines;
        private final ProcedureRegistry registry;
        private final List<Found> found = new ArrayList<>();
        private int pos;
        private int order;

        Parser(List<PythonLines.LogicalLine> lines, ProcedureRegistry registry) {
            this.lines = lines;
            this.registry = registry;
        }

        // ------------------------------------------------------------ 模块 / 类层

        /**
         * 模块或类体：只收集 def 和 class，其他语句跳过（复合语句内部仍继续查找 def）。
         */
        void declarations(int indent, String container, int depth) {
            while (pos < lines.size() && lines.get(pos).indent() >= indent) {
                PythonLines.LogicalLine line = lines.get(pos);
                String text = stripAsync(line.text());
                String word = PythonText.leadingWord(text);
                if (text.startsWith("@")) {
                    pos++;
                } else if (word.equals("def")) {
                    defineProcedure(line, container, depth);
                } else if (word.equals("class")) {
                    String name = PythonText.leadingWord(text.substring(5).strip());
                    registry.registerContainer(name);
                    pos++;
                    int inner = suiteIndent(line);
                    if (inner >= 0) {
                        declarations(inner, name, depth + 1);
                    }
                } else {
                    pos++;
                    int inner = suiteIndent(line);
                    if (inner >= 0) {
                        declarations(inner, container, depth + 1);
                    }
                }
            }
        }

        private Procedure defineProcedure(PythonLines.LogicalLine header, String container, int depth) {
            String text = stripAsync(header.text()).substring(3).strip();
            String blanked = PythonText.blank(text);
            String name = PythonText.leadingWord(text);
            List<String> params = new ArrayList<>();
            int open = blanked.indexOf('(');
            int close = open < 0 ? -1 : PythonText.matching(blanked, open);
            if (close > open) {
                for (String p : PythonText.splitTopLevel(text.substring(open + 1, close), ',')) {
                    if (p.isEmpty() || p.equals("/")) {
                        continue;
                    }
                    if (p.startsWith("*")) {
                        break;
                    }
                    params.add(PythonText.leadingWord(p));
                }
            }
            int myOrder = order++;
            int colon = headerColon(blanked, Math.max(close, 0));
            String inline = colon < 0 ? "" : text.substring(colon + 1).strip();
            pos++;
            List<Stmt> body = suite(header, inline, depth);
            Procedure procedure = new Procedure(name, container, params, body, SourceLanguage.PYTHON, header.line());
            found.add(new Found(depth, myOrder, procedure));
            return procedure;
        }

        // ------------------------------------------------------------ 函数体

        private List<Stmt> statements(int indent, int depth) {
            List<Stmt> result = new ArrayList<>();
            while (pos < lines.size() && lines.get(pos).indent() >= indent) {
                result.addAll(statement(depth));
            }
            return result;
        }

        private List<Stmt> statement(int depth) {
            PythonLines.LogicalLine line = lines.get(pos);
            String text = stripAsync(line.text());
            String word = PythonText.leadingWord(text);
            if (text.startsWith("@")) {
                pos++;
                return List.of();
            }
            switch (word) {
                case "def": {
                    Procedure nested = defineProcedure(line, null, depth);
                    Stmt s = new Stmt(StmtKind.NESTED_DEF,
                            "def " + nested.name() + "(" + String.join(", ", nested.parameters()) + "):", line.line());
                    return List.of(s);
                }
                case "if":
                    return List.of(parseIf(line, text, 2, depth));
                case "for":
                case "while":
                    return List.of(parseLoop(line, text, word, depth));
                case "try":
                    return List.of(parseTry(line, text, depth));
                case "with":
                    return List.of(parseWith(line, text, depth));
                case "class":
                case "elif":
                case "else":
                case "except":
                case "finally":
                    return List.of(unknownCompound(line));
                case "match":
                    if (isSoftKeywordHeader(text)) {
                        return List.of(unknownCompound(line));
                    }
                    break;
                default:
                    break;
            }
            pos++;
            return simpleStatements(text, line.line());
        }

        private Stmt parseIf(PythonLines.LogicalLine line, String text, int keywordLength, int depth) {
            String blanked = PythonText.blank(text);
            int colon = headerColon(blanked, keywordLength);
            if (colon < 0) {
                return unknownCompound(line);
            }
            String cond = text.substring(keywordLength, colon).strip();
            Stmt s = new Stmt(StmtKind.IF, "if " + cond + ":", line.line());
            s.condition = cond;
            s.headCalls.addAll(PythonText.calls(cond));
            pos++;
            s.body = suite(line, text.substring(colon + 1).strip(), depth);

            if (pos < lines.size() && lines.get(pos).indent() == line.indent()) {
                PythonLines.LogicalLine next = lines.get(pos);
                String word = PythonText.leadingWord(next.text());
                if (word.equals("elif")) {
                    s.orElse = new ArrayList<>(List.of(parseIf(next, next.text(), 4, depth)));
                } else if (word.equals("else")) {
                    s.orElse = elseClause(next, depth);
                }
            }
            return s;
        }

        private Stmt parseLoop(PythonLines.LogicalLine line, String text, String keyword, int depth) {
            String blanked = PythonText.blank(text);
            int colon = headerColon(blanked, keyword.length());
            if (colon < 0) {
                return unknownCompound(line);
            }
            String head = text.substring(keyword.length(), colon).strip();
            Stmt s;
            if (keyword.equals("for")) {
                String headBlanked = PythonText.blank(head);
                int in = PythonText.topLevelKeyword(headBlanked, "in", 0);
                if (in < 0) {
                    return unknownCompound(line);
                }
                String target = head.substring(0, in).strip();
                String iterable = head.substring(in + 2).strip();
                s = new Stmt(StmtKind.FOR, "for " + target + " in " + iterable + ":", line.line());
                s.condition = target + " in " + iterable;
                s.headCalls.addAll(PythonText.calls(iterable));
            } else {
                s = new Stmt(StmtKind.WHILE, "while " + head + ":", line.line());
                s.condition = head;
                s.headCalls.addAll(PythonText.calls(head));
            }
            pos++;
            s.body = suite(line, text.substring(colon + 1).strip(), depth);
            if (pos < lines.size() && lines.get(pos).indent() == line.indent()
                    && PythonText.leadingWord(lines.get(pos).text()).equals("else")) {
                s.orElse = elseClause(lines.get(pos), depth);
            }
            return s;
        }

        private Stmt parseTry(PythonLines.LogicalLine line, String text, int depth) {
            int colon = headerColon(PythonText.blank(text), 3);
            if (colon < 0) {
                return unknownCompound(line);
            }
            Stmt s = new Stmt(StmtKind.TRY, "try:", line.line());
            pos++;
            s.body = suite(line, text.substring(colon + 1).strip(), depth);
            while (pos < lines.size() && lines.get(pos).indent() == line.indent()) {
                PythonLines.LogicalLine next = lines.get(pos);
                String word = PythonText.leadingWord(next.text());
                if (word.equals("except")) {
                    s.handlers.add(parseHandler(next, depth));
                } else if (word.equals("else")) {
                    s.orElse = elseClause(next, depth);
                } else if (word.equals("finally")) {
                    s.finalBody = elseClause(next, depth);
                } else {
                    break;
                }
            }
            return s;
        }

        private Stmt parseHandler(PythonLines.LogicalLine line, int depth) {
            String text = line.text();
            int colon = headerColon(PythonText.blank(text), 6);
            if (colon < 0) {
                Stmt unknown = unknownCompound(line);
                return new Stmt(StmtKind.EXCEPT_HANDLER, unknown.code, unknown.line);
            }
            String head = text.substring(6, colon).strip();
            Stmt s = new Stmt(StmtKind.EXCEPT_HANDLER, head.isEmpty() ? "except:" : "except " + head + ":", line.line());
            pos++;
            s.body = suite(line, text.substring(colon + 1).strip(), depth);
            return s;
        }

        private Stmt parseWith(PythonLines.LogicalLine line, String text, int depth) {
            int colon = headerColon(PythonText.blank(text), 4);
            if (colon < 0) {
                return unknownCompound(line);
            }
            String items = text.substring(4, colon).strip();
            Stmt s = new Stmt(StmtKind.WITH, "with " + items + ":", line.line());
            s.headCalls.addAll(PythonText.calls(items));
            pos++;
            s.body = suite(line, text.substring(colon + 1).strip(), depth);
            return s;
        }

        /**
         * else / finally 子句：返回子句体。
         */
        private List<Stmt> elseClause(PythonLines.LogicalLine line, int depth) {
            int colon = headerColon(PythonText.blank(line.text()), 0);
            pos++;
            return suite(line, colon < 0 ? "" : line.text().substring(colon + 1).strip(), depth);
        }

        /**
         * 无法处理的复合语句：整个头部作为一条 unknown 语句，其子句体跳过。
         */
        private Stmt unknownCompound(PythonLines.LogicalLine line) {
            pos++;
            while (pos < lines.size() && lines.get(pos).indent() > line.indent()) {
                pos++;
            }
            return new Stmt(StmtKind.UNKNOWN, line.text(), line.line());
        }

        private List<Stmt> suite(PythonLines.LogicalLine header, String inline, int depth) {
            if (!inline.isEmpty()) {
                return simpleStatements(inline, header.line());
            }
            int inner = suiteIndent(header);
            return inner < 0 ? new ArrayList<>() : statements(inner, depth + 1);
        }

        private int suiteIndent(PythonLines.LogicalLine header) {
            if (pos < lines.size() && lines.get(pos).indent() > header.indent()) {
                return lines.get(pos).indent();
            }
            return -1;
        }

        // ------------------------------------------------------------ 简单语句

        private List<Stmt> simpleStatements(String text, int line) {
            List<Stmt> result = new ArrayList<>();
            for (String part : PythonText.splitTopLevel(text, ';')) {
                // 单独的字符串字面量（docstring 或注释用字符串）不产生语句
                if (!part.isEmpty() && !PythonText.isStringLiteralOnly(part)) {
                    result.add(simple(part, line));
                }
            }
            return result;
        }

        private Stmt simple(String text, int line) {
            String word = PythonText.leadingWord(text);
            StmtKind kind;
            switch (word) {
                case "return":
                    return returnStatement(text, line);
                case "break":
                    kind = StmtKind.BREAK;
                    break;
                case "continue":
                    kind = StmtKind.CONTINUE;
                    break;
                case "pass":
                    kind = StmtKind.PASS;
                    break;
                case "assert":
                    kind = StmtKind.ASSERT;
                    break;
                case "raise":
                    kind = StmtKind.RAISE;
                    break;
                case "del":
                    kind = StmtKind.DELETE;
                    break;
                case "import":
                case "from":
                    kind = StmtKind.IMPORT;
                    break;
                case "global":
                    kind = StmtKind.GLOBAL;
                    break;
                case "nonlocal":
                    kind = StmtKind.NONLOCAL;
                    break;
                case "lambda":
                case "yield":
                case "await":
                    kind = StmtKind.EXPRESSION;
                    break;
                default:
                    kind = assignmentKind(PythonText.blank(text));
            }
            Stmt s = new Stmt(kind, text, line);
            s.headCalls.addAll(PythonText.calls(text));
            return s;
        }

        private Stmt returnStatement(String text, int line) {
            Stmt s = new Stmt(StmtKind.RETURN, text, line);
            String expr = text.substring(6).strip();
            s.comprehension = expr.isEmpty() ? null : comprehension(expr);
            if (s.comprehension != null) {
                // 推导式各部分的调用挂在展开出的合成 block 上，return 只保留剩余部分的调用
                s.headCalls.addAll(PythonText.calls(s.comprehension.returnText()));
            } else {
                s.headCalls.addAll(PythonText.calls(expr));
            }
            return s;
        }

        /**
         * 先找列表推导式，再找生成器表达式（括号或调用参数形式），只取第一个 for 子句。
         */
        private static Comprehension comprehension(String expr) {
            String blanked = PythonText.blank(expr);
            for (char open : new char[]{'[', '('}) {
                for (int i = blanked.indexOf(open); i >= 0; i = blanked.indexOf(open, i + 1)) {
                    Comprehension c = comprehensionAt(expr, blanked, i, open == '(');
                    if (c != null) {
                        return c;
                    }
                }
            }
            return null;
        }

        private static Comprehension comprehensionAt(String expr, String blanked, int open, boolean generator) {
            int close = PythonText.matching(blanked, open);
            if (close < 0) {
                return null;
            }
            String content = expr.substring(open + 1, close);
            String cb = blanked.substring(open + 1, close);
            int forAt = PythonText.topLevelKeyword(cb, "for", 0);
            if (forAt < 0) {
                return null;
            }
            int inAt = PythonText.topLevelKeyword(cb, "in", forAt + 3);
            if (inAt < 0) {
                return null;
            }
            String element = content.substring(0, forAt).strip();
            String target = content.substring(forAt + 3, inAt).strip();
            int iterStart = inAt + 2;
            int nextFor = PythonText.topLevelKeyword(cb, "for", iterStart);
            int ifAt = PythonText.topLevelKeyword(cb, "if", iterStart);
            int iterEnd = firstOf(content.length(), nextFor, ifAt);
            String iterable = content.substring(iterStart, iterEnd).strip();
            String filter = null;
            if (ifAt >= 0 && (nextFor < 0 || ifAt < nextFor)) {
                int filterEnd = firstOf(content.length(),
                        PythonText.topLevelKeyword(cb, "if", ifAt + 2), nextFor);
                filter = content.substring(ifAt + 2, filterEnd).strip();
            }

            String replaced;
            String name = generator ? Comprehension.GENERATOR_RESULT : Comprehension.LIST_RESULT;
            if (generator && isCallParen(blanked, open)) {
                replaced = expr.substring(0, open + 1) + name + expr.substring(close);
            } else {
                replaced = expr.substring(0, open) + name + expr.substring(close + 1);
            }
            return new Comprehension(generator, element, target, iterable, filter, "return " + replaced,
                    PythonText.calls(element), PythonText.calls(iterable),
                    filter == null ? Set.of() : PythonText.calls(filter));
        }

        private static int firstOf(int fallback, int... positions) {
            int best = fallback;
            for (int p : positions) {
                if (p >= 0 && p < best) {
                    best = p;
                }
            }
            return best;
        }

        private static boolean isCallParen(String blanked, int open) {
            int i = open - 1;
            while (i >= 0 && blanked.charAt(i) == ' ') {
                i--;
            }
            if (i < 0) {
                return false;
            }
            char c = blanked.charAt(i);
            if (c == ')' || c == ']') {
                return true;
            }
            if (!PythonText.isWordChar(c)) {
                return false;
            }
            int start = i;
            while (start > 0 && PythonText.isWordChar(blanked.charAt(start - 1))) {
                start--;
            }
            return !PythonText.KEYWORDS.contains(blanked.substring(start, i + 1));
        }

        /**
         * 顶层运算符分类：{@code x: T [= v]} 为带注解赋值，{@code op=} 为增量赋值，单个 {@code =} 为赋值。
         */
        private static StmtKind assignmentKind(String blanked) {
            int eq = -1;
            boolean augmented = false;
            int depth = 0;
            for (int i = 0; i < blanked.length() && eq < 0; i++) {
                char c = blanked.charAt(i);
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                } else if (c == '=' && depth == 0) {
                    if (i + 1 < blanked.length() && blanked.charAt(i + 1) == '=') {
                        i++;
                        continue;
                    }
                    char prev = i > 0 ? blanked.charAt(i - 1) : ' ';
                    if (prev == '!' || prev == ':') {
                        continue;
                    }
                    if (prev == '<' || prev == '>') {
                        if (i > 1 && blanked.charAt(i - 2) == prev) {
                            eq = i;
                            augmented = true;
                        }
                        continue;
                    }
                    eq = i;
                    augmented = "+-*/%&|^@".indexOf(prev) >= 0;
                }
            }
            int colon = headerColon(blanked, 0);
            if (colon >= 0 && (eq < 0 || colon < eq)) {
                return StmtKind.ANNOTATED_ASSIGNMENT;
            }
            if (eq >= 0) {
                return augmented ? StmtKind.AUGMENTED_ASSIGNMENT : StmtKind.ASSIGNMENT;
            }
            return StmtKind.EXPRESSION;
        }

        // ------------------------------------------------------------ 工具

        /**
         * @return from 之后第一个深度为 0 的冒号（跳过 :=），找不到时为 -1
         */
        private static int headerColon(String blanked, int from) {
            int at = PythonText.topLevelIndex(blanked, ':', from);
            while (at >= 0 && at + 1 < blanked.length() && blanked.charAt(at + 1) == '=') {
                at = PythonText.topLevelIndex(blanked, ':', at + 2);
            }
            return at;
        }

        private static boolean isSoftKeywordHeader(String text) {
            String blanked = PythonText.blank(text).stripTrailing();
            return blanked.endsWith(":") && headerColon(blanked, 0) == blanked.length() - 1
                    && assignmentKind(blanked.substring(0, blanked.length() - 1)) == StmtKind.EXPRESSION;
        }

        private static String stripAsync(String text) {
            if (text.startsWith("async ") || text.startsWith("async\t")) {
                return text.substring(6).strip();
            }
            return text;
        }
    }
}
