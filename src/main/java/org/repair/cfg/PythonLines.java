package org.repair.cfg;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 Python 源码切分为逻辑行：括号内换行与反斜杠续行并入同一行，字符串外的注释去掉，空行跳过。
 * 三引号字符串中的换行原样保留。
 */
final class PythonLines {

    /**
     * 一个逻辑行
     *
     * @param text   去掉缩进和注释后的文本
     * @param indent 缩进列数（tab 补齐到 8 的倍数）
     * @param line   起始物理行号（从 1 开始）
     */
    record LogicalLine(String text, int indent, int line) {
    }

    private PythonLines() {
    }

    static List<LogicalLine> split(String source) {
        List<LogicalLine> result = new ArrayList<>();
        String src = source.replace("\r\n", "\n").replace('\r', '\n');
        int n = src.length();
        int i = 0;
        int lineNo = 1;
        while (i < n) {
            // 行首缩进
            int indent = 0;
            while (i < n && (src.charAt(i) == ' ' || src.charAt(i) == '\t' || src.charAt(i) == '\f')) {
                char c = src.charAt(i);
                if (c == '\t') {
                    indent = (indent / 8 + 1) * 8;
                } else if (c == ' ') {
                    indent++;
                }
                i++;
            }
            int startLine = lineNo;
            StringBuilder text = new StringBuilder();
            int depth = 0;
            char quote = 0;         // 当前字符串的引号字符
            boolean triple = false;
            boolean done = false;
            int joinedAt = -1;      // 最近一次续行拼接后的文本长度
            while (i < n && !done) {
                char c = src.charAt(i);
                if (quote != 0) {
                    if (c == '\\' && i + 1 < n) {
                        text.append(c).append(src.charAt(i + 1));
                        if (src.charAt(i + 1) == '\n') {
                            lineNo++;
                        }
                        i += 2;
                        continue;
                    }
                    if (c == '\n') {
                        lineNo++;
                        if (!triple) {
                            // 未闭合的单行字符串，按行结束处理
                            quote = 0;
                            done = true;
                            i++;
                            continue;
                        }
                    }
                    if (c == quote && (!triple || src.startsWith(String.valueOf(c).repeat(3), i))) {
                        int len = triple ? 3 : 1;
                        text.append(src, i, i + len);
                        i += len;
                        quote = 0;
                        continue;
                    }
                    text.append(c);
                    i++;
                    continue;
                }
                switch (c) {
                    case '#':
                        while (i < n && src.charAt(i) != '\n') {
                            i++;
                        }
                        break;
                    case '\'':
                    case '"':
                        quote = c;
                        triple = src.startsWith(String.valueOf(c).repeat(3), i);
                        int len = triple ? 3 : 1;
                        text.append(src, i, i + len);
                        i += len;
                        break;
                    case '\\':
                        if (i + 1 < n && src.charAt(i + 1) == '\n') {
                            lineNo++;
                            i += 2;
                            joinContinuation(text);
                            joinedAt = text.length();
                            i = skipBlanks(src, i);
                        } else {
                            text.append(c);
                            i++;
                        }
                        break;
                    case '(':
                    case '[':
                    case '{':
                        depth++;
                        text.append(c);
                        i++;
                        break;
                    case ')':
                    case ']':
                    case '}':
                        depth = Math.max(0, depth - 1);
                        if (joinedAt == text.length() && joinedAt > 0 && text.charAt(joinedAt - 1) == ' ') {
                            text.setLength(joinedAt - 1);
                        }
                        text.append(c);
                        i++;
                        break;
                    case '\n':
                        lineNo++;
                        i++;
                        if (depth > 0) {
                            joinContinuation(text);
                            joinedAt = text.length();
                            i = skipBlanks(src, i);
                        } else {
                            done = true;
                        }
                        break;
                    default:
                        text.append(c);
                        i++;
                }
            }
            String t = text.toString().strip();
            if (!t.isEmpty()) {
                result.add(new LogicalLine(t, indent, startLine));
            }
        }
        return result;
    }

    /**
     * 续行拼接：开括号之后不加空格，其余情况以单个空格分隔。
     */
    private static void joinContinuation(StringBuilder text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        text.setLength(end);
        if (end > 0) {
            char last = text.charAt(end - 1);
            if (last != '(' && last != '[' && last != '{') {
                text.append(' ');
            }
        }
    }

    private static int skipBlanks(String src, int i) {
        while (i < src.length() && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
