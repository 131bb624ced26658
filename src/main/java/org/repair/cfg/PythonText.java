package org.repair.cfg;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 逻辑行内的文本扫描工具。所有"顶层"查找都在字符串内容被抹掉的副本上进行，
 * 且只认括号深度为 0 的位置。
 */
final class PythonText {

    private static final Pattern CALL = Pattern.compile("(?<![\\w.])([A-Za-z_]\\w*)\\s*\\(");

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private PythonText() {
    }

    /**
     * 字符串字面量的内容替换为空格，引号保留，长度不变。
     */
    static String blank(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c != '\'' && c != '"') {
                out.append(c);
                i++;
                continue;
            }
            boolean triple = text.startsWith(String.valueOf(c).repeat(3), i);
            int q = triple ? 3 : 1;
            out.append(text, i, i + q);
            i += q;
            while (i < n) {
                char d = text.charAt(i);
                if (d == '\\' && i + 1 < n) {
                    out.append(blankChar(d)).append(blankChar(text.charAt(i + 1)));
                    i += 2;
                    continue;
                }
                if (d == c && (!triple || text.startsWith(String.valueOf(c).repeat(3), i))) {
                    out.append(text, i, i + q);
                    i += q;
                    break;
                }
                out.append(blankChar(d));
                i++;
            }
        }
        return out.toString();
    }

    private static char blankChar(char c) {
        return c == '\n' ? '\n' : ' ';
    }

    /**
     * @return 从 from 开始第一个深度为 0 的字符 c，找不到时为 -1
     */
    static int topLevelIndex(String blanked, char target, int from) {
        int depth = 0;
        for (int i = from; i < blanked.length(); i++) {
            char c = blanked.charAt(i);
            if (c == target && depth == 0) {
                return i;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
        }
        return -1;
    }

    /**
     * 查找深度为 0 的关键字（按单词边界）。
     *
     * @return 关键字起始位置，找不到时为 -1
     */
    static int topLevelKeyword(String blanked, String keyword, int from) {
        int depth = 0;
        for (int i = from; i < blanked.length(); i++) {
            char c = blanked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && blanked.startsWith(keyword, i)
                    && (i == 0 || !isWordChar(blanked.charAt(i - 1)))
                    && (i + keyword.length() == blanked.length() || !isWordChar(blanked.charAt(i + keyword.length())))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return 与 open 位置的开括号配对的闭括号位置，找不到时为 -1
     */
    static int matching(String blanked, int open) {
        int depth = 0;
        for (int i = open; i < blanked.length(); i++) {
            char c = blanked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 在深度为 0 的分隔符处切分，返回原文片段（已去除首尾空白）。
     */
    static List<String> splitTopLevel(String text, char separator) {
        String blanked = blank(text);
        List<String> parts = new ArrayList<>();
        int start = 0;
        int at;
        while ((at = topLevelIndex(blanked, separator, start)) >= 0) {
            parts.add(text.substring(start, at).strip());
            start = at + 1;
        }
        parts.add(text.substring(start).strip());
        return parts;
    }

    /**
     * @return 文本中以普通名字调用的函数名（不含属性调用和关键字），按出现顺序
     */
    static Set<String> calls(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        Matcher m = CALL.matcher(blank(text));
        while (m.find()) {
            if (!KEYWORDS.contains(m.group(1))) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    /**
     * @return 开头的标识符，没有时为空串
     */
    static String leadingWord(String text) {
        int i = 0;
        while (i < text.length() && isWordChar(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i);
    }

    /**
     * 整行只由字符串字面量（可带前缀、可相邻拼接）组成，如 docstring。
     */
    static boolean isStringLiteralOnly(String text) {
        String blanked = blank(text);
        int i = 0;
        int n = blanked.length();
        boolean any = false;
        while (i < n) {
            char c = blanked.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int j = i;
            while (j < n && j - i < 2 && "rRbBuUfF".indexOf(blanked.charAt(j)) >= 0) {
                j++;
            }
            if (j >= n || (blanked.charAt(j) != '\'' && blanked.charAt(j) != '"')) {
                return false;
            }
            char q = blanked.charAt(j);
            int ql = blanked.startsWith(String.valueOf(q).repeat(3), j) ? 3 : 1;
            int close = blanked.indexOf(String.valueOf(q).repeat(ql), j + ql);
            if (close < 0) {
                return false;
            }
            i = close + ql;
            any = true;
        }
        return any;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
