package org.repair.cfg;

import java.util.List;

/**
 * 源码整体无法解析（单条语句无法识别时不会抛出，而是退化为 unknown block）。
 */
public class SourceParseException extends CfgException {

    private final List<String> problems;

    public SourceParseException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return 形如 "Line 3: ..." 的问题列表
     */
    public List<String> getProblems() {
        return problems;
    }
}
