package org.repair.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 逻辑行切分
 */
public class PythonLinesTest {

    @Test
    public void testIndentAndLineNumbers() {
        List<PythonLines.LogicalLine> lines = PythonLines.split("def f():\n\n    x = 1\n\tif x:\n");
        assertEquals(3, lines.size());
        assertEquals(new PythonLines.LogicalLine("def f():", 0, 1), lines.get(0));
        assertEquals(new PythonLines.LogicalLine("x = 1", 4, 3), lines.get(1));
        assertEquals(8, lines.get(2).indent());
    }

    @Test
    public void testTripleQuotedStringKeepsNewlines() {
        List<PythonLines.LogicalLine> lines = PythonLines.split("s = '''a\n# b'''\nt = 1\n");
        assertEquals(2, lines.size());
        assertEquals("s = '''a\n# b'''", lines.get(0).text());
        assertEquals(3, lines.get(1).line());
    }

    @Test
    public void testCommentOnlyLinesAreSkipped() {
        List<PythonLines.LogicalLine> lines = PythonLines.split("# header\n    # indented\nx = 'a#b'  # tail\n");
        assertEquals(1, lines.size());
        assertEquals("x = 'a#b'", lines.get(0).text());
    }

    @Test
    public void testCrLfAndBracketJoin() {
        List<PythonLines.LogicalLine> lines = PythonLines.split("f(\r\n    a,\r\n    b\r\n)\r\n");
        assertEquals(1, lines.size());
        assertEquals("f(a, b)", lines.get(0).text());
    }
}
