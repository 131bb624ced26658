package org.repair.cfg;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.repair.cfg.CfgFixtures.*;

/**
 * JSON 导出测试
 */
public class GraphJsonTest {

    @Test
    public void testGraphFields() {
        ControlFlowGraph g = python("""
                def f(x):
                    y = g(x)
                    return y

                def g(v):
                    return v
                """);

        JsonObject json = JsonParser.parseString(GraphJson.toJson(g)).getAsJsonObject();
        assertEquals("f(x)", json.get("signature").getAsString());
        assertEquals("f", json.get("root").getAsString());
        assertEquals(0, json.get("entry").getAsInt());
        assertEquals(3, json.get("end").getAsInt());

        JsonArray blocks = json.getAsJsonArray("blocks");
        assertEquals(3, blocks.size());
        JsonObject first = blocks.get(0).getAsJsonObject();
        assertEquals("y = g(x)", first.get("code").getAsString());
        assertEquals("ASSIGNMENT", first.get("kind").getAsString());
        assertEquals("g", first.getAsJsonArray("calls").get(0).getAsString());
        assertEquals("g", blocks.get(2).getAsJsonObject().get("procedure").getAsString());

        JsonArray edges = json.getAsJsonArray("edges");
        assertEquals(g.edges().size(), edges.size());
        JsonObject edge = edges.get(0).getAsJsonObject();
        assertTrue(edge.has("from"));
        assertTrue(edge.has("to"));
        assertTrue(edge.has("label"));
        assertFalse(edge.has("kind"));
    }

    @Test
    public void testBuildStateIsNotExported() {
        ControlFlowGraph g = python("""
                def f(a):
                    return a
                """);

        JsonObject json = JsonParser.parseString(GraphJson.toJson(g)).getAsJsonObject();
        assertFalse(json.has("layouts"));
        assertFalse(json.has("implicitExits"));
        assertFalse(json.has("maxBlocks"));
        assertTrue(json.getAsJsonArray("warnings").isEmpty());
    }

    @Test
    public void testConditionLabelsAreNotHtmlEscaped() {
        ControlFlowGraph g = python("""
                def f(a):
                    if a < 1:
                        return 0
                    return a
                """);

        String json = GraphJson.toJson(g);
        assertTrue(json.contains("\"condition_true:a < 1\""), json);
    }
}
