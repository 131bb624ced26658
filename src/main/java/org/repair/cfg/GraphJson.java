package org.repair.cfg;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializer;

/**
 * 把图导出为 JSON（block、边、END id、根签名与警告）。
 * 构建期字段标记为 transient，不参与输出。
 */
public final class GraphJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapter(Edge.class, (JsonSerializer<Edge>) (edge, type, context) -> {
                JsonObject o = new JsonObject();
                o.addProperty("from", edge.from());
                o.addProperty("to", edge.to());
                o.addProperty("label", edge.label());
                return o;
            })
            .create();

    private GraphJson() {
    }

    public static String toJson(ControlFlowGraph graph) {
        return GSON.toJson(graph);
    }
}
