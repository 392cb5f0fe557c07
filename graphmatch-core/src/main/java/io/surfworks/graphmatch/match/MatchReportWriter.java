package io.surfworks.graphmatch.match;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import io.surfworks.graphmatch.ir.Graph;
import io.surfworks.graphmatch.ir.Node;
import io.surfworks.graphmatch.ir.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Writes match results as a JSON document for inspecting pass pipelines.
 *
 * <pre>{@code
 * {
 *   "pattern": { "nodes": 1, "root": "aten::add" },
 *   "graph": { "nodes": 3 },
 *   "matchCount": 1,
 *   "matches": [
 *     {
 *       "anchor": { "id": 4, "kind": "aten::add" },
 *       "nodes": [ { "pattern": "aten::add#2", "target": "aten::add#4" } ],
 *       "values": [ { "pattern": "%a", "target": "%x" }, ... ]
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Correspondences are sorted by pattern id so output is stable.
 */
public final class MatchReportWriter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private MatchReportWriter() {}

    /**
     * Builds the report as a JSON tree.
     */
    public static JsonObject toJsonTree(Graph pattern, Graph graph, List<Match> matches) {
        JsonObject report = new JsonObject();

        JsonObject patternInfo = new JsonObject();
        patternInfo.addProperty("nodes", pattern.nodes().size());
        if (pattern.returnNode().inputs().size() == 1) {
            patternInfo.addProperty("root", pattern.returnNode().input().node().kind().qualifiedName());
        }
        report.add("pattern", patternInfo);

        JsonObject graphInfo = new JsonObject();
        graphInfo.addProperty("nodes", graph.nodes().size());
        report.add("graph", graphInfo);

        report.addProperty("matchCount", matches.size());
        JsonArray matchArray = new JsonArray();
        for (Match match : matches) {
            matchArray.add(matchToJson(match));
        }
        report.add("matches", matchArray);
        return report;
    }

    /**
     * Renders the report as pretty-printed JSON.
     */
    public static String toJson(Graph pattern, Graph graph, List<Match> matches) {
        return GSON.toJson(toJsonTree(pattern, graph, matches));
    }

    /**
     * Writes the report to a file, creating parent directories.
     *
     * @throws IOException if writing fails
     */
    public static void write(Graph pattern, Graph graph, List<Match> matches, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(pattern, graph, matches), StandardCharsets.UTF_8);
    }

    private static JsonObject matchToJson(Match match) {
        JsonObject json = new JsonObject();

        JsonObject anchor = new JsonObject();
        anchor.addProperty("id", match.anchor().id());
        anchor.addProperty("kind", match.anchor().kind().qualifiedName());
        json.add("anchor", anchor);

        JsonArray nodes = new JsonArray();
        match.nodeMap().entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<Node, Node> e) -> e.getKey().id()))
                .forEach(e -> nodes.add(pair(e.getKey().toString(), e.getValue().toString())));
        json.add("nodes", nodes);

        JsonArray values = new JsonArray();
        match.valueMap().entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<Value, Value> e) -> e.getKey().id()))
                .forEach(e -> values.add(pair(e.getKey().toString(), e.getValue().toString())));
        json.add("values", values);
        return json;
    }

    private static JsonObject pair(String pattern, String target) {
        JsonObject pair = new JsonObject();
        pair.addProperty("pattern", pattern);
        pair.addProperty("target", target);
        return pair;
    }
}
