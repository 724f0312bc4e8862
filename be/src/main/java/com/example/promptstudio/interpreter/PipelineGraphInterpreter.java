package com.example.promptstudio.interpreter;

import com.example.promptstudio.service.JsonDocuments;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Walks a pipeline graph's nodes in document order and simulates each one against the call input.
 * Edges are not followed.
 */
public class PipelineGraphInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraphInterpreter.class);

    private final JsonDocuments jsonDocuments;

    public PipelineGraphInterpreter(JsonDocuments jsonDocuments) {
        this.jsonDocuments = Objects.requireNonNull(jsonDocuments, "jsonDocuments");
    }

    /**
     * Processes every node and returns the per-node results plus the pipeline output
     * ({@code pipelineId}, {@code result} of the last node, {@code processedNodes}).
     */
    public Interpretation interpret(String pipelineId, Map<String, Object> graph, Map<String, Object> input) {
        Objects.requireNonNull(pipelineId, "pipelineId");
        Objects.requireNonNull(graph, "graph");
        String inputJson = jsonDocuments.write(input != null ? input : Map.of());
        List<NodeResult> nodeResults = new ArrayList<>();
        for (Object node : nodes(graph)) {
            long start = System.nanoTime();
            Map<String, Object> output = processNode(node, inputJson);
            long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            nodeResults.add(new NodeResult((String) output.get("nodeId"), output, duration));
        }
        log.debug("Interpreted pipeline id={} nodes={}", pipelineId, nodeResults.size());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("pipelineId", pipelineId);
        output.put("result", nodeResults.isEmpty()
                ? Map.of("message", "Pipeline executed successfully")
                : nodeResults.get(nodeResults.size() - 1).output());
        output.put("processedNodes", nodeResults.size());
        return new Interpretation(output, nodeResults);
    }

    private Map<String, Object> processNode(Object node, String inputJson) {
        Map<?, ?> fields = node instanceof Map<?, ?> map ? map : Map.of();
        Object id = fields.get("id");
        Object type = fields.get("type");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("nodeId", id != null ? String.valueOf(id) : null);
        output.put("type", type);
        output.put("result", "Processed " + type + " with input: " + inputJson);
        return output;
    }

    private static List<?> nodes(Map<String, Object> graph) {
        return graph.get("nodes") instanceof List<?> list ? list : List.of();
    }

    public record Interpretation(Map<String, Object> output, List<NodeResult> nodeResults) {
    }
}
