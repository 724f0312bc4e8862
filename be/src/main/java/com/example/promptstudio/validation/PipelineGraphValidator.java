package com.example.promptstudio.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates an untyped pipeline graph document ({@code {"nodes": [...], "edges": [...]}}).
 * <p>
 * Reports every structural problem it finds, in discovery order: node problems, then edge
 * problems, then a single cycle error. Never throws.
 * </p>
 */
public final class PipelineGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraphValidator.class);

    static final String NOT_AN_OBJECT = "Graph must be a valid object";
    static final String MISSING_NODES = "Graph must contain a nodes array";
    static final String MISSING_EDGES = "Graph must contain an edges array";
    static final String NODE_WITHOUT_ID = "Each node must have a string id";
    static final String EDGE_WITHOUT_SOURCE = "Each edge must have a string source";
    static final String EDGE_WITHOUT_TARGET = "Each edge must have a string target";
    static final String CYCLE = "Pipeline graph contains cycles";
    static final String INTERNAL_ERROR = "Validation failed due to internal error";

    private PipelineGraphValidator() {
    }

    public static GraphValidationResult validate(Object graph) {
        try {
            return GraphValidationResult.of(collectErrors(graph));
        } catch (RuntimeException e) {
            log.error("Graph validation failed unexpectedly: {}", e.getMessage(), e);
            return new GraphValidationResult(false, List.of(INTERNAL_ERROR));
        }
    }

    private static List<String> collectErrors(Object graph) {
        List<String> errors = new ArrayList<>();
        // a bare array is structured but carries neither array
        if (!(graph instanceof Map<?, ?>) && !(graph instanceof List<?>)) {
            errors.add(NOT_AN_OBJECT);
            return errors;
        }
        Object nodes = field(graph, "nodes");
        Object edges = field(graph, "edges");
        if (!(nodes instanceof List<?>)) {
            errors.add(MISSING_NODES);
        }
        if (!(edges instanceof List<?>)) {
            errors.add(MISSING_EDGES);
        }
        if (!errors.isEmpty()) {
            return errors;
        }

        Set<String> nodeIds = new HashSet<>();
        for (Object node : (List<?>) nodes) {
            Object id = field(node, "id");
            if (!isNonEmptyString(id)) {
                errors.add(NODE_WITHOUT_ID);
                continue;
            }
            String nodeId = (String) id;
            if (!nodeIds.add(nodeId)) {
                errors.add("Duplicate node id: " + nodeId);
            }
            if (!isNonEmptyString(field(node, "type"))) {
                errors.add("Node " + nodeId + " must have a string type");
            }
        }

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            adjacency.put(nodeId, new ArrayList<>());
        }
        for (Object edge : (List<?>) edges) {
            Object source = field(edge, "source");
            Object target = field(edge, "target");
            if (!isNonEmptyString(source)) {
                errors.add(EDGE_WITHOUT_SOURCE);
                continue;
            }
            if (!isNonEmptyString(target)) {
                errors.add(EDGE_WITHOUT_TARGET);
                continue;
            }
            if (!nodeIds.contains(source)) {
                errors.add("Edge references non-existent source node: " + source);
            }
            if (!nodeIds.contains(target)) {
                errors.add("Edge references non-existent target node: " + target);
            }
            adjacency.computeIfAbsent((String) source, k -> new ArrayList<>()).add((String) target);
            adjacency.computeIfAbsent((String) target, k -> new ArrayList<>());
        }

        if (hasCycle(adjacency)) {
            errors.add(CYCLE);
        }
        return errors;
    }

    /**
     * Iterative DFS with an explicit on-stack set; a back edge to a node on the current path is a cycle.
     */
    private static boolean hasCycle(Map<String, List<String>> adjacency) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Map<String, Iterator<String>> pending = new HashMap<>();
        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            path.push(start);
            visited.add(start);
            onStack.add(start);
            pending.put(start, adjacency.get(start).iterator());
            while (!path.isEmpty()) {
                String current = path.peek();
                Iterator<String> next = pending.get(current);
                if (next.hasNext()) {
                    String neighbour = next.next();
                    if (onStack.contains(neighbour)) {
                        return true;
                    }
                    if (visited.add(neighbour)) {
                        path.push(neighbour);
                        onStack.add(neighbour);
                        pending.put(neighbour, adjacency.getOrDefault(neighbour, List.of()).iterator());
                    }
                } else {
                    path.pop();
                    onStack.remove(current);
                }
            }
        }
        return false;
    }

    /**
     * Reads a property of a graph element. Scalars have no properties; a {@code null} element is malformed
     * input and aborts validation.
     */
    private static Object field(Object element, String name) {
        if (element == null) {
            throw new IllegalArgumentException("Graph contains a null element where an object was expected");
        }
        return element instanceof Map<?, ?> map ? map.get(name) : null;
    }

    private static boolean isNonEmptyString(Object value) {
        return value instanceof String s && !s.isEmpty();
    }
}
