package com.example.promptstudio.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PipelineGraphValidator")
class PipelineGraphValidatorTest {

    @Nested
    @DisplayName("valid graph")
    class ValidGraph {

        @Test
        @DisplayName("accepts an empty graph")
        void emptyGraphIsValid() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(List.of(), List.of()));

            assertTrue(result.valid());
            assertTrue(result.errors().isEmpty());
        }

        @Test
        @DisplayName("accepts a linear chain")
        void linearChainIsValid() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "input"), node("b", "llm"), node("c", "output")),
                    List.of(edge("a", "b"), edge("b", "c"))));

            assertTrue(result.valid());
        }

        @Test
        @DisplayName("accepts a diamond where two paths join")
        void diamondIsValid() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "input"), node("b", "llm"), node("c", "llm"), node("d", "output")),
                    List.of(edge("a", "b"), edge("a", "c"), edge("b", "d"), edge("c", "d"))));

            assertTrue(result.valid());
        }

        @Test
        @DisplayName("handles a long chain without stack overflow")
        void deepChainIsValid() {
            List<Object> nodes = new ArrayList<>();
            List<Object> edges = new ArrayList<>();
            for (int i = 0; i < 20_000; i++) {
                nodes.add(node("n" + i, "llm"));
                if (i > 0) {
                    edges.add(edge("n" + (i - 1), "n" + i));
                }
            }

            assertTrue(PipelineGraphValidator.validate(graph(nodes, edges)).valid());
        }
    }

    @Nested
    @DisplayName("structure errors")
    class StructureErrors {

        @Test
        @DisplayName("rejects a non-object graph")
        void nonObjectRejected() {
            assertEquals(List.of(PipelineGraphValidator.NOT_AN_OBJECT), PipelineGraphValidator.validate("graph").errors());
            assertEquals(List.of(PipelineGraphValidator.NOT_AN_OBJECT), PipelineGraphValidator.validate(null).errors());
            assertEquals(List.of(PipelineGraphValidator.NOT_AN_OBJECT), PipelineGraphValidator.validate(42).errors());
        }

        @Test
        @DisplayName("treats a bare array as a graph without nodes and edges")
        void arrayGraphMissesBothArrays() {
            GraphValidationResult result = PipelineGraphValidator.validate(List.of());

            assertFalse(result.valid());
            assertEquals(List.of(PipelineGraphValidator.MISSING_NODES, PipelineGraphValidator.MISSING_EDGES), result.errors());
        }

        @Test
        @DisplayName("collapses a null node or edge into the internal error")
        void nullElementIsInternalError() {
            GraphValidationResult nullNode = PipelineGraphValidator.validate(graph(Arrays.asList(node("a", "llm"), null), List.of()));
            GraphValidationResult nullEdge = PipelineGraphValidator.validate(graph(List.of(node("a", "llm")), Arrays.asList((Object) null)));

            assertEquals(new GraphValidationResult(false, List.of(PipelineGraphValidator.INTERNAL_ERROR)), nullNode);
            assertEquals(new GraphValidationResult(false, List.of(PipelineGraphValidator.INTERNAL_ERROR)), nullEdge);
        }

        @Test
        @DisplayName("reports both missing arrays and stops")
        void missingArraysReported() {
            GraphValidationResult result = PipelineGraphValidator.validate(Map.of("nodes", "not a list"));

            assertFalse(result.valid());
            assertEquals(List.of(PipelineGraphValidator.MISSING_NODES, PipelineGraphValidator.MISSING_EDGES), result.errors());
        }

        @Test
        @DisplayName("reports nodes without a string id")
        void nodeWithoutId() {
            Map<String, Object> numericId = new HashMap<>();
            numericId.put("id", 7);
            numericId.put("type", "llm");
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    Arrays.asList(Map.of("type", "llm"), numericId, node("", "llm"), "not a node"),
                    List.of()));

            assertEquals(4, result.errors().size());
            assertTrue(result.errors().stream().allMatch(PipelineGraphValidator.NODE_WITHOUT_ID::equals));
        }

        @Test
        @DisplayName("reports every repeat of a duplicate id")
        void duplicatesPerRepeat() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "llm"), node("a", "llm"), node("a", "llm")),
                    List.of()));

            assertEquals(List.of("Duplicate node id: a", "Duplicate node id: a"), result.errors());
        }

        @Test
        @DisplayName("reports nodes without a string type")
        void missingType() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(Map.of("id", "a"), Map.of("id", "b", "type", 3), node("c", "")),
                    List.of()));

            assertEquals(List.of("Node a must have a string type", "Node b must have a string type",
                    "Node c must have a string type"), result.errors());
        }

        @Test
        @DisplayName("reports edges without source or target and keeps going")
        void edgeWithoutEndpoints() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "llm")),
                    List.of(Map.of("target", "a"), Map.of("source", "a"), Map.of("source", "", "target", ""))));

            assertEquals(List.of(
                    PipelineGraphValidator.EDGE_WITHOUT_SOURCE,
                    PipelineGraphValidator.EDGE_WITHOUT_TARGET,
                    PipelineGraphValidator.EDGE_WITHOUT_SOURCE), result.errors());
        }

        @Test
        @DisplayName("reports dangling edges without crashing")
        void danglingEdges() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "llm")),
                    List.of(edge("a", "ghost"), edge("phantom", "a"))));

            assertEquals(List.of(
                    "Edge references non-existent target node: ghost",
                    "Edge references non-existent source node: phantom"), result.errors());
        }
    }

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        @DisplayName("treats a self-loop as a cycle")
        void selfLoop() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "llm")),
                    List.of(edge("a", "a"))));

            assertEquals(List.of(PipelineGraphValidator.CYCLE), result.errors());
        }

        @Test
        @DisplayName("reports missing types before the cycle error")
        void threeNodeCycleWithoutTypes() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(Map.of("id", "a"), Map.of("id", "b"), Map.of("id", "c")),
                    List.of(edge("a", "b"), edge("b", "c"), edge("c", "a"))));

            assertFalse(result.valid());
            assertEquals(List.of(
                    "Node a must have a string type",
                    "Node b must have a string type",
                    "Node c must have a string type",
                    PipelineGraphValidator.CYCLE), result.errors());
        }

        @Test
        @DisplayName("finds a cycle through nodes that do not exist")
        void cycleThroughUnknownNodes() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(),
                    List.of(edge("x", "y"), edge("y", "x"))));

            assertTrue(result.errors().contains(PipelineGraphValidator.CYCLE));
            assertEquals(5, result.errors().size());
        }

        @Test
        @DisplayName("reports a single cycle error for several cycles")
        void singleCycleError() {
            GraphValidationResult result = PipelineGraphValidator.validate(graph(
                    List.of(node("a", "llm"), node("b", "llm"), node("c", "llm"), node("d", "llm")),
                    List.of(edge("a", "b"), edge("b", "a"), edge("c", "d"), edge("d", "c"))));

            assertEquals(List.of(PipelineGraphValidator.CYCLE), result.errors());
        }
    }

    @Test
    @DisplayName("gives the same result when run twice")
    void idempotent() {
        Map<String, Object> graph = graph(
                List.of(node("a", "llm"), Map.of("id", "b")),
                List.of(edge("a", "b"), edge("b", "a"), edge("a", "z")));

        assertEquals(PipelineGraphValidator.validate(graph), PipelineGraphValidator.validate(graph));
    }

    private static Map<String, Object> graph(List<?> nodes, List<?> edges) {
        return Map.of("nodes", nodes, "edges", edges);
    }

    private static Map<String, Object> node(String id, String type) {
        return Map.of("id", id, "type", type);
    }

    private static Map<String, Object> edge(String source, String target) {
        return Map.of("source", source, "target", target);
    }
}
