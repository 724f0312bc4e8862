package com.example.promptstudio.interpreter;

import java.util.List;
import java.util.Map;

/**
 * Response of a pipeline execution. Failures are reported in-band with {@code success=false},
 * {@code output.error}, zero execution time and no node results.
 */
public record PipelineExecutionResult(boolean success, Map<String, Object> output, long executionTime, List<NodeResult> nodeResults) {

    public PipelineExecutionResult {
        nodeResults = nodeResults != null ? List.copyOf(nodeResults) : List.of();
    }

    public static PipelineExecutionResult failure(String error) {
        return new PipelineExecutionResult(false, Map.of("error", error), 0, List.of());
    }
}
