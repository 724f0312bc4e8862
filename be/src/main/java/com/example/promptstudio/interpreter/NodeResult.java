package com.example.promptstudio.interpreter;

import java.util.Map;

/**
 * Output of one processed node and how long it took, in milliseconds.
 */
public record NodeResult(String nodeId, Map<String, Object> output, long duration) {
}
