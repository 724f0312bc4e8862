package com.example.promptstudio.api.v1.dto;

import java.util.Map;

/**
 * Null fields are left unchanged; an empty {@code endpointSlug} clears it.
 */
public record PipelineUpdateRequest(String name, Map<String, Object> graph, String endpointSlug) {
}
