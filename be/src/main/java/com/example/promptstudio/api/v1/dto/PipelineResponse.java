package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.PipelineStatus;

import java.time.Instant;
import java.util.Map;

public record PipelineResponse(
        String id,
        String projectId,
        String name,
        Map<String, Object> graph,
        PipelineStatus status,
        String endpointSlug,
        Instant createdAt,
        Instant updatedAt
) {
}
