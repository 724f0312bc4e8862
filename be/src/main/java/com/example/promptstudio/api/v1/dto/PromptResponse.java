package com.example.promptstudio.api.v1.dto;

import java.time.Instant;

public record PromptResponse(
        String id,
        String projectId,
        String name,
        String description,
        String currentVersionId,
        Instant createdAt,
        Instant updatedAt
) {
}
