package com.example.promptstudio.api.v1.dto;

import java.time.Instant;
import java.util.Map;

public record PromptVersionResponse(
        String id,
        String promptId,
        String version,
        String content,
        Map<String, Object> variables,
        Map<String, Object> testInputs,
        String commitMessage,
        String createdBy,
        Instant createdAt
) {
}
