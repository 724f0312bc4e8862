package com.example.promptstudio.api.v1.dto;

import java.time.Instant;
import java.util.Map;

public record TemplateResponse(
        String id,
        String orgId,
        String name,
        String category,
        Map<String, Object> content,
        Instant createdAt
) {
}
