package com.example.promptstudio.api.v1.dto;

import java.time.Instant;
import java.util.List;

public record ProjectResponse(
        String id,
        String orgId,
        String name,
        String description,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
}
