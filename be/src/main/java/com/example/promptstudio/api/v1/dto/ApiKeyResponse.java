package com.example.promptstudio.api.v1.dto;

import java.time.Instant;
import java.util.List;

public record ApiKeyResponse(
        String id,
        String orgId,
        String label,
        List<String> scopes,
        Instant createdAt,
        Instant lastUsedAt
) {
}
