package com.example.promptstudio.api.v1.dto;

import java.time.Instant;
import java.util.Map;

public record AuditLogResponse(
        String id,
        String orgId,
        String actorUserId,
        String action,
        String targetType,
        String targetId,
        Map<String, Object> metadata,
        Instant createdAt
) {
}
