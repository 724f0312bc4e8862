package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record AuditLogCreateRequest(
        @NotBlank String orgId,
        @NotBlank String actorUserId,
        @NotBlank String action,
        @NotBlank String targetType,
        @NotBlank String targetId,
        Map<String, Object> metadata
) {
}
