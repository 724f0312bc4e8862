package com.example.promptstudio.api.v1.dto;

import java.time.Instant;

public record UserResponse(
        String id,
        String email,
        String name,
        String avatarUrl,
        Instant createdAt,
        Instant lastLoginAt
) {
}
