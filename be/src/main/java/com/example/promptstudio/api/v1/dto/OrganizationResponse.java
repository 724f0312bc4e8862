package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.OrganizationPlan;

import java.time.Instant;

public record OrganizationResponse(
        String id,
        String name,
        String slug,
        String ownerUserId,
        OrganizationPlan plan,
        Instant createdAt
) {
}
