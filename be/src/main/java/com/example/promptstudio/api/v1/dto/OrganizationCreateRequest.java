package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.OrganizationPlan;

import jakarta.validation.constraints.NotBlank;

public record OrganizationCreateRequest(
        @NotBlank String name,
        @NotBlank String slug,
        @NotBlank String ownerUserId,
        OrganizationPlan plan
) {
}
