package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.OrganizationPlan;

public record OrganizationUpdateRequest(String name, String slug, OrganizationPlan plan) {
}
