package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.OrganizationPlan;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionVerificationResponse(boolean success, String orgId, OrganizationPlan plan) {
}
