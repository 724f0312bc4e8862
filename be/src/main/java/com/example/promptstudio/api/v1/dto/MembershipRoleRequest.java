package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.MembershipRole;

import jakarta.validation.constraints.NotNull;

public record MembershipRoleRequest(@NotNull MembershipRole role) {
}
