package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.MembershipRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record MembershipCreateRequest(@NotBlank String userId, @NotNull MembershipRole role) {
}
