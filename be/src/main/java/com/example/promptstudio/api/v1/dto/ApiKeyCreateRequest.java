package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ApiKeyCreateRequest(@NotBlank String orgId, @NotBlank String label, List<String> scopes) {
}
