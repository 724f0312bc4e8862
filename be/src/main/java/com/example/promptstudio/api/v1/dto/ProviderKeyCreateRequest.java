package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.AiProvider;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ProviderKeyCreateRequest(
        @NotBlank String orgId,
        @NotNull AiProvider provider,
        @NotBlank String label,
        @NotBlank String apiKey
) {
}
