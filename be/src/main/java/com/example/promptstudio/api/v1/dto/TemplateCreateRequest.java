package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record TemplateCreateRequest(
        @NotBlank String orgId,
        @NotBlank String name,
        @NotBlank String category,
        @NotNull Map<String, Object> content
) {
}
