package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record PromptCreateRequest(@NotBlank String projectId, @NotBlank String name, String description) {
}
