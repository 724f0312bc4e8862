package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record ChatSessionCreateRequest(
        @NotBlank String projectId,
        @NotBlank String userId,
        String title,
        @NotBlank String model
) {
}
