package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record PromptVersionCreateRequest(
        @NotBlank String version,
        @NotNull String content,
        Map<String, Object> variables,
        Map<String, Object> testInputs,
        String commitMessage,
        @NotBlank String createdBy
) {
}
