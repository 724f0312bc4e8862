package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record PipelineCreateRequest(
        @NotBlank String projectId,
        @NotBlank String name,
        @NotNull Map<String, Object> graph
) {
}
