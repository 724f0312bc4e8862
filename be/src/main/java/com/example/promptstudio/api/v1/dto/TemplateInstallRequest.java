package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record TemplateInstallRequest(@NotBlank String projectId, String createdBy) {
}
