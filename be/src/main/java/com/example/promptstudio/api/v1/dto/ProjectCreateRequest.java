package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ProjectCreateRequest(
        @NotBlank String orgId,
        @NotBlank String name,
        String description,
        List<String> tags
) {
}
