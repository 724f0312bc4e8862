package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Variants are keyed by name; each value is free-form variant configuration.
 */
public record ExperimentCreateRequest(@NotBlank String promptId, @NotBlank String name, Map<String, Object> variants) {
}
