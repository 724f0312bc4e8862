package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record PlanChangeRequest(@NotBlank String plan, String customerId) {
}
