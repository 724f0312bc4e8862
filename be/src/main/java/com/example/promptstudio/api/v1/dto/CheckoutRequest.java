package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

public record CheckoutRequest(@NotBlank String orgId, @NotBlank String plan, String successUrl) {
}
