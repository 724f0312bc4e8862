package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Map;

public record RunCreateRequest(
        @NotBlank String projectId,
        @NotBlank String promptId,
        @NotBlank String versionId,
        String experimentId,
        @NotBlank String model,
        Map<String, Object> input,
        Map<String, Object> output,
        @NotNull @PositiveOrZero Integer tokensIn,
        @NotNull @PositiveOrZero Integer tokensOut,
        @NotNull @DecimalMin("0") @Digits(integer = 4, fraction = 6) BigDecimal costUsd,
        @NotNull @PositiveOrZero Integer latencyMs,
        @NotNull Boolean success,
        Map<String, Object> flags
) {
}
