package com.example.promptstudio.api.v1.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record RunResponse(
        String id,
        String projectId,
        String promptId,
        String versionId,
        String experimentId,
        String model,
        Map<String, Object> input,
        Map<String, Object> output,
        int tokensIn,
        int tokensOut,
        BigDecimal costUsd,
        int latencyMs,
        boolean success,
        Map<String, Object> flags,
        Instant createdAt
) {
}
