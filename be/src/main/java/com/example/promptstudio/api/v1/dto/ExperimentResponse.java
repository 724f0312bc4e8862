package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.ExperimentStatus;

import java.time.Instant;
import java.util.Map;

public record ExperimentResponse(
        String id,
        String promptId,
        String name,
        ExperimentStatus status,
        Map<String, Object> variants,
        Instant createdAt
) {
}
