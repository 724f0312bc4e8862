package com.example.promptstudio.api.v1.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Aggregates over the filtered runs. {@code successRate} is a percentage with two decimals; {@code costByDay} is keyed by ISO date.
 */
public record RunAnalyticsResponse(
        long totalRuns,
        long totalTokens,
        BigDecimal totalCost,
        long avgLatency,
        double successRate,
        Map<String, Long> runsByModel,
        Map<String, BigDecimal> costByDay
) {
}
