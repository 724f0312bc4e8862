package com.example.promptstudio.api.v1.dto;

/**
 * Model output for one experiment variant.
 */
public record VariantResult(String variant, String content, int tokens, long latencyMs, Object config) {
}
