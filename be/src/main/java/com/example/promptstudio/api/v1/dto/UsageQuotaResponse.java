package com.example.promptstudio.api.v1.dto;

/**
 * Token usage of the current calendar month against the metered quota.
 */
public record UsageQuotaResponse(long used, long quota, long percentage, boolean exceeded) {
}
