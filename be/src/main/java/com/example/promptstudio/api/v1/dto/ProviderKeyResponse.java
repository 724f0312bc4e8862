package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.AiProvider;

import java.time.Instant;

/**
 * Never carries the key itself, in clear or encrypted.
 */
public record ProviderKeyResponse(String id, String orgId, AiProvider provider, String label, Instant createdAt) {
}
