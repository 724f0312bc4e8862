package com.example.promptstudio.api.v1.dto;

/**
 * {@code token} is only returned here; it cannot be retrieved later.
 */
public record ApiKeyCreatedResponse(ApiKeyResponse apiKey, String token) {
}
