package com.example.promptstudio.api.v1.dto;

/**
 * Null fields are left unchanged; an empty {@code description} clears it.
 */
public record PromptUpdateRequest(String name, String description) {
}
