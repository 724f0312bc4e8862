package com.example.promptstudio.api.v1.dto;

/**
 * Profile changes. Null fields are left unchanged; an empty {@code avatarUrl} clears it.
 */
public record UserUpdateRequest(String name, String avatarUrl) {
}
