package com.example.promptstudio.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code model} switches the session model when present.
 */
public record ChatSendRequest(@NotBlank String content, String model) {
}
