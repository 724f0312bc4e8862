package com.example.promptstudio.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * One message of a chat transcript. {@code role} is {@code user} or {@code assistant}.
 */
public record ChatMessageEntry(@NotBlank String role, @NotNull String content, Instant timestamp) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
}
