package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.chat.ChatMessageEntry;

import java.time.Instant;
import java.util.List;

public record ChatSessionResponse(
        String id,
        String projectId,
        String userId,
        String title,
        String model,
        List<ChatMessageEntry> messages,
        Instant createdAt,
        Instant updatedAt
) {
}
