package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.chat.ChatMessageEntry;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ChatMessagesUpdateRequest(@NotNull List<@Valid ChatMessageEntry> messages) {
}
