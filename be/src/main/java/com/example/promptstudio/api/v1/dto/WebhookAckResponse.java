package com.example.promptstudio.api.v1.dto;

public record WebhookAckResponse(boolean received, String type) {
}
