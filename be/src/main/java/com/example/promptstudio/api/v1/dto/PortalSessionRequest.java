package com.example.promptstudio.api.v1.dto;

public record PortalSessionRequest(String returnUrl) {
}
