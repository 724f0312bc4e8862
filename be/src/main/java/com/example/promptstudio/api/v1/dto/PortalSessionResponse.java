package com.example.promptstudio.api.v1.dto;

public record PortalSessionResponse(String url) {
}
