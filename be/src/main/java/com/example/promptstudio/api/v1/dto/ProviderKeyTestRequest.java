package com.example.promptstudio.api.v1.dto;

public record ProviderKeyTestRequest(String provider, String apiKey) {
}
