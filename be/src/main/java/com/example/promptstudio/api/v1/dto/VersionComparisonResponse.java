package com.example.promptstudio.api.v1.dto;

public record VersionComparisonResponse(PromptVersionResponse version1, PromptVersionResponse version2) {
}
