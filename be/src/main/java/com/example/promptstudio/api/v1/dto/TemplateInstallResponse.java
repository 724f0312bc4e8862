package com.example.promptstudio.api.v1.dto;

public record TemplateInstallResponse(PromptResponse prompt, PromptVersionResponse version) {
}
