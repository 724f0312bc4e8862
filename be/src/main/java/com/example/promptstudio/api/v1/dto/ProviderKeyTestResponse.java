package com.example.promptstudio.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderKeyTestResponse(boolean valid, String error) {
}
