package com.example.promptstudio.api.v1.dto;

import java.util.Map;

public record ComparisonRequest(Map<String, Object> input) {
}
