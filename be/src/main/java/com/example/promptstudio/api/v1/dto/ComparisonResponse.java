package com.example.promptstudio.api.v1.dto;

public record ComparisonResponse(VariantResult variantA, VariantResult variantB) {
}
