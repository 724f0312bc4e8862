package com.example.promptstudio.service;

import java.util.Locale;

public enum ExportFormat {
    CSV,
    JSON;

    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value, e);
        }
    }
}
