package com.example.promptstudio.validation;

import java.util.Objects;

/**
 * A single request validation error (field and message).
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
