package com.example.promptstudio.validation;

import java.util.List;

/**
 * Outcome of validating a pipeline graph. {@code valid} is true iff {@code errors} is empty.
 */
public record GraphValidationResult(boolean valid, List<String> errors) {

    public GraphValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static GraphValidationResult of(List<String> errors) {
        return new GraphValidationResult(errors.isEmpty(), errors);
    }
}
