package com.example.promptstudio.service;

/**
 * Partial-update rules shared by the update operations: a null field keeps the current value,
 * an empty string clears a nullable field.
 */
final class Updates {

    private Updates() {
    }

    static <T> T keep(T requested, T current) {
        return requested != null ? requested : current;
    }

    static String clearable(String requested, String current) {
        if (requested == null) {
            return current;
        }
        return requested.isBlank() ? null : requested;
    }
}
