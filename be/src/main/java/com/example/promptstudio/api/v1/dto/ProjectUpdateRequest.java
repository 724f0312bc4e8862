package com.example.promptstudio.api.v1.dto;

import java.util.List;

/**
 * Null fields are left unchanged; an empty {@code description} clears it.
 */
public record ProjectUpdateRequest(String name, String description, List<String> tags) {
}
