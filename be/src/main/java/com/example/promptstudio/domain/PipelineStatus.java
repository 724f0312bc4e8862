package com.example.promptstudio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Publication state of a pipeline; only published pipelines are callable by slug. */
public enum PipelineStatus {
    DRAFT,
    PUBLISHED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PipelineStatus fromWireName(String value) {
        if (value != null) {
            for (PipelineStatus candidate : values()) {
                if (candidate.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid pipeline status: " + value);
    }
}
