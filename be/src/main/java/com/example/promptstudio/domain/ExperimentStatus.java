package com.example.promptstudio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Lifecycle of an A/B experiment: draft, then running, then completed (or cancelled). */
public enum ExperimentStatus {
    DRAFT,
    RUNNING,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExperimentStatus fromWireName(String value) {
        if (value != null) {
            for (ExperimentStatus candidate : values()) {
                if (candidate.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid experiment status: " + value);
    }
}
