package com.example.promptstudio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** AI provider a stored key belongs to. */
public enum AiProvider {
    OPENAI,
    ANTHROPIC,
    GEMINI,
    LOCAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AiProvider fromWireName(String value) {
        if (value != null) {
            for (AiProvider candidate : values()) {
                if (candidate.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid provider: " + value);
    }
}
