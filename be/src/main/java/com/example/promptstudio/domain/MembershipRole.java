package com.example.promptstudio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Role of a user inside an organization. */
public enum MembershipRole {
    OWNER,
    ADMIN,
    EDITOR,
    VIEWER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MembershipRole fromWireName(String value) {
        if (value != null) {
            for (MembershipRole candidate : values()) {
                if (candidate.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("Invalid role: " + value);
    }
}
