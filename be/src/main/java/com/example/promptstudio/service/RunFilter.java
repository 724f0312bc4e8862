package com.example.promptstudio.service;

import java.time.Instant;
import java.util.Objects;

/**
 * Selection of an organization's runs for analytics and export. All fields but {@code orgId} are optional;
 * the date range is inclusive.
 */
public record RunFilter(String orgId, String projectId, Instant startDate, Instant endDate, String model) {

    public RunFilter {
        Objects.requireNonNull(orgId, "orgId");
    }
}
