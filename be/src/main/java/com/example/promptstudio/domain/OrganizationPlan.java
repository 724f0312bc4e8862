package com.example.promptstudio.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Subscription plan with the seat and metered-token limits it grants when assigned.
 */
public enum OrganizationPlan {

    FREE(1, 1_000),
    PRO(5, 10_000),
    ENTERPRISE(20, 100_000);

    private final int seats;
    private final long meteredQuota;

    OrganizationPlan(int seats, long meteredQuota) {
        this.seats = seats;
        this.meteredQuota = meteredQuota;
    }

    public int seats() {
        return seats;
    }

    public long meteredQuota() {
        return meteredQuota;
    }

    public boolean isPaid() {
        return this != FREE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a known plan
     */
    @JsonCreator
    public static OrganizationPlan fromWireName(String value) {
        if (value != null) {
            for (OrganizationPlan plan : values()) {
                if (plan.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return plan;
                }
            }
        }
        throw new IllegalArgumentException("Invalid plan: " + value);
    }
}
