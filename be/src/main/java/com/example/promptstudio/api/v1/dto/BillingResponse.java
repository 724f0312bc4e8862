package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.OrganizationPlan;

import java.time.Instant;

public record BillingResponse(
        String orgId,
        String stripeCustomerId,
        OrganizationPlan plan,
        int seats,
        long meteredQuota,
        Instant renewsAt
) {
}
