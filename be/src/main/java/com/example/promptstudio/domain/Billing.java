package com.example.promptstudio.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Billing state of an organization, keyed by org id. Seats and quota are a snapshot of the plan
 * limits taken when the plan last changed.
 */
@Entity
@Table(name = "billing")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Billing {

    @Id
    @Column(name = "org_id")
    private String orgId;

    @Column(name = "stripe_customer_id", length = 255)
    private String stripeCustomerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OrganizationPlan plan;

    @Column(nullable = false)
    private int seats;

    @Column(name = "metered_quota", nullable = false)
    private long meteredQuota;

    @Column(name = "renews_at")
    private Instant renewsAt;

    public Billing(String orgId) {
        this.orgId = Objects.requireNonNull(orgId, "orgId");
        this.plan = OrganizationPlan.FREE;
        this.seats = OrganizationPlan.FREE.seats();
        this.meteredQuota = OrganizationPlan.FREE.meteredQuota();
    }

    /**
     * Applies the plan's limits. A null {@code customerId} keeps the current customer.
     */
    public void applyPlan(OrganizationPlan plan, String customerId, Instant renewsAt) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.seats = plan.seats();
        this.meteredQuota = plan.meteredQuota();
        this.renewsAt = renewsAt;
        if (customerId != null) {
            this.stripeCustomerId = customerId;
        }
    }
}
