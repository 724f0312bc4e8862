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
 * Tenant. Everything except users hangs off an organization, directly or through a project.
 */
@Entity
@Table(name = "organization")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Organization {

    @Id
    private String id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, unique = true, length = 255)
    private String slug;

    @Column(name = "owner_user_id", nullable = false)
    private String ownerUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OrganizationPlan plan;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Organization(String id, String name, String slug, String ownerUserId, OrganizationPlan plan, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.slug = Objects.requireNonNull(slug, "slug");
        this.ownerUserId = Objects.requireNonNull(ownerUserId, "ownerUserId");
        this.plan = plan != null ? plan : OrganizationPlan.FREE;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public void rename(String name, String slug) {
        this.name = Objects.requireNonNull(name, "name");
        this.slug = Objects.requireNonNull(slug, "slug");
    }

    public void changePlan(OrganizationPlan plan) {
        this.plan = Objects.requireNonNull(plan, "plan");
    }
}
