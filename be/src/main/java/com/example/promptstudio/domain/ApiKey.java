package com.example.promptstudio.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Organization API key used to call published pipelines. Only the SHA-256 hash of the token is kept.
 */
@Entity
@Table(name = "api_key")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApiKey {

    @Id
    private String id;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    @Column(nullable = false, length = 255)
    private String label;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "scopes_json", nullable = false, columnDefinition = "CLOB")
    private String scopesJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    public ApiKey(String id, String orgId, String label, String tokenHash, String scopesJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orgId = Objects.requireNonNull(orgId, "orgId");
        this.label = Objects.requireNonNull(label, "label");
        this.tokenHash = Objects.requireNonNull(tokenHash, "tokenHash");
        this.scopesJson = Objects.requireNonNull(scopesJson, "scopesJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public void markUsed(Instant at) {
        this.lastUsedAt = Objects.requireNonNull(at, "at");
    }
}
