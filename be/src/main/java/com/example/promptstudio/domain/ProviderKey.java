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
 * An organization's credential for an AI provider. Only the encrypted form is stored.
 */
@Entity
@Table(name = "provider_key")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProviderKey {

    @Id
    private String id;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AiProvider provider;

    @Column(nullable = false, length = 255)
    private String label;

    @Column(name = "encrypted_api_key", nullable = false, length = 2048)
    private String encryptedApiKey;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ProviderKey(String id, String orgId, AiProvider provider, String label, String encryptedApiKey, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orgId = Objects.requireNonNull(orgId, "orgId");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.label = Objects.requireNonNull(label, "label");
        this.encryptedApiKey = Objects.requireNonNull(encryptedApiKey, "encryptedApiKey");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
