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

@Entity
@Table(name = "audit_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLog {

    @Id
    private String id;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    @Column(name = "actor_user_id", nullable = false)
    private String actorUserId;

    @Column(nullable = false, length = 128)
    private String action;

    @Column(name = "target_type", nullable = false, length = 64)
    private String targetType;

    @Column(name = "target_id", nullable = false)
    private String targetId;

    @Column(name = "metadata_json", nullable = false, columnDefinition = "CLOB")
    private String metadataJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public AuditLog(String id, String orgId, String actorUserId, String action, String targetType, String targetId,
                    String metadataJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orgId = Objects.requireNonNull(orgId, "orgId");
        this.actorUserId = Objects.requireNonNull(actorUserId, "actorUserId");
        this.action = Objects.requireNonNull(action, "action");
        this.targetType = Objects.requireNonNull(targetType, "targetType");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.metadataJson = Objects.requireNonNull(metadataJson, "metadataJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
