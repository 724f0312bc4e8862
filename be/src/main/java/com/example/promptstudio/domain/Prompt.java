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
 * A named prompt in a project. {@code currentVersionId} points at the promoted version, if any.
 */
@Entity
@Table(name = "prompt")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Prompt {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "current_version_id")
    private String currentVersionId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Prompt(String id, String projectId, String name, String description, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void update(String name, String description, Instant at) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    public void promote(String versionId, Instant at) {
        this.currentVersionId = Objects.requireNonNull(versionId, "versionId");
        this.updatedAt = Objects.requireNonNull(at, "at");
    }
}
