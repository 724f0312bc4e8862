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
 * Project inside an organization. Tags are kept as a JSON array in {@code tags_json}.
 */
@Entity
@Table(name = "project")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Project {

    @Id
    private String id;

    @Column(name = "org_id", nullable = false)
    private String orgId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "tags_json", nullable = false, columnDefinition = "CLOB")
    private String tagsJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Project(String id, String orgId, String name, String description, String tagsJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orgId = Objects.requireNonNull(orgId, "orgId");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.tagsJson = Objects.requireNonNull(tagsJson, "tagsJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void update(String name, String description, String tagsJson, Instant at) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.tagsJson = Objects.requireNonNull(tagsJson, "tagsJson");
        this.updatedAt = Objects.requireNonNull(at, "at");
    }
}
