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
 * Visual pipeline: a graph document ({@code nodes}/{@code edges}) stored as JSON.
 * <p>
 * Created in {@link PipelineStatus#DRAFT}. Publishing assigns an endpoint slug once and keeps it;
 * the pipeline is callable by slug only while published.
 * </p>
 */
@Entity
@Table(name = "pipeline")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Pipeline {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "graph_json", nullable = false, columnDefinition = "CLOB")
    private String graphJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PipelineStatus status;

    @Column(name = "endpoint_slug", unique = true, length = 320)
    private String endpointSlug;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Pipeline(String id, String projectId, String name, String graphJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.name = Objects.requireNonNull(name, "name");
        this.graphJson = Objects.requireNonNull(graphJson, "graphJson");
        this.status = PipelineStatus.DRAFT;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void update(String name, String graphJson, String endpointSlug, Instant at) {
        this.name = Objects.requireNonNull(name, "name");
        this.graphJson = Objects.requireNonNull(graphJson, "graphJson");
        this.endpointSlug = endpointSlug;
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    /**
     * Marks the pipeline published. {@code generatedSlug} is only used when no slug is set yet.
     */
    public void publish(String generatedSlug, Instant at) {
        if (this.endpointSlug == null) {
            this.endpointSlug = Objects.requireNonNull(generatedSlug, "generatedSlug");
        }
        this.status = PipelineStatus.PUBLISHED;
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    public void unpublish(Instant at) {
        this.status = PipelineStatus.DRAFT;
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    public boolean isCallable() {
        return status == PipelineStatus.PUBLISHED && endpointSlug != null;
    }
}
