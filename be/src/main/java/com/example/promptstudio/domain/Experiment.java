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
 * A/B experiment over a prompt. Variants are a JSON object keyed by variant name.
 */
@Entity
@Table(name = "experiment")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Experiment {

    @Id
    private String id;

    @Column(name = "prompt_id", nullable = false)
    private String promptId;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ExperimentStatus status;

    @Column(name = "variants_json", nullable = false, columnDefinition = "CLOB")
    private String variantsJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Experiment(String id, String promptId, String name, String variantsJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.promptId = Objects.requireNonNull(promptId, "promptId");
        this.name = Objects.requireNonNull(name, "name");
        this.status = ExperimentStatus.DRAFT;
        this.variantsJson = Objects.requireNonNull(variantsJson, "variantsJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public void moveTo(ExperimentStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }
}
