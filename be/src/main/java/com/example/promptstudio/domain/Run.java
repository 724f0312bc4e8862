package com.example.promptstudio.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One recorded model execution. Runs are append-only; usage and analytics are computed from them.
 */
@Entity
@Table(name = "prompt_run", indexes = {
        @Index(name = "idx_prompt_run_project_created", columnList = "project_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Run {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "prompt_id", nullable = false)
    private String promptId;

    @Column(name = "version_id", nullable = false)
    private String versionId;

    @Column(name = "experiment_id")
    private String experimentId;

    @Column(nullable = false, length = 128)
    private String model;

    @Column(name = "input_json", nullable = false, columnDefinition = "CLOB")
    private String inputJson;

    @Column(name = "output_json", nullable = false, columnDefinition = "CLOB")
    private String outputJson;

    @Column(name = "tokens_in", nullable = false)
    private int tokensIn;

    @Column(name = "tokens_out", nullable = false)
    private int tokensOut;

    @Column(name = "cost_usd", nullable = false, precision = 10, scale = 6)
    private BigDecimal costUsd;

    @Column(name = "latency_ms", nullable = false)
    private int latencyMs;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "flags_json", nullable = false, columnDefinition = "CLOB")
    private String flagsJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Run(String id, String projectId, String promptId, String versionId, String experimentId, String model,
               String inputJson, String outputJson, int tokensIn, int tokensOut, BigDecimal costUsd, int latencyMs,
               boolean success, String flagsJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.promptId = Objects.requireNonNull(promptId, "promptId");
        this.versionId = Objects.requireNonNull(versionId, "versionId");
        this.experimentId = experimentId;
        this.model = Objects.requireNonNull(model, "model");
        this.inputJson = Objects.requireNonNull(inputJson, "inputJson");
        this.outputJson = Objects.requireNonNull(outputJson, "outputJson");
        this.tokensIn = tokensIn;
        this.tokensOut = tokensOut;
        this.costUsd = Objects.requireNonNull(costUsd, "costUsd");
        this.latencyMs = latencyMs;
        this.success = success;
        this.flagsJson = Objects.requireNonNull(flagsJson, "flagsJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
