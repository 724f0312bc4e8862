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
 * Immutable snapshot of a prompt's text with its variables and test inputs (JSON objects).
 */
@Entity
@Table(name = "prompt_version")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PromptVersion {

    @Id
    private String id;

    @Column(name = "prompt_id", nullable = false)
    private String promptId;

    @Column(name = "version_label", nullable = false, length = 64)
    private String version;

    @Column(nullable = false, columnDefinition = "CLOB")
    private String content;

    @Column(name = "variables_json", nullable = false, columnDefinition = "CLOB")
    private String variablesJson;

    @Column(name = "test_inputs_json", nullable = false, columnDefinition = "CLOB")
    private String testInputsJson;

    @Column(name = "commit_message", length = 1000)
    private String commitMessage;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public PromptVersion(String id, String promptId, String version, String content, String variablesJson,
                         String testInputsJson, String commitMessage, String createdBy, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.promptId = Objects.requireNonNull(promptId, "promptId");
        this.version = Objects.requireNonNull(version, "version");
        this.content = Objects.requireNonNull(content, "content");
        this.variablesJson = Objects.requireNonNull(variablesJson, "variablesJson");
        this.testInputsJson = Objects.requireNonNull(testInputsJson, "testInputsJson");
        this.commitMessage = commitMessage;
        this.createdBy = Objects.requireNonNull(createdBy, "createdBy");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
