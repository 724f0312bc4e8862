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
 * Chat session; the transcript is an ordered JSON array of {@code {role, content, timestamp}} messages.
 */
@Entity
@Table(name = "chat_session")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChatSession {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(length = 255)
    private String title;

    @Column(nullable = false, length = 128)
    private String model;

    @Column(name = "messages_json", nullable = false, columnDefinition = "CLOB")
    private String messagesJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ChatSession(String id, String projectId, String userId, String title, String model, String messagesJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.title = title;
        this.model = Objects.requireNonNull(model, "model");
        this.messagesJson = Objects.requireNonNull(messagesJson, "messagesJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    public void replaceMessages(String messagesJson, Instant at) {
        this.messagesJson = Objects.requireNonNull(messagesJson, "messagesJson");
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    public void switchModel(String model) {
        this.model = Objects.requireNonNull(model, "model");
    }
}
