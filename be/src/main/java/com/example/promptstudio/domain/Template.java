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
 * Installable prompt template. Public templates have no organization.
 */
@Entity
@Table(name = "prompt_template")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Template {

    @Id
    private String id;

    @Column(name = "org_id")
    private String orgId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, length = 128)
    private String category;

    @Column(name = "content_json", nullable = false, columnDefinition = "CLOB")
    private String contentJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Template(String id, String orgId, String name, String category, String contentJson, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orgId = orgId;
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
        this.contentJson = Objects.requireNonNull(contentJson, "contentJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public void replaceContent(String category, String contentJson) {
        this.category = Objects.requireNonNull(category, "category");
        this.contentJson = Objects.requireNonNull(contentJson, "contentJson");
    }

    public boolean isPublic() {
        return orgId == null;
    }
}
