package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.PromptVersionResponse;
import com.example.promptstudio.api.v1.dto.TemplateCreateRequest;
import com.example.promptstudio.api.v1.dto.TemplateInstallResponse;
import com.example.promptstudio.api.v1.dto.TemplateResponse;
import com.example.promptstudio.domain.Prompt;
import com.example.promptstudio.domain.PromptVersion;
import com.example.promptstudio.domain.Template;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.repository.PromptRepository;
import com.example.promptstudio.repository.PromptVersionRepository;
import com.example.promptstudio.repository.TemplateRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prompt templates: public ones (no organization) and organization-owned ones, and installing a template
 * into a project as a prompt with a first version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateService {

    static final String INSTALLED_VERSION = "1.0.0";
    static final String SYSTEM_USER = "system";

    private final TemplateRepository templates;
    private final OrganizationRepository organizations;
    private final ProjectRepository projects;
    private final PromptRepository prompts;
    private final PromptVersionRepository versions;
    private final PromptService promptService;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TemplateResponse> findPublic() {
        return templates.findByOrgIdIsNullOrderByName().stream()
                .map(this::toResponse)
                .toList();
    }

    /** Public templates of the category, plus the organization's own when {@code orgId} is given. */
    @Transactional(readOnly = true)
    public List<TemplateResponse> findByCategory(String category, String orgId) {
        return templates.findVisibleByCategory(category, orgId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public TemplateResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<TemplateResponse> findByOrgId(String orgId) {
        return templates.findByOrgIdOrderByName(orgId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public TemplateResponse createOrganizationTemplate(TemplateCreateRequest request) {
        if (!organizations.existsById(request.orgId())) {
            throw ResourceNotFoundException.of("Organization", request.orgId());
        }
        Template template = new Template(idGenerator.newId("tpl"), request.orgId(), request.name(), request.category(),
                json.writeObject(request.content()), clock.instant());
        templates.save(template);
        log.info("Created template id={} orgId={} category={}", template.getId(), template.getOrgId(), template.getCategory());
        return toResponse(template);
    }

    /**
     * Creates or refreshes a public template by name. Used to seed the catalogue at startup.
     */
    @Transactional
    public TemplateResponse upsertPublicTemplate(String name, String category, Map<String, Object> content) {
        Optional<Template> existing = templates.findFirstByOrgIdIsNullAndName(name);
        Template template;
        if (existing.isPresent()) {
            template = existing.get();
            template.replaceContent(category, json.writeObject(content));
        } else {
            template = new Template(idGenerator.newId("tpl"), null, name, category, json.writeObject(content), clock.instant());
        }
        templates.save(template);
        return toResponse(template);
    }

    /**
     * Installs the template into the project: a prompt built from the template content and version
     * {@code 1.0.0} promoted to current, all or nothing.
     */
    @Transactional
    public TemplateInstallResponse install(String templateId, String projectId, String createdBy) {
        Template template = require(templateId);
        if (!projects.existsById(projectId)) {
            throw ResourceNotFoundException.of("Project", projectId);
        }
        Map<String, Object> content = json.readObject(template.getContentJson());
        Instant now = clock.instant();

        Prompt prompt = new Prompt(idGenerator.newId("pmt"), projectId,
                text(content, "name", template.getName()),
                text(content, "description", "Installed from " + template.getName() + " template"),
                now);
        prompts.save(prompt);

        PromptVersion version = new PromptVersion(idGenerator.newId("ver"), prompt.getId(), INSTALLED_VERSION,
                text(content, "content", ""),
                json.writeObject(object(content, "variables")),
                json.writeObject(object(content, "test_inputs")),
                "Installed from template: " + template.getName(),
                createdBy != null && !createdBy.isBlank() ? createdBy : SYSTEM_USER,
                now);
        versions.save(version);

        prompt.promote(version.getId(), now);
        prompts.save(prompt);
        log.info("Installed template id={} into project id={} as prompt id={}", templateId, projectId, prompt.getId());
        PromptVersionResponse versionResponse = promptService.toResponse(version);
        return new TemplateInstallResponse(PromptService.toResponse(prompt), versionResponse);
    }

    private Template require(String id) {
        return templates.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Template", id));
    }

    private static String text(Map<String, Object> content, String key, String fallback) {
        return content.get(key) instanceof String value && !value.isBlank() ? value : fallback;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> content, String key) {
        return content.get(key) instanceof Map<?, ?> value ? (Map<String, Object>) value : Map.of();
    }

    private TemplateResponse toResponse(Template template) {
        return new TemplateResponse(template.getId(), template.getOrgId(), template.getName(), template.getCategory(),
                json.readObject(template.getContentJson()), template.getCreatedAt());
    }
}
