package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ProjectCreateRequest;
import com.example.promptstudio.api.v1.dto.ProjectResponse;
import com.example.promptstudio.api.v1.dto.ProjectUpdateRequest;
import com.example.promptstudio.domain.Project;
import com.example.promptstudio.domain.Prompt;
import com.example.promptstudio.repository.ChatSessionRepository;
import com.example.promptstudio.repository.ExperimentRepository;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.PipelineRepository;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.repository.PromptRepository;
import com.example.promptstudio.repository.PromptVersionRepository;
import com.example.promptstudio.repository.RunRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Projects of an organization. Deleting a project removes everything that belongs to it in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private final ProjectRepository projects;
    private final OrganizationRepository organizations;
    private final PromptRepository prompts;
    private final PromptVersionRepository versions;
    private final ExperimentRepository experiments;
    private final RunRepository runs;
    private final PipelineRepository pipelines;
    private final ChatSessionRepository chatSessions;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public ProjectResponse create(ProjectCreateRequest request) {
        if (!organizations.existsById(request.orgId())) {
            throw ResourceNotFoundException.of("Organization", request.orgId());
        }
        Project project = new Project(idGenerator.newId("prj"), request.orgId(), request.name(),
                Updates.clearable(request.description(), null), json.write(tags(request.tags())), clock.instant());
        projects.save(project);
        log.info("Created project id={} orgId={}", project.getId(), project.getOrgId());
        return toResponse(project);
    }

    @Transactional(readOnly = true)
    public ProjectResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<ProjectResponse> findByOrgId(String orgId) {
        return projects.findByOrgIdOrderByCreatedAt(orgId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public ProjectResponse update(String id, ProjectUpdateRequest request) {
        Project project = require(id);
        String tagsJson = request.tags() != null ? json.write(tags(request.tags())) : project.getTagsJson();
        project.update(Updates.keep(request.name(), project.getName()),
                Updates.clearable(request.description(), project.getDescription()),
                tagsJson,
                clock.instant());
        projects.save(project);
        return toResponse(project);
    }

    @Transactional
    public void delete(String id) {
        Project project = require(id);
        List<String> promptIds = prompts.findByProjectIdOrderByCreatedAt(id).stream().map(Prompt::getId).toList();
        runs.deleteByProjectId(id);
        if (!promptIds.isEmpty()) {
            experiments.deleteByPromptIdIn(promptIds);
            versions.deleteByPromptIdIn(promptIds);
            prompts.deleteAllById(promptIds);
        }
        pipelines.deleteByProjectId(id);
        chatSessions.deleteByProjectId(id);
        projects.delete(project);
        log.info("Deleted project id={} prompts={}", id, promptIds.size());
    }

    Project require(String id) {
        return projects.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Project", id));
    }

    private static List<String> tags(List<String> tags) {
        return tags != null ? tags : List.of();
    }

    private ProjectResponse toResponse(Project project) {
        return new ProjectResponse(project.getId(), project.getOrgId(), project.getName(), project.getDescription(),
                json.readStrings(project.getTagsJson()), project.getCreatedAt(), project.getUpdatedAt());
    }
}
