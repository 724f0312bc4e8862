package com.example.promptstudio.service;

import com.example.promptstudio.api.DomainRuleViolationException;
import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.PromptCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptResponse;
import com.example.promptstudio.api.v1.dto.PromptUpdateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionResponse;
import com.example.promptstudio.api.v1.dto.VersionComparisonResponse;
import com.example.promptstudio.domain.Prompt;
import com.example.promptstudio.domain.PromptVersion;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.repository.PromptRepository;
import com.example.promptstudio.repository.PromptVersionRepository;
import com.example.promptstudio.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Prompts and their immutable versions, including promotion of a version to current.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptService {

    private final PromptRepository prompts;
    private final PromptVersionRepository versions;
    private final ProjectRepository projects;
    private final UserRepository users;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public PromptResponse create(PromptCreateRequest request) {
        if (!projects.existsById(request.projectId())) {
            throw ResourceNotFoundException.of("Project", request.projectId());
        }
        Prompt prompt = new Prompt(idGenerator.newId("pmt"), request.projectId(), request.name(),
                Updates.clearable(request.description(), null), clock.instant());
        prompts.save(prompt);
        log.debug("Created prompt id={} projectId={}", prompt.getId(), prompt.getProjectId());
        return toResponse(prompt);
    }

    @Transactional(readOnly = true)
    public PromptResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<PromptResponse> findByProjectId(String projectId) {
        return prompts.findByProjectIdOrderByCreatedAt(projectId).stream()
                .map(PromptService::toResponse)
                .toList();
    }

    @Transactional
    public PromptResponse update(String id, PromptUpdateRequest request) {
        Prompt prompt = require(id);
        prompt.update(Updates.keep(request.name(), prompt.getName()),
                Updates.clearable(request.description(), prompt.getDescription()),
                clock.instant());
        prompts.save(prompt);
        return toResponse(prompt);
    }

    @Transactional
    public PromptVersionResponse createVersion(String promptId, PromptVersionCreateRequest request) {
        require(promptId);
        if (!users.existsById(request.createdBy())) {
            throw ResourceNotFoundException.of("User", request.createdBy());
        }
        PromptVersion version = new PromptVersion(idGenerator.newId("ver"), promptId, request.version(), request.content(),
                json.writeObject(request.variables()), json.writeObject(request.testInputs()),
                request.commitMessage(), request.createdBy(), clock.instant());
        versions.save(version);
        log.debug("Created version id={} promptId={} version={}", version.getId(), promptId, version.getVersion());
        return toResponse(version);
    }

    @Transactional(readOnly = true)
    public PromptVersionResponse findVersionById(String versionId) {
        return toResponse(requireVersion(versionId, "Version"));
    }

    /** Versions of the prompt, newest first. */
    @Transactional(readOnly = true)
    public List<PromptVersionResponse> findVersions(String promptId) {
        return versions.findByPromptIdOrderByCreatedAtDesc(promptId).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Makes the version the prompt's current one.
     *
     * @throws DomainRuleViolationException if the version belongs to another prompt
     */
    @Transactional
    public PromptResponse promoteVersion(String promptId, String versionId) {
        Prompt prompt = require(promptId);
        PromptVersion version = requireVersion(versionId, "Version");
        if (!version.getPromptId().equals(promptId)) {
            throw new DomainRuleViolationException("Version " + versionId + " does not belong to prompt " + promptId);
        }
        prompt.promote(versionId, clock.instant());
        prompts.save(prompt);
        log.info("Promoted version id={} on prompt id={}", versionId, promptId);
        return toResponse(prompt);
    }

    @Transactional(readOnly = true)
    public VersionComparisonResponse compareVersions(String versionId1, String versionId2) {
        PromptVersion first = requireVersion(versionId1, "Version 1");
        PromptVersion second = requireVersion(versionId2, "Version 2");
        if (!first.getPromptId().equals(second.getPromptId())) {
            throw new DomainRuleViolationException("Versions must belong to the same prompt");
        }
        return new VersionComparisonResponse(toResponse(first), toResponse(second));
    }

    Prompt require(String id) {
        return prompts.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Prompt", id));
    }

    private PromptVersion requireVersion(String id, String label) {
        return versions.findById(id).orElseThrow(() -> ResourceNotFoundException.of(label, id));
    }

    static PromptResponse toResponse(Prompt prompt) {
        return new PromptResponse(prompt.getId(), prompt.getProjectId(), prompt.getName(), prompt.getDescription(),
                prompt.getCurrentVersionId(), prompt.getCreatedAt(), prompt.getUpdatedAt());
    }

    PromptVersionResponse toResponse(PromptVersion version) {
        return new PromptVersionResponse(version.getId(), version.getPromptId(), version.getVersion(), version.getContent(),
                json.readObject(version.getVariablesJson()), json.readObject(version.getTestInputsJson()),
                version.getCommitMessage(), version.getCreatedBy(), version.getCreatedAt());
    }
}
