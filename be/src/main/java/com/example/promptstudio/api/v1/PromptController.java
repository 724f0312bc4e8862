package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.PromptCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptResponse;
import com.example.promptstudio.api.v1.dto.PromptUpdateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionResponse;
import com.example.promptstudio.api.v1.dto.VersionComparisonResponse;
import com.example.promptstudio.service.PromptService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Prompts and versions: {@code /api/v1/prompts}, {@code /{id}/versions}, {@code /{id}/versions/{versionId}/promote}
 * and {@code /versions/compare}.
 */
@RestController
@RequestMapping("/api/v1/prompts")
@RequiredArgsConstructor
@Slf4j
public class PromptController {

    private final PromptService service;

    @PostMapping
    public ResponseEntity<PromptResponse> create(@Valid @RequestBody PromptCreateRequest request) {
        log.info("Creating prompt name={} projectId={}", request.name(), request.projectId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping
    public ResponseEntity<List<PromptResponse>> listByProject(@RequestParam String projectId) {
        return ResponseEntity.ok(service.findByProjectId(projectId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PromptResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PromptResponse> update(@PathVariable String id, @Valid @RequestBody PromptUpdateRequest request) {
        return ResponseEntity.ok(service.update(id, request));
    }

    @PostMapping("/{id}/versions")
    public ResponseEntity<PromptVersionResponse> createVersion(@PathVariable String id,
                                                               @Valid @RequestBody PromptVersionCreateRequest request) {
        log.info("Creating version {} for prompt id={}", request.version(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createVersion(id, request));
    }

    @GetMapping("/{id}/versions")
    public ResponseEntity<List<PromptVersionResponse>> listVersions(@PathVariable String id) {
        return ResponseEntity.ok(service.findVersions(id));
    }

    @GetMapping("/versions/{versionId}")
    public ResponseEntity<PromptVersionResponse> getVersion(@PathVariable String versionId) {
        return ResponseEntity.ok(service.findVersionById(versionId));
    }

    @PostMapping("/{id}/versions/{versionId}/promote")
    public ResponseEntity<PromptResponse> promote(@PathVariable String id, @PathVariable String versionId) {
        log.info("Promoting version id={} on prompt id={}", versionId, id);
        return ResponseEntity.ok(service.promoteVersion(id, versionId));
    }

    @GetMapping("/versions/compare")
    public ResponseEntity<VersionComparisonResponse> compare(@RequestParam String versionId1, @RequestParam String versionId2) {
        return ResponseEntity.ok(service.compareVersions(versionId1, versionId2));
    }
}
