package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.TemplateCreateRequest;
import com.example.promptstudio.api.v1.dto.TemplateInstallRequest;
import com.example.promptstudio.api.v1.dto.TemplateInstallResponse;
import com.example.promptstudio.api.v1.dto.TemplateResponse;
import com.example.promptstudio.service.TemplateService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Templates. Without query parameters {@code GET} lists public templates; {@code ?category=} lists a category
 * (public plus the organization's own when {@code orgId} is given); {@code ?orgId=} alone lists the organization's.
 */
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
@Slf4j
public class TemplateController {

    private final TemplateService service;

    @GetMapping
    public ResponseEntity<List<TemplateResponse>> list(@RequestParam(required = false) String category,
                                                       @RequestParam(required = false) String orgId) {
        if (category != null) {
            return ResponseEntity.ok(service.findByCategory(category, orgId));
        }
        if (orgId != null) {
            return ResponseEntity.ok(service.findByOrgId(orgId));
        }
        return ResponseEntity.ok(service.findPublic());
    }

    @GetMapping("/{id}")
    public ResponseEntity<TemplateResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @PostMapping
    public ResponseEntity<TemplateResponse> create(@Valid @RequestBody TemplateCreateRequest request) {
        log.info("Creating template name={} orgId={}", request.name(), request.orgId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.createOrganizationTemplate(request));
    }

    @PostMapping("/{id}/install")
    public ResponseEntity<TemplateInstallResponse> install(@PathVariable String id, @Valid @RequestBody TemplateInstallRequest request) {
        log.info("Installing template id={} into project id={}", id, request.projectId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.install(id, request.projectId(), request.createdBy()));
    }
}
