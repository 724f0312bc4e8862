package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.PipelineCreateRequest;
import com.example.promptstudio.api.v1.dto.PipelineResponse;
import com.example.promptstudio.api.v1.dto.PipelineUpdateRequest;
import com.example.promptstudio.interpreter.PipelineExecutionResult;
import com.example.promptstudio.service.PipelineExecutionService;
import com.example.promptstudio.service.PipelineService;
import com.example.promptstudio.validation.GraphValidationResult;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Pipelines: CRUD, {@code /validate}, {@code /{id}/publish} and {@code /execute/{slug}}.
 * <p>
 * Execution takes the API key from the {@code X-Api-Key} header and always answers 200; failures are
 * reported in the body with {@code success=false}.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/pipelines")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    static final String API_KEY_HEADER = "X-Api-Key";

    private final PipelineService service;
    private final PipelineExecutionService executionService;

    @PostMapping
    public ResponseEntity<PipelineResponse> create(@Valid @RequestBody PipelineCreateRequest request) {
        log.info("Creating pipeline name={} projectId={}", request.name(), request.projectId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping
    public ResponseEntity<List<PipelineResponse>> listByProject(@RequestParam String projectId) {
        return ResponseEntity.ok(service.findByProjectId(projectId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PipelineResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PipelineResponse> update(@PathVariable String id, @Valid @RequestBody PipelineUpdateRequest request) {
        log.info("Updating pipeline id={}", id);
        return ResponseEntity.ok(service.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        service.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/publish")
    public ResponseEntity<PipelineResponse> publish(@PathVariable String id) {
        log.info("Publishing pipeline id={}", id);
        return ResponseEntity.ok(service.publish(id));
    }

    @PostMapping("/{id}/unpublish")
    public ResponseEntity<PipelineResponse> unpublish(@PathVariable String id) {
        return ResponseEntity.ok(service.unpublish(id));
    }

    /** Accepts any JSON value; a non-object body is reported as an invalid graph. */
    @PostMapping("/validate")
    public ResponseEntity<GraphValidationResult> validate(@RequestBody(required = false) Object graph) {
        return ResponseEntity.ok(service.validate(graph));
    }

    @PostMapping("/execute/{slug}")
    public ResponseEntity<PipelineExecutionResult> execute(@PathVariable String slug,
                                                           @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
                                                           @RequestBody(required = false) Map<String, Object> input) {
        log.info("Executing pipeline slug={}", slug);
        return ResponseEntity.ok(executionService.execute(slug, input != null ? input : Map.of(), apiKey));
    }
}
