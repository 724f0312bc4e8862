package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.PipelineCreateRequest;
import com.example.promptstudio.api.v1.dto.PipelineResponse;
import com.example.promptstudio.api.v1.dto.PipelineUpdateRequest;
import com.example.promptstudio.domain.Pipeline;
import com.example.promptstudio.repository.PipelineRepository;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.validation.GraphValidationResult;
import com.example.promptstudio.validation.PipelineGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Pipeline CRUD, graph validation and publishing.
 * <p>
 * Pipelines start as drafts. Publishing generates an endpoint slug from the name the first time
 * ({@code lower-cased name with non-alphanumerics replaced by '-'} plus {@code '-' + epoch millis})
 * and keeps any existing slug.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineService {

    private final PipelineRepository pipelines;
    private final ProjectRepository projects;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public PipelineResponse create(PipelineCreateRequest request) {
        if (!projects.existsById(request.projectId())) {
            throw ResourceNotFoundException.of("Project", request.projectId());
        }
        Pipeline pipeline = new Pipeline(idGenerator.newId("pipe"), request.projectId(), request.name(),
                json.writeObject(request.graph()), clock.instant());
        pipelines.save(pipeline);
        log.info("Created pipeline id={} projectId={}", pipeline.getId(), pipeline.getProjectId());
        return toResponse(pipeline);
    }

    @Transactional(readOnly = true)
    public PipelineResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<PipelineResponse> findByProjectId(String projectId) {
        return pipelines.findByProjectIdOrderByCreatedAt(projectId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public PipelineResponse update(String id, PipelineUpdateRequest request) {
        Pipeline pipeline = require(id);
        String graphJson = request.graph() != null ? json.writeObject(request.graph()) : pipeline.getGraphJson();
        pipeline.update(Updates.keep(request.name(), pipeline.getName()), graphJson,
                Updates.clearable(request.endpointSlug(), pipeline.getEndpointSlug()), clock.instant());
        pipelines.saveAndFlush(pipeline);
        return toResponse(pipeline);
    }

    @Transactional
    public void delete(String id) {
        pipelines.delete(require(id));
        log.info("Deleted pipeline id={}", id);
    }

    @Transactional
    public PipelineResponse publish(String id) {
        Pipeline pipeline = require(id);
        pipeline.publish(slugFor(pipeline.getName()), clock.instant());
        pipelines.saveAndFlush(pipeline);
        log.info("Published pipeline id={} slug={}", id, pipeline.getEndpointSlug());
        return toResponse(pipeline);
    }

    @Transactional
    public PipelineResponse unpublish(String id) {
        Pipeline pipeline = require(id);
        pipeline.unpublish(clock.instant());
        pipelines.save(pipeline);
        log.info("Unpublished pipeline id={}", id);
        return toResponse(pipeline);
    }

    public GraphValidationResult validate(Object graph) {
        GraphValidationResult result = PipelineGraphValidator.validate(graph);
        log.debug("Validated graph valid={} errors={}", result.valid(), result.errors().size());
        return result;
    }

    String slugFor(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-") + "-" + clock.millis();
    }

    private Pipeline require(String id) {
        return pipelines.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Pipeline", id));
    }

    private PipelineResponse toResponse(Pipeline pipeline) {
        return new PipelineResponse(pipeline.getId(), pipeline.getProjectId(), pipeline.getName(),
                json.readObject(pipeline.getGraphJson()), pipeline.getStatus(), pipeline.getEndpointSlug(),
                pipeline.getCreatedAt(), pipeline.getUpdatedAt());
    }
}
