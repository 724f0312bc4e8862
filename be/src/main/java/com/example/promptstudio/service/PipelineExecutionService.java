package com.example.promptstudio.service;

import com.example.promptstudio.domain.ApiKey;
import com.example.promptstudio.domain.Pipeline;
import com.example.promptstudio.interpreter.PipelineExecutionResult;
import com.example.promptstudio.interpreter.PipelineGraphInterpreter;
import com.example.promptstudio.repository.PipelineRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Executes published pipelines by endpoint slug on behalf of an API key.
 * <p>
 * Every outcome is reported in-band: an unknown key yields {@code "invalid API key"}, and a pipeline that is
 * missing, unpublished or owned by another organization yields {@code "pipeline not found"}.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineExecutionService {

    static final String INVALID_API_KEY = "invalid API key";
    static final String PIPELINE_NOT_FOUND = "pipeline not found";

    private final ApiKeyService apiKeyService;
    private final PipelineRepository pipelines;
    private final PipelineGraphInterpreter interpreter;
    private final JsonDocuments json;
    private final Clock clock;

    @Transactional
    public PipelineExecutionResult execute(String slug, Map<String, Object> input, String apiKeyToken) {
        long start = clock.millis();
        Optional<ApiKey> apiKey = apiKeyService.resolve(apiKeyToken);
        if (apiKey.isEmpty()) {
            log.warn("Pipeline execution rejected slug={}: {}", slug, INVALID_API_KEY);
            return PipelineExecutionResult.failure(INVALID_API_KEY);
        }
        String orgId = apiKey.get().getOrgId();
        Optional<Pipeline> pipeline = pipelines.findBySlugForOrganization(slug, orgId);
        if (pipeline.isEmpty()) {
            log.warn("Pipeline execution rejected slug={} orgId={}: no such slug in organization", slug, orgId);
            return PipelineExecutionResult.failure(PIPELINE_NOT_FOUND);
        }
        if (!pipeline.get().isCallable()) {
            log.warn("Pipeline execution rejected slug={} orgId={} id={}: pipeline is {}",
                    slug, orgId, pipeline.get().getId(), pipeline.get().getStatus());
            return PipelineExecutionResult.failure(PIPELINE_NOT_FOUND);
        }
        try {
            Map<String, Object> graph = json.readObject(pipeline.get().getGraphJson());
            PipelineGraphInterpreter.Interpretation interpretation = interpreter.interpret(pipeline.get().getId(), graph, input);
            long executionTime = clock.millis() - start;
            log.info("Executed pipeline id={} slug={} nodes={} executionTime={}ms",
                    pipeline.get().getId(), slug, interpretation.nodeResults().size(), executionTime);
            return new PipelineExecutionResult(true, interpretation.output(), executionTime, interpretation.nodeResults());
        } catch (RuntimeException e) {
            log.error("Pipeline execution failed slug={}: {}", slug, e.getMessage(), e);
            return PipelineExecutionResult.failure(e.getMessage() != null ? e.getMessage() : "Pipeline execution failed");
        }
    }
}
