package com.example.promptstudio.service;

import com.example.promptstudio.api.DomainRuleViolationException;
import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ComparisonResponse;
import com.example.promptstudio.api.v1.dto.ExperimentCreateRequest;
import com.example.promptstudio.api.v1.dto.ExperimentResponse;
import com.example.promptstudio.api.v1.dto.VariantResult;
import com.example.promptstudio.domain.Experiment;
import com.example.promptstudio.domain.ExperimentStatus;
import com.example.promptstudio.llm.ModelCompletion;
import com.example.promptstudio.llm.ModelGateway;
import com.example.promptstudio.repository.ExperimentRepository;
import com.example.promptstudio.repository.PromptRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A/B experiments over prompt variants.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExperimentService {

    static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final ExperimentRepository experiments;
    private final PromptRepository prompts;
    private final ModelGateway modelGateway;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public ExperimentResponse create(ExperimentCreateRequest request) {
        if (!prompts.existsById(request.promptId())) {
            throw ResourceNotFoundException.of("Prompt", request.promptId());
        }
        Experiment experiment = new Experiment(idGenerator.newId("exp"), request.promptId(), request.name(),
                json.writeObject(request.variants()), clock.instant());
        experiments.save(experiment);
        log.info("Created experiment id={} promptId={}", experiment.getId(), experiment.getPromptId());
        return toResponse(experiment);
    }

    @Transactional(readOnly = true)
    public ExperimentResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<ExperimentResponse> findByPromptId(String promptId) {
        return experiments.findByPromptIdOrderByCreatedAtDesc(promptId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public ExperimentResponse start(String id) {
        return moveTo(id, ExperimentStatus.RUNNING);
    }

    @Transactional
    public ExperimentResponse stop(String id) {
        return moveTo(id, ExperimentStatus.COMPLETED);
    }

    /**
     * Runs the input through the first two declared variants.
     *
     * @throws DomainRuleViolationException if the experiment is not running or has fewer than two variants
     */
    @Transactional(readOnly = true)
    public ComparisonResponse runComparison(String id, Map<String, Object> input) {
        Experiment experiment = require(id);
        if (experiment.getStatus() != ExperimentStatus.RUNNING) {
            throw new DomainRuleViolationException("Experiment " + id + " is not running");
        }
        List<Map.Entry<String, Object>> variants = new ArrayList<>(json.readObject(experiment.getVariantsJson()).entrySet());
        if (variants.size() < 2) {
            throw new DomainRuleViolationException("Experiment must have at least 2 variants for comparison");
        }
        Map<String, Object> safeInput = input != null ? input : Map.of();
        VariantResult first = runVariant(variants.get(0), safeInput);
        VariantResult second = runVariant(variants.get(1), safeInput);
        log.info("Compared variants {} and {} of experiment id={}", first.variant(), second.variant(), id);
        return new ComparisonResponse(first, second);
    }

    private VariantResult runVariant(Map.Entry<String, Object> variant, Map<String, Object> input) {
        String model = DEFAULT_MODEL;
        String prompt = "Variant " + variant.getKey() + " with input: " + json.write(input);
        if (variant.getValue() instanceof Map<?, ?> config) {
            if (config.get("model") instanceof String configured && !configured.isBlank()) {
                model = configured;
            }
            if (config.get("prompt") instanceof String configured && !configured.isBlank()) {
                prompt = configured;
            }
        }
        ModelCompletion completion = modelGateway.complete(model, prompt);
        return new VariantResult(variant.getKey(), completion.text(), completion.totalTokens(), completion.latencyMs(), variant.getValue());
    }

    private ExperimentResponse moveTo(String id, ExperimentStatus status) {
        Experiment experiment = require(id);
        experiment.moveTo(status);
        experiments.save(experiment);
        log.info("Experiment id={} is now {}", id, status.wireName());
        return toResponse(experiment);
    }

    private Experiment require(String id) {
        return experiments.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Experiment", id));
    }

    private ExperimentResponse toResponse(Experiment experiment) {
        return new ExperimentResponse(experiment.getId(), experiment.getPromptId(), experiment.getName(),
                experiment.getStatus(), json.readObject(experiment.getVariantsJson()), experiment.getCreatedAt());
    }
}
