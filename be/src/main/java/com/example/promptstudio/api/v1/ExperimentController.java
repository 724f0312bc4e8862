package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.ComparisonRequest;
import com.example.promptstudio.api.v1.dto.ComparisonResponse;
import com.example.promptstudio.api.v1.dto.ExperimentCreateRequest;
import com.example.promptstudio.api.v1.dto.ExperimentResponse;
import com.example.promptstudio.service.ExperimentService;

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

@RestController
@RequestMapping("/api/v1/experiments")
@RequiredArgsConstructor
@Slf4j
public class ExperimentController {

    private final ExperimentService service;

    @PostMapping
    public ResponseEntity<ExperimentResponse> create(@Valid @RequestBody ExperimentCreateRequest request) {
        log.info("Creating experiment name={} promptId={}", request.name(), request.promptId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExperimentResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @GetMapping
    public ResponseEntity<List<ExperimentResponse>> listByPrompt(@RequestParam String promptId) {
        return ResponseEntity.ok(service.findByPromptId(promptId));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<ExperimentResponse> start(@PathVariable String id) {
        return ResponseEntity.ok(service.start(id));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<ExperimentResponse> stop(@PathVariable String id) {
        return ResponseEntity.ok(service.stop(id));
    }

    @PostMapping("/{id}/compare")
    public ResponseEntity<ComparisonResponse> runComparison(@PathVariable String id,
                                                            @RequestBody(required = false) ComparisonRequest request) {
        log.info("Running comparison for experiment id={}", id);
        return ResponseEntity.ok(service.runComparison(id, request != null ? request.input() : null));
    }
}
