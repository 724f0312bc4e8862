package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.RunAnalyticsResponse;
import com.example.promptstudio.api.v1.dto.RunCreateRequest;
import com.example.promptstudio.api.v1.dto.RunResponse;
import com.example.promptstudio.service.ExportFormat;
import com.example.promptstudio.service.RunFilter;
import com.example.promptstudio.service.RunService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Runs: recording, listing, {@code /analytics} and {@code /export?format=csv|json}.
 * Date filters are ISO-8601 instants.
 */
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
@Slf4j
public class RunController {

    private final RunService service;

    @PostMapping
    public ResponseEntity<RunResponse> create(@Valid @RequestBody RunCreateRequest request) {
        log.debug("Recording run projectId={} model={}", request.projectId(), request.model());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @GetMapping
    public ResponseEntity<List<RunResponse>> listByProject(@RequestParam String projectId,
                                                           @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(service.findByProjectId(projectId, limit));
    }

    @GetMapping("/analytics")
    public ResponseEntity<RunAnalyticsResponse> analytics(@RequestParam String orgId,
                                                          @RequestParam(required = false) String projectId,
                                                          @RequestParam(required = false) Instant startDate,
                                                          @RequestParam(required = false) Instant endDate,
                                                          @RequestParam(required = false) String model) {
        return ResponseEntity.ok(service.analytics(new RunFilter(orgId, projectId, startDate, endDate, model)));
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(@RequestParam String orgId,
                                         @RequestParam(required = false) String projectId,
                                         @RequestParam(required = false) Instant startDate,
                                         @RequestParam(required = false) Instant endDate,
                                         @RequestParam(required = false) String model,
                                         @RequestParam(defaultValue = "json") String format) {
        ExportFormat exportFormat = ExportFormat.parse(format);
        String body = service.export(new RunFilter(orgId, projectId, startDate, endDate, model), exportFormat);
        MediaType type = exportFormat == ExportFormat.CSV ? new MediaType("text", "csv") : MediaType.APPLICATION_JSON;
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=runs." + exportFormat.name().toLowerCase(Locale.ROOT))
                .body(body);
    }
}
