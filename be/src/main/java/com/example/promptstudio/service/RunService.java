package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.RunAnalyticsResponse;
import com.example.promptstudio.api.v1.dto.RunCreateRequest;
import com.example.promptstudio.api.v1.dto.RunResponse;
import com.example.promptstudio.domain.Run;
import com.example.promptstudio.repository.ExperimentRepository;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.repository.PromptRepository;
import com.example.promptstudio.repository.PromptVersionRepository;
import com.example.promptstudio.repository.RunRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvSchema;

import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only execution runs: recording, listing, analytics and export.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunService {

    public static final int DEFAULT_LIMIT = 100;
    static final String CSV_HEADER = "id,model,tokens_in,tokens_out,cost_usd,latency_ms,created_at";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema CSV_SCHEMA = CsvSchema.builder()
            .addColumn("id")
            .addColumn("model")
            .addNumberColumn("tokens_in")
            .addNumberColumn("tokens_out")
            .addColumn("cost_usd")
            .addNumberColumn("latency_ms")
            .addColumn("created_at")
            .setUseHeader(true)
            .setLineSeparator("\n")
            .build();

    private final RunRepository runs;
    private final ProjectRepository projects;
    private final PromptRepository prompts;
    private final PromptVersionRepository versions;
    private final ExperimentRepository experiments;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public RunResponse create(RunCreateRequest request) {
        requireExists(projects.existsById(request.projectId()), "Project", request.projectId());
        requireExists(prompts.existsById(request.promptId()), "Prompt", request.promptId());
        requireExists(versions.existsById(request.versionId()), "Prompt version", request.versionId());
        if (request.experimentId() != null) {
            requireExists(experiments.existsById(request.experimentId()), "Experiment", request.experimentId());
        }
        Run run = new Run(idGenerator.newId("run"), request.projectId(), request.promptId(), request.versionId(),
                request.experimentId(), request.model(),
                json.writeObject(request.input()), json.writeObject(request.output()),
                request.tokensIn(), request.tokensOut(), request.costUsd(), request.latencyMs(), request.success(),
                json.writeObject(request.flags()), clock.instant());
        runs.save(run);
        log.debug("Recorded run id={} projectId={} model={} tokensIn={}", run.getId(), run.getProjectId(), run.getModel(), run.getTokensIn());
        return toResponse(run);
    }

    @Transactional(readOnly = true)
    public RunResponse findById(String id) {
        return runs.findById(id)
                .map(this::toResponse)
                .orElseThrow(() -> ResourceNotFoundException.of("Run", id));
    }

    /** Most recent runs of the project, newest first. */
    @Transactional(readOnly = true)
    public List<RunResponse> findByProjectId(String projectId, Integer limit) {
        int max = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return runs.findByProjectIdOrderByCreatedAtDesc(projectId, Limit.of(max)).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public RunAnalyticsResponse analytics(RunFilter filter) {
        List<Run> selected = select(filter);
        long totalRuns = selected.size();
        long totalTokens = selected.stream().mapToLong(r -> (long) r.getTokensIn() + r.getTokensOut()).sum();
        BigDecimal totalCost = selected.stream().map(Run::getCostUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
        long avgLatency = totalRuns == 0 ? 0 : Math.round(selected.stream().mapToLong(Run::getLatencyMs).sum() / (double) totalRuns);
        double successRate = totalRuns == 0 ? 0.0
                : BigDecimal.valueOf(selected.stream().filter(Run::isSuccess).count() * 100.0 / totalRuns)
                        .setScale(2, RoundingMode.HALF_UP)
                        .doubleValue();
        Map<String, Long> runsByModel = selected.stream()
                .collect(Collectors.groupingBy(Run::getModel, LinkedHashMap::new, Collectors.counting()));
        Map<String, BigDecimal> costByDay = selected.stream()
                .collect(Collectors.groupingBy(r -> LocalDate.ofInstant(r.getCreatedAt(), ZoneOffset.UTC).toString(),
                        TreeMap::new,
                        Collectors.reducing(BigDecimal.ZERO, Run::getCostUsd, BigDecimal::add)));
        log.debug("Analytics orgId={} runs={} tokens={}", filter.orgId(), totalRuns, totalTokens);
        return new RunAnalyticsResponse(totalRuns, totalTokens, totalCost, avgLatency, successRate, runsByModel, costByDay);
    }

    /**
     * Exports the filtered runs, newest first. CSV has a header line and no trailing newline.
     */
    @Transactional(readOnly = true)
    public String export(RunFilter filter, ExportFormat format) {
        List<Run> selected = select(filter);
        log.info("Exporting {} runs orgId={} format={}", selected.size(), filter.orgId(), format);
        if (format == ExportFormat.CSV) {
            return toCsv(selected);
        }
        return json.write(selected.stream().map(this::toResponse).toList());
    }

    private static String toCsv(List<Run> selected) {
        List<Map<String, Object>> rows = selected.stream().map(RunService::toCsvRow).toList();
        String csv = CSV_MAPPER.writer(CSV_SCHEMA).writeValueAsString(rows);
        // every record is terminated; the export has no trailing line separator
        return csv.endsWith("\n") ? csv.substring(0, csv.length() - 1) : csv;
    }

    private static Map<String, Object> toCsvRow(Run run) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", run.getId());
        row.put("model", run.getModel());
        row.put("tokens_in", run.getTokensIn());
        row.put("tokens_out", run.getTokensOut());
        row.put("cost_usd", run.getCostUsd().toPlainString());
        row.put("latency_ms", run.getLatencyMs());
        row.put("created_at", run.getCreatedAt().toString());
        return row;
    }

    private List<Run> select(RunFilter filter) {
        return runs.findByOrganization(filter.orgId()).stream()
                .filter(r -> filter.projectId() == null || filter.projectId().equals(r.getProjectId()))
                .filter(r -> filter.startDate() == null || !r.getCreatedAt().isBefore(filter.startDate()))
                .filter(r -> filter.endDate() == null || !r.getCreatedAt().isAfter(filter.endDate()))
                .filter(r -> filter.model() == null || filter.model().equals(r.getModel()))
                .toList();
    }

    private static void requireExists(boolean exists, String type, String id) {
        if (!exists) {
            throw ResourceNotFoundException.of(type, id);
        }
    }

    private RunResponse toResponse(Run run) {
        return new RunResponse(run.getId(), run.getProjectId(), run.getPromptId(), run.getVersionId(), run.getExperimentId(),
                run.getModel(), json.readObject(run.getInputJson()), json.readObject(run.getOutputJson()),
                run.getTokensIn(), run.getTokensOut(), run.getCostUsd(), run.getLatencyMs(), run.isSuccess(),
                json.readObject(run.getFlagsJson()), run.getCreatedAt());
    }
}
