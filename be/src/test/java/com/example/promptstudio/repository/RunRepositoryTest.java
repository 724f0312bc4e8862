package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Project;
import com.example.promptstudio.domain.Run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.data.jpa.test.autoconfigure.DataJpaTest;
import org.springframework.data.domain.Limit;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("RunRepository")
class RunRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    @Autowired
    private RunRepository runs;

    @Autowired
    private ProjectRepository projects;

    @BeforeEach
    void setUp() {
        projects.save(new Project("proj_a", "org_a", "A", null, "[]", T0));
        projects.save(new Project("proj_b", "org_a", "B", null, "[]", T0));
        projects.save(new Project("proj_x", "org_x", "X", null, "[]", T0));
        runs.save(run("run_1", "proj_a", 100, T0));
        runs.save(run("run_2", "proj_b", 50, T0.plusSeconds(60)));
        runs.save(run("run_3", "proj_x", 999, T0.plusSeconds(120)));
        runs.save(run("run_4", "proj_a", 7, T0.minusSeconds(86_400 * 30)));
    }

    @Test
    @DisplayName("sums input tokens of the organization's projects within the window")
    void sumTokensInForOrganization() {
        assertEquals(150L, runs.sumTokensInForOrganization("org_a", T0.minusSeconds(1), T0.plusSeconds(3600)));
        assertEquals(157L, runs.sumTokensInForOrganization("org_a", T0.minusSeconds(86_400 * 60), T0.plusSeconds(3600)));
    }

    @Test
    @DisplayName("sums to zero when nothing matches")
    void sumIsZeroWithoutRuns() {
        assertEquals(0L, runs.sumTokensInForOrganization("org_none", T0.minusSeconds(1), T0.plusSeconds(3600)));
    }

    @Test
    @DisplayName("lists organization runs newest first")
    void findByOrganization() {
        List<String> ids = runs.findByOrganization("org_a").stream().map(Run::getId).toList();

        assertEquals(List.of("run_2", "run_1", "run_4"), ids);
    }

    @Test
    @DisplayName("limits project runs")
    void findByProjectWithLimit() {
        List<Run> latest = runs.findByProjectIdOrderByCreatedAtDesc("proj_a", Limit.of(1));

        assertEquals(1, latest.size());
        assertEquals("run_1", latest.get(0).getId());
    }

    private static Run run(String id, String projectId, int tokensIn, Instant createdAt) {
        return new Run(id, projectId, "prm_1", "ver_1", null, "gpt-4o-mini", "{}", "{}",
                tokensIn, 10, new BigDecimal("0.001000"), 120, true, "[]", createdAt);
    }
}
