package com.example.promptstudio.repository;

import com.example.promptstudio.domain.AuditLog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.data.jpa.test.autoconfigure.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("AuditLogRepository")
class AuditLogRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private AuditLogRepository auditLogs;

    @BeforeEach
    void setUp() {
        for (int i = 0; i < 5; i++) {
            auditLogs.save(new AuditLog("aud_" + i, "org_1", i % 2 == 0 ? "usr_even" : "usr_odd", "prompt.update",
                    "prompt", "prm_" + (i % 2), "{}", T0.plusSeconds(i)));
        }
    }

    @Test
    @DisplayName("pages organization entries newest first")
    void pageByOrg() {
        assertEquals(List.of("aud_4", "aud_3"), ids(auditLogs.findPageByOrgId("org_1", 2, 0)));
        assertEquals(List.of("aud_2", "aud_1"), ids(auditLogs.findPageByOrgId("org_1", 2, 2)));
        assertEquals(List.of("aud_0"), ids(auditLogs.findPageByOrgId("org_1", 2, 4)));
    }

    @Test
    @DisplayName("filters by actor and by target")
    void byActorAndTarget() {
        assertEquals(List.of("aud_3", "aud_1"), ids(auditLogs.findPageByActorUserId("usr_odd", 10, 0)));
        assertEquals(List.of("aud_4", "aud_2", "aud_0"),
                ids(auditLogs.findByTargetTypeAndTargetIdOrderByCreatedAtDesc("prompt", "prm_0")));
    }

    private static List<String> ids(List<AuditLog> entries) {
        return entries.stream().map(AuditLog::getId).toList();
    }
}
