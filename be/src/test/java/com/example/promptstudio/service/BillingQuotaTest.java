package com.example.promptstudio.service;

import com.example.promptstudio.api.v1.dto.UsageQuotaResponse;
import com.example.promptstudio.billing.PaymentGateway;
import com.example.promptstudio.domain.Billing;
import com.example.promptstudio.repository.BillingRepository;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.RunRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("BillingService quota arithmetic")
class BillingQuotaTest {

    private static final Instant NOW = Instant.parse("2026-05-17T09:30:00Z");
    private static final Instant MONTH_START = Instant.parse("2026-05-01T00:00:00Z");

    private BillingRepository billings;
    private RunRepository runs;
    private BillingService service;

    @BeforeEach
    void setUp() {
        billings = mock(BillingRepository.class);
        runs = mock(RunRepository.class);
        service = new BillingService(billings, mock(OrganizationRepository.class), runs, mock(PaymentGateway.class),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("150 tokens against a quota of 100 is 150 percent and exceeded")
    void overQuota() {
        givenQuota("org_1", 100);
        when(runs.sumTokensInForOrganization("org_1", MONTH_START, NOW)).thenReturn(150L);

        assertThat(service.checkUsageQuota("org_1")).isEqualTo(new UsageQuotaResponse(150, 100, 150, true));
    }

    @Test
    @DisplayName("rounds the percentage half up")
    void rounding() {
        givenQuota("org_2", 1000);
        when(runs.sumTokensInForOrganization("org_2", MONTH_START, NOW)).thenReturn(5L);

        assertThat(service.checkUsageQuota("org_2").percentage()).isEqualTo(1);
    }

    @Test
    @DisplayName("reports zero percent for a zero quota")
    void zeroQuota() {
        givenQuota("org_3", 0);
        when(runs.sumTokensInForOrganization("org_3", MONTH_START, NOW)).thenReturn(10L);

        UsageQuotaResponse quota = service.checkUsageQuota("org_3");

        assertThat(quota.percentage()).isZero();
        assertThat(quota.exceeded()).isTrue();
    }

    private void givenQuota(String orgId, long meteredQuota) {
        Billing row = mock(Billing.class);
        when(row.getMeteredQuota()).thenReturn(meteredQuota);
        when(billings.findById(orgId)).thenReturn(Optional.of(row));
    }
}
