package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.BillingResponse;
import com.example.promptstudio.api.v1.dto.CheckoutRequest;
import com.example.promptstudio.api.v1.dto.PlanChangeRequest;
import com.example.promptstudio.api.v1.dto.PortalSessionRequest;
import com.example.promptstudio.api.v1.dto.PortalSessionResponse;
import com.example.promptstudio.api.v1.dto.SessionVerificationResponse;
import com.example.promptstudio.api.v1.dto.UsageQuotaResponse;
import com.example.promptstudio.api.v1.dto.WebhookAckResponse;
import com.example.promptstudio.billing.CheckoutSession;
import com.example.promptstudio.service.BillingService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Slf4j
public class BillingController {

    private final BillingService service;

    @PostMapping("/checkout")
    public ResponseEntity<CheckoutSession> createCheckoutSession(@Valid @RequestBody CheckoutRequest request) {
        log.info("Creating checkout session orgId={} plan={}", request.orgId(), request.plan());
        return ResponseEntity.ok(service.createCheckoutSession(request.orgId(), request.plan(), request.successUrl()));
    }

    @GetMapping("/checkout/{sessionId}")
    public ResponseEntity<SessionVerificationResponse> verifySession(@PathVariable String sessionId) {
        return ResponseEntity.ok(service.verifySession(sessionId));
    }

    @GetMapping("/{orgId}")
    public ResponseEntity<BillingResponse> getByOrgId(@PathVariable String orgId) {
        return ResponseEntity.ok(service.findByOrgId(orgId)
                .orElseThrow(() -> new ResourceNotFoundException("No billing information found for organization " + orgId)));
    }

    @PutMapping("/{orgId}/plan")
    public ResponseEntity<BillingResponse> updatePlan(@PathVariable String orgId, @Valid @RequestBody PlanChangeRequest request) {
        log.info("Changing plan orgId={} plan={}", orgId, request.plan());
        return ResponseEntity.ok(service.updateOrganizationPlan(orgId, request.plan(), request.customerId()));
    }

    @PostMapping("/{orgId}/portal")
    public ResponseEntity<PortalSessionResponse> createPortalSession(@PathVariable String orgId,
                                                                     @RequestBody(required = false) PortalSessionRequest request) {
        return ResponseEntity.ok(service.createPortalSession(orgId, request != null ? request.returnUrl() : null));
    }

    @GetMapping("/{orgId}/usage")
    public ResponseEntity<UsageQuotaResponse> checkUsageQuota(@PathVariable String orgId) {
        return ResponseEntity.ok(service.checkUsageQuota(orgId));
    }

    @PostMapping("/webhook")
    public ResponseEntity<WebhookAckResponse> webhook(@RequestBody(required = false) Map<String, Object> event) {
        return ResponseEntity.ok(service.handleWebhook(event));
    }
}
