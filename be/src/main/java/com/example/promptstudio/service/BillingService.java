package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.BillingResponse;
import com.example.promptstudio.api.v1.dto.PortalSessionResponse;
import com.example.promptstudio.api.v1.dto.SessionVerificationResponse;
import com.example.promptstudio.api.v1.dto.UsageQuotaResponse;
import com.example.promptstudio.api.v1.dto.WebhookAckResponse;
import com.example.promptstudio.billing.CheckoutSession;
import com.example.promptstudio.billing.PaymentGateway;
import com.example.promptstudio.domain.Billing;
import com.example.promptstudio.domain.Organization;
import com.example.promptstudio.domain.OrganizationPlan;
import com.example.promptstudio.repository.BillingRepository;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.RunRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Plans, usage quotas and the payment-provider flows (checkout, portal, webhooks).
 * <p>
 * The billing row of an organization is created on its first plan change; until then the organization
 * is treated as free with default limits. A plan change updates the billing row and the organization's
 * plan in the same transaction.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingService {

    static final Duration RENEWAL_PERIOD = Duration.ofDays(30);
    static final Set<String> HANDLED_EVENTS = Set.of(
            "invoice.payment_succeeded",
            "invoice.payment_failed",
            "customer.subscription.updated",
            "customer.subscription.deleted"
    );

    private final BillingRepository billings;
    private final OrganizationRepository organizations;
    private final RunRepository runs;
    private final PaymentGateway paymentGateway;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CheckoutSession createCheckoutSession(String orgId, String plan, String successUrl) {
        requireOrganization(orgId);
        OrganizationPlan requested = OrganizationPlan.fromWireName(plan);
        return paymentGateway.createCheckoutSession(orgId, requested, successUrl);
    }

    /** Soft check of a checkout session; never throws for unknown sessions. */
    @Transactional(readOnly = true)
    public SessionVerificationResponse verifySession(String sessionId) {
        Optional<String> orgId = paymentGateway.resolveCheckoutSession(sessionId)
                .filter(organizations::existsById);
        if (orgId.isEmpty()) {
            log.warn("Checkout session could not be verified sessionId={}", sessionId);
            return new SessionVerificationResponse(false, null, null);
        }
        return new SessionVerificationResponse(true, orgId.get(), paymentGateway.purchasedPlan(sessionId));
    }

    @Transactional(readOnly = true)
    public Optional<BillingResponse> findByOrgId(String orgId) {
        return billings.findById(orgId).map(BillingService::toResponse);
    }

    /**
     * Applies the plan's seats and quota, sets renewal 30 days out for paid plans, and mirrors the plan
     * onto the organization.
     *
     * @throws IllegalArgumentException if {@code plan} is not a known plan
     */
    @Transactional
    public BillingResponse updateOrganizationPlan(String orgId, String plan, String customerId) {
        Organization organization = requireOrganization(orgId);
        OrganizationPlan newPlan = OrganizationPlan.fromWireName(plan);
        Instant renewsAt = newPlan.isPaid() ? clock.instant().plus(RENEWAL_PERIOD) : null;
        Billing billing = billings.findById(orgId).orElseGet(() -> new Billing(orgId));
        billing.applyPlan(newPlan, customerId, renewsAt);
        billings.save(billing);
        organization.changePlan(newPlan);
        organizations.save(organization);
        log.info("Organization id={} moved to plan={} seats={} quota={}", orgId, newPlan.wireName(), billing.getSeats(), billing.getMeteredQuota());
        return toResponse(billing);
    }

    @Transactional(readOnly = true)
    public PortalSessionResponse createPortalSession(String orgId, String returnUrl) {
        Billing billing = billings.findById(orgId)
                .filter(b -> b.getStripeCustomerId() != null)
                .orElseThrow(() -> new ResourceNotFoundException("No billing information found for organization " + orgId));
        return new PortalSessionResponse(paymentGateway.createPortalSessionUrl(billing.getStripeCustomerId(), returnUrl));
    }

    /**
     * Tokens used this calendar month (UTC) against the metered quota.
     */
    @Transactional(readOnly = true)
    public UsageQuotaResponse checkUsageQuota(String orgId) {
        Optional<Billing> billing = billings.findById(orgId);
        if (billing.isEmpty()) {
            return new UsageQuotaResponse(0, OrganizationPlan.FREE.meteredQuota(), 0, false);
        }
        Instant now = clock.instant();
        Instant monthStart = ZonedDateTime.ofInstant(now, ZoneOffset.UTC)
                .withDayOfMonth(1)
                .truncatedTo(ChronoUnit.DAYS)
                .toInstant();
        long used = runs.sumTokensInForOrganization(orgId, monthStart, now);
        long quota = billing.get().getMeteredQuota();
        long percentage = quota > 0 ? Math.round(used * 100.0 / quota) : 0;
        return new UsageQuotaResponse(used, quota, percentage, used > quota);
    }

    /**
     * Handles a payment-provider event. Unknown event types are acknowledged and ignored.
     *
     * @throws IllegalArgumentException if the event has no string {@code type}
     */
    @Transactional
    public WebhookAckResponse handleWebhook(Map<String, Object> event) {
        if (event == null || !(event.get("type") instanceof String type)) {
            throw new IllegalArgumentException("Invalid webhook event");
        }
        if (!HANDLED_EVENTS.contains(type)) {
            log.info("Ignoring unhandled webhook event type={}", type);
            return new WebhookAckResponse(true, type);
        }
        String customerId = customerOf(event);
        log.info("Webhook event type={} customer={}", type, customerId);
        if ("customer.subscription.deleted".equals(type) && customerId != null) {
            billings.findFirstByStripeCustomerId(customerId)
                    .ifPresent(billing -> updateOrganizationPlan(billing.getOrgId(), OrganizationPlan.FREE.wireName(), null));
        }
        return new WebhookAckResponse(true, type);
    }

    private static String customerOf(Map<String, Object> event) {
        if (event.get("data") instanceof Map<?, ?> data
                && data.get("object") instanceof Map<?, ?> object
                && object.get("customer") instanceof String customer) {
            return customer;
        }
        return null;
    }

    private Organization requireOrganization(String orgId) {
        return organizations.findById(orgId).orElseThrow(() -> ResourceNotFoundException.of("Organization", orgId));
    }

    private static BillingResponse toResponse(Billing billing) {
        return new BillingResponse(billing.getOrgId(), billing.getStripeCustomerId(), billing.getPlan(),
                billing.getSeats(), billing.getMeteredQuota(), billing.getRenewsAt());
    }
}
