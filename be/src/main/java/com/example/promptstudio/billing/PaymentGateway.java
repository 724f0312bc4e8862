package com.example.promptstudio.billing;

import com.example.promptstudio.domain.OrganizationPlan;

import java.util.Optional;

/**
 * Payment provider seam. Implementations only talk to the provider; plan bookkeeping stays in the billing service.
 */
public interface PaymentGateway {

    CheckoutSession createCheckoutSession(String orgId, OrganizationPlan plan, String successUrl);

    /**
     * Organization id a completed checkout session was opened for, or empty when the session is unknown.
     */
    Optional<String> resolveCheckoutSession(String sessionId);

    /** Plan purchased through a completed checkout session. */
    OrganizationPlan purchasedPlan(String sessionId);

    String createPortalSessionUrl(String customerId, String returnUrl);
}
