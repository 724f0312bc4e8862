package com.example.promptstudio.billing;

import com.example.promptstudio.domain.OrganizationPlan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for the payment provider. Session ids have the form
 * {@code cs_test_<epochMillis>_<orgId>} so they can be resolved without remote state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StubPaymentGateway implements PaymentGateway {

    static final String CHECKOUT_BASE_URL = "https://checkout.stripe.com/c/pay/";
    static final String PORTAL_BASE_URL = "https://billing.stripe.com/p/session_";

    private static final Pattern SESSION_ID = Pattern.compile("^cs_test_(\\d+)_(.+)$");

    private final Clock clock;

    @Override
    public CheckoutSession createCheckoutSession(String orgId, OrganizationPlan plan, String successUrl) {
        String sessionId = "cs_test_" + clock.millis() + "_" + orgId;
        log.info("Stub checkout session created sessionId={} plan={} successUrl={}", sessionId, plan.wireName(), successUrl);
        return new CheckoutSession(sessionId, CHECKOUT_BASE_URL + sessionId);
    }

    @Override
    public Optional<String> resolveCheckoutSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Matcher matcher = SESSION_ID.matcher(sessionId);
        return matcher.matches() ? Optional.of(matcher.group(2)) : Optional.empty();
    }

    @Override
    public OrganizationPlan purchasedPlan(String sessionId) {
        return OrganizationPlan.PRO;
    }

    @Override
    public String createPortalSessionUrl(String customerId, String returnUrl) {
        String url = PORTAL_BASE_URL + customerId;
        return returnUrl != null && !returnUrl.isBlank() ? url + "?return_url=" + returnUrl : url;
    }
}
