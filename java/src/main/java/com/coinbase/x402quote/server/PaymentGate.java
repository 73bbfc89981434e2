package com.coinbase.x402quote.server;

import com.coinbase.x402quote.client.FacilitatorClient;
import com.coinbase.x402quote.client.SettlementResponse;
import com.coinbase.x402quote.client.VerificationResponse;
import com.coinbase.x402quote.model.PaymentPayload;
import com.coinbase.x402quote.model.PaymentRequiredResponse;
import com.coinbase.x402quote.model.PaymentRequirements;
import com.coinbase.x402quote.model.PaymentRequirementsTemplate;
import com.coinbase.x402quote.model.SettlementResponseHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Server-side x402 flow for one protected route, independent of the HTTP framework:
 * decode the X-PAYMENT header, resolve requirements, verify with the facilitator,
 * and settle once the resource has been served.
 */
public class PaymentGate {

    private static final Logger logger = LoggerFactory.getLogger(PaymentGate.class);

    public static final String PAYMENT_HEADER = "X-PAYMENT";
    public static final String PAYMENT_RESPONSE_HEADER = "X-PAYMENT-RESPONSE";
    public static final int X402_VERSION = 1;

    static final String PAYMENT_HEADER_REQUIRED = "X-PAYMENT header is required";
    static final String INVALID_PAYMENT_HEADER = "Invalid or malformed payment header";
    static final String NO_MATCHING_REQUIREMENTS = "Unable to find matching payment requirements";
    static final String VERIFICATION_FAILED = "Payment verification failed";
    static final String SETTLEMENT_FAILED = "Payment settlement failed";

    private final FacilitatorClient facilitator;
    private final PaymentRequirementsResolver resolver;
    private final URI baseUrl;
    private final List<PaymentRequirementsTemplate> templates;

    public PaymentGate(FacilitatorClient facilitator,
                       PaymentRequirementsResolver resolver,
                       URI baseUrl,
                       List<PaymentRequirementsTemplate> templates) {
        this.facilitator = Objects.requireNonNull(facilitator, "facilitator");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("At least one payment requirements template is required");
        }
        this.templates = List.copyOf(templates);
    }

    /**
     * Decides whether the request may reach the protected resource.
     *
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the facilitator call is interrupted
     * @throws com.coinbase.x402quote.model.InvalidAmountException if the resolver cannot finalize an amount
     */
    public GateDecision authorize(RequestContext request) throws IOException, InterruptedException {
        String header = request.header(PAYMENT_HEADER);
        if (header == null || header.isBlank()) {
            return GateDecision.reject(paymentRequired(nominal(request), PAYMENT_HEADER_REQUIRED));
        }

        PaymentPayload payload = decode(header, request);
        if (payload == null) {
            return GateDecision.reject(paymentRequired(nominal(request), INVALID_PAYMENT_HEADER));
        }

        Resolution resolution = resolver.resolve(request, baseUrl, templates);
        if (!resolution.isFinalized()) {
            return GateDecision.reject(paymentRequired(resolution.getRequirements(), PAYMENT_HEADER_REQUIRED));
        }

        List<PaymentRequirements> finalized = resolution.getRequirements();
        PaymentRequirements matching = finalized.stream()
                .filter(r -> r.scheme.equals(payload.scheme) && r.network.equals(payload.network))
                .findFirst()
                .orElse(null);
        if (matching == null) {
            return GateDecision.reject(paymentRequired(finalized, NO_MATCHING_REQUIREMENTS));
        }

        VerificationResponse verification = facilitator.verify(payload, matching);
        if (!verification.isValid) {
            String reason = verification.invalidReason == null ? VERIFICATION_FAILED : verification.invalidReason;
            logger.info("Payment for {} rejected by facilitator: {}", matching.resource, reason);
            return GateDecision.reject(paymentRequired(finalized, reason));
        }
        return GateDecision.admit(payload, matching);
    }

    /**
     * Settles an admitted payment.
     *
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the facilitator call is interrupted
     */
    public SettlementResponseHeader settle(GateDecision admitted) throws IOException, InterruptedException {
        if (!admitted.isAdmitted()) {
            throw new IllegalArgumentException("Only admitted requests can be settled");
        }
        SettlementResponse settlement = facilitator.settle(admitted.getPayload(), admitted.getRequirements());
        if (settlement.success) {
            logger.info("Settled {} base units for {} in tx {}",
                    admitted.getRequirements().maxAmountRequired, admitted.getRequirements().resource,
                    settlement.transaction);
        } else {
            logger.warn("Settlement for {} failed: {}", admitted.getRequirements().resource, settlement.errorReason);
        }
        return settlement.toHeader();
    }

    /** 402 body for a payment that was verified but could not be settled. */
    public PaymentRequiredResponse settlementFailed(GateDecision admitted, SettlementResponseHeader settlement) {
        String reason = settlement.errorReason == null ? SETTLEMENT_FAILED : settlement.errorReason;
        return paymentRequired(List.of(admitted.getRequirements()), reason);
    }

    private static PaymentPayload decode(String header, RequestContext request) {
        try {
            return PaymentPayload.fromHeader(header);
        } catch (IOException e) {
            logger.debug("Rejecting undecodable payment header on {}: {}", request.path(), e.getMessage());
            return null;
        }
    }

    private List<PaymentRequirements> nominal(RequestContext request) {
        URI resource = request.resourceUrl(baseUrl);
        return templates.stream()
                .map(t -> t.toPaymentRequirements(resource))
                .collect(Collectors.toList());
    }

    private static PaymentRequiredResponse paymentRequired(List<PaymentRequirements> accepts, String error) {
        return new PaymentRequiredResponse(X402_VERSION, accepts, error);
    }
}
