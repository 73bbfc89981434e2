package com.coinbase.x402quote.server;

import com.coinbase.x402quote.model.PaymentPayload;
import com.coinbase.x402quote.model.PaymentRequiredResponse;
import com.coinbase.x402quote.model.PaymentRequirements;

/** Result of {@link PaymentGate#authorize(RequestContext)}. */
public final class GateDecision {
    private final PaymentPayload payload;
    private final PaymentRequirements requirements;
    private final PaymentRequiredResponse rejection;

    private GateDecision(PaymentPayload payload, PaymentRequirements requirements, PaymentRequiredResponse rejection) {
        this.payload = payload;
        this.requirements = requirements;
        this.rejection = rejection;
    }

    static GateDecision admit(PaymentPayload payload, PaymentRequirements requirements) {
        return new GateDecision(payload, requirements, null);
    }

    static GateDecision reject(PaymentRequiredResponse rejection) {
        return new GateDecision(null, null, rejection);
    }

    public boolean isAdmitted() {
        return rejection == null;
    }

    /** Verified payment; {@code null} when rejected. */
    public PaymentPayload getPayload() {
        return payload;
    }

    /** Requirements the payment was verified against; {@code null} when rejected. */
    public PaymentRequirements getRequirements() {
        return requirements;
    }

    /** 402 body to send; {@code null} when admitted. */
    public PaymentRequiredResponse getRejection() {
        return rejection;
    }
}
