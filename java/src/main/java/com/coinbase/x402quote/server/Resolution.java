package com.coinbase.x402quote.server;

import com.coinbase.x402quote.model.PaymentRequirements;

import java.util.List;

/**
 * Outcome of resolving the payment requirements of one request: either finalized
 * requirements to verify the payment against, or a payment-required signal carrying
 * the nominal requirements.
 */
public final class Resolution {

    public enum Outcome { FINALIZED, PAYMENT_REQUIRED }

    private final Outcome outcome;
    private final List<PaymentRequirements> requirements;

    private Resolution(Outcome outcome, List<PaymentRequirements> requirements) {
        this.outcome = outcome;
        this.requirements = List.copyOf(requirements);
    }

    public static Resolution finalized(List<PaymentRequirements> requirements) {
        return new Resolution(Outcome.FINALIZED, requirements);
    }

    public static Resolution paymentRequired(List<PaymentRequirements> nominal) {
        return new Resolution(Outcome.PAYMENT_REQUIRED, nominal);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isFinalized() {
        return outcome == Outcome.FINALIZED;
    }

    public List<PaymentRequirements> getRequirements() {
        return requirements;
    }
}
