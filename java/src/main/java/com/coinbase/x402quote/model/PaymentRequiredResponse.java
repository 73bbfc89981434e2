package com.coinbase.x402quote.model;

import java.util.ArrayList;
import java.util.List;

/** HTTP 402 response body returned by an x402-enabled server. */
public class PaymentRequiredResponse {
    public int x402Version;
    public List<PaymentRequirements> accepts = new ArrayList<>();
    public String error;

    /** Default constructor for Jackson. */
    public PaymentRequiredResponse() {}

    public PaymentRequiredResponse(int x402Version, List<PaymentRequirements> accepts, String error) {
        this.x402Version = x402Version;
        this.accepts = new ArrayList<>(accepts);
        this.error = error;
    }
}
