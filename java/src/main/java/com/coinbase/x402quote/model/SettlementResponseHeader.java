package com.coinbase.x402quote.model;

import com.coinbase.x402quote.util.Json;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.IOException;
import java.util.Base64;

/**
 * Settlement response header that gets base64-encoded into X-PAYMENT-RESPONSE.
 */
@JsonInclude(JsonInclude.Include.ALWAYS) // Always include all fields, even nulls
public class SettlementResponseHeader {
    /** Whether the settlement was successful. */
    public boolean success;

    /** Transaction hash of the settled payment. */
    public String transaction;

    /** Network ID where the settlement occurred. */
    public String network;

    /** Wallet address of the person who made the payment (can be null). */
    public String payer;

    /** Reason reported by the facilitator when settlement failed (can be null). */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String errorReason;

    /** Default constructor for Jackson. */
    public SettlementResponseHeader() {}

    public SettlementResponseHeader(boolean success, String transaction, String network, String payer) {
        this.success = success;
        this.transaction = transaction;
        this.network = network;
        this.payer = payer;
    }

    /** Base64 JSON form used as the X-PAYMENT-RESPONSE header value. */
    public String toHeader() {
        try {
            return Base64.getEncoder().encodeToString(Json.MAPPER.writeValueAsBytes(this));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to encode settlement response", e);
        }
    }
}
