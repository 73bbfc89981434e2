package com.coinbase.x402quote.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/** Defines one acceptable way to pay for a resource (x402 v1). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRequirements {
    public String scheme;              // e.g. "exact"
    public String network;             // e.g. "base-sepolia"
    public String maxAmountRequired;   // uint256 in atomic units
    public String resource;            // absolute URL of the protected resource
    public String description;
    public String mimeType;
    public Map<String, Object> outputSchema; // optional JSON schema
    public String payTo;               // address (EVM / Solana etc.)
    public Integer maxTimeoutSeconds;
    public String asset;               // token contract address
    public Map<String, Object> extra;  // scheme-specific, e.g. EIP-712 domain name/version
}
