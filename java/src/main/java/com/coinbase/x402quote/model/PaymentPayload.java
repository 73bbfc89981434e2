package com.coinbase.x402quote.model;

import com.coinbase.x402quote.util.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/** Signed payment sent by a client in the base64 encoded X-PAYMENT header. */
public class PaymentPayload {
    public int x402Version;
    public String scheme;
    public String network;
    public Map<String, Object> payload;   // scheme-specific: signature + authorization

    /** Serializes this payload to its X-PAYMENT header value. */
    public String toHeader() {
        try {
            byte[] json = Json.MAPPER.writeValueAsBytes(this);
            return Base64.getEncoder().encodeToString(json);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to encode payment payload", e);
        }
    }

    /**
     * Decodes an X-PAYMENT header value.
     *
     * @param header base64 encoded JSON payload
     * @return the decoded payload
     * @throws IOException if the header is not valid base64 or not a payment payload
     */
    public static PaymentPayload fromHeader(String header) throws IOException {
        byte[] json;
        try {
            json = Base64.getDecoder().decode(header.trim());
        } catch (IllegalArgumentException e) {
            throw new IOException("X-PAYMENT header is not valid base64", e);
        }
        PaymentPayload decoded = Json.MAPPER.readValue(new String(json, StandardCharsets.UTF_8), PaymentPayload.class);
        if (decoded.scheme == null || decoded.network == null) {
            throw new IOException("X-PAYMENT header is missing scheme or network");
        }
        return decoded;
    }
}
