package com.coinbase.x402quote.client;

/** JSON returned by POST /verify on the facilitator. */
public class VerificationResponse {
    /** Whether the payment verification succeeded. */
    public boolean isValid;

    /** Reason for verification failure (if isValid is false). */
    public String invalidReason;

    /** Address of the paying wallet, when the facilitator reports it. */
    public String payer;
}
