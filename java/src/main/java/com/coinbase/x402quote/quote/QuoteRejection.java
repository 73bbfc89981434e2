package com.coinbase.x402quote.quote;

/** Why a quote could not back a payment requirement. Internal only. */
public enum QuoteRejection {
    NOT_FOUND,
    EXPIRED,
    OWNER_MISMATCH,
    ALREADY_CONSUMED
}
