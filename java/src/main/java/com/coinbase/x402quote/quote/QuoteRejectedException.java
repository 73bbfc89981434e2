package com.coinbase.x402quote.quote;

/** Raised by {@link QuoteStore#tryConsume} when a quote cannot be consumed. */
public class QuoteRejectedException extends Exception {
    private final String quoteId;
    private final QuoteRejection reason;

    public QuoteRejectedException(String quoteId, QuoteRejection reason) {
        super("Quote " + quoteId + " rejected: " + reason);
        this.quoteId = quoteId;
        this.reason = reason;
    }

    public String getQuoteId() {
        return quoteId;
    }

    public QuoteRejection getReason() {
        return reason;
    }
}
