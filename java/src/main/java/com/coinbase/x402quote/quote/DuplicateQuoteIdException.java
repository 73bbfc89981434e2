package com.coinbase.x402quote.quote;

/** Raised when a quote id is inserted twice. */
public class DuplicateQuoteIdException extends IllegalStateException {
    private final String quoteId;

    public DuplicateQuoteIdException(String quoteId) {
        super("Quote id already in use: " + quoteId);
        this.quoteId = quoteId;
    }

    public String getQuoteId() {
        return quoteId;
    }
}
