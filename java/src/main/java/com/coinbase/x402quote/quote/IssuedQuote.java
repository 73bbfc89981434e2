package com.coinbase.x402quote.quote;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the caller gets back from a quote request: the id to present and the quoted amount. */
public class IssuedQuote {
    @JsonProperty("quote_id")
    private final String quoteId;

    @JsonProperty("amount")
    private final String amount;

    public IssuedQuote(String quoteId, String amount) {
        this.quoteId = quoteId;
        this.amount = amount;
    }

    public String getQuoteId() {
        return quoteId;
    }

    public String getAmount() {
        return amount;
    }
}
