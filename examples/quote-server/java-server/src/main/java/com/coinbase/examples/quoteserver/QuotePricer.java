package com.coinbase.examples.quoteserver;

import com.coinbase.x402quote.model.MoneyAmount;

/** Business pricing: turns a quote request into a money amount. */
public interface QuotePricer {
    MoneyAmount price(QuoteRequest request);
}
