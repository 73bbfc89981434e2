package com.coinbase.examples.quoteserver;

import com.coinbase.x402quote.model.MoneyAmount;

/** Flat price per file, e.g. $0.01 per file. */
public class PerFilePricer implements QuotePricer {
    private final MoneyAmount unitPrice;

    public PerFilePricer(MoneyAmount unitPrice) {
        this.unitPrice = unitPrice;
    }

    @Override
    public MoneyAmount price(QuoteRequest request) {
        return unitPrice.times(request.numberOfFiles);
    }
}
