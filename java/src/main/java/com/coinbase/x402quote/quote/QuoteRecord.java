package com.coinbase.x402quote.quote;

import java.time.Instant;
import java.util.Objects;

/**
 * One priced offer issued to one caller. Immutable snapshot; the store replaces the
 * record when it is consumed.
 */
public final class QuoteRecord {
    private final String amount;
    private final String ownerId;
    private final Instant expiresAt;
    private final boolean consumed;

    public QuoteRecord(String amount, String ownerId, Instant expiresAt) {
        this(amount, ownerId, expiresAt, false);
    }

    private QuoteRecord(String amount, String ownerId, Instant expiresAt, boolean consumed) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.consumed = consumed;
    }

    /** Decimal money amount as issued, e.g. {@code "0.05"}. */
    public String getAmount() {
        return amount;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isConsumed() {
        return consumed;
    }

    /** A quote is expired from {@code expiresAt} onwards. */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    QuoteRecord markConsumed() {
        return new QuoteRecord(amount, ownerId, expiresAt, true);
    }

    @Override
    public String toString() {
        return "QuoteRecord{amount=" + amount + ", ownerId=" + ownerId
                + ", expiresAt=" + expiresAt + ", consumed=" + consumed + '}';
    }
}
