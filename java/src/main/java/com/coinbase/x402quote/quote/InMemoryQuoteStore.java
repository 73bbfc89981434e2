package com.coinbase.x402quote.quote;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link QuoteStore} backed by a {@link ConcurrentHashMap}. Consumption runs inside
 * {@code computeIfPresent}, which locks only the bin holding the quote, so different
 * quotes never contend with each other. Nothing here is persisted.
 */
public class InMemoryQuoteStore implements QuoteStore {

    private final ConcurrentHashMap<String, QuoteRecord> quotes = new ConcurrentHashMap<>();

    @Override
    public void put(String quoteId, QuoteRecord record) {
        Objects.requireNonNull(quoteId, "quoteId");
        Objects.requireNonNull(record, "record");
        if (quotes.putIfAbsent(quoteId, record) != null) {
            throw new DuplicateQuoteIdException(quoteId);
        }
    }

    @Override
    public Optional<QuoteRecord> get(String quoteId) {
        return Optional.ofNullable(quotes.get(quoteId));
    }

    @Override
    public QuoteRecord tryConsume(String quoteId, String ownerId, Instant now) throws QuoteRejectedException {
        Objects.requireNonNull(quoteId, "quoteId");
        Objects.requireNonNull(now, "now");
        AtomicReference<QuoteRejection> rejection = new AtomicReference<>(QuoteRejection.NOT_FOUND);
        AtomicReference<QuoteRecord> claimed = new AtomicReference<>();

        quotes.computeIfPresent(quoteId, (id, record) -> {
            QuoteRejection reason = check(record, ownerId, now);
            if (reason != null) {
                rejection.set(reason);
                return record;
            }
            claimed.set(record);
            return record.markConsumed();
        });

        QuoteRecord record = claimed.get();
        if (record == null) {
            throw new QuoteRejectedException(quoteId, rejection.get());
        }
        return record;
    }

    private static QuoteRejection check(QuoteRecord record, String ownerId, Instant now) {
        if (record.isExpiredAt(now)) {
            return QuoteRejection.EXPIRED;
        }
        if (!record.getOwnerId().equals(ownerId)) {
            return QuoteRejection.OWNER_MISMATCH;
        }
        if (record.isConsumed()) {
            return QuoteRejection.ALREADY_CONSUMED;
        }
        return null;
    }

    @Override
    public int evictExpired(Instant now) {
        int[] removed = {0};
        for (String quoteId : quotes.keySet()) {
            quotes.computeIfPresent(quoteId, (id, record) -> {
                if (record.isExpiredAt(now)) {
                    removed[0]++;
                    return null;
                }
                return record;
            });
        }
        return removed[0];
    }

    @Override
    public int size() {
        return quotes.size();
    }
}
