package com.coinbase.x402quote.quote;

import java.time.Instant;
import java.util.Optional;

/**
 * Owner of all issued quotes. Implementations must make {@link #tryConsume} atomic per
 * quote id: of any number of concurrent calls for the same quote, at most one succeeds.
 */
public interface QuoteStore {

    /**
     * Inserts a new quote.
     *
     * @throws DuplicateQuoteIdException if {@code quoteId} is already present
     */
    void put(String quoteId, QuoteRecord record);

    /** Read-only snapshot lookup. */
    Optional<QuoteRecord> get(String quoteId);

    /**
     * Validates and consumes a quote in one step. Checks, in order: the quote exists,
     * {@code now} is before its expiry, {@code ownerId} matches, and it was not consumed yet.
     *
     * @return the record as it was before consumption
     * @throws QuoteRejectedException carrying the first failed check
     */
    QuoteRecord tryConsume(String quoteId, String ownerId, Instant now) throws QuoteRejectedException;

    /**
     * Removes every quote whose expiry is at or before {@code now}, consumed or not.
     *
     * @return number of quotes removed
     */
    int evictExpired(Instant now);

    int size();
}
