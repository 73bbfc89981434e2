package com.coinbase.x402quote.quote;

import com.coinbase.x402quote.model.MoneyAmount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/** Issues single-use, time-bounded quotes into a {@link QuoteStore}. */
public class QuoteIssuer {

    private static final Logger logger = LoggerFactory.getLogger(QuoteIssuer.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private final QuoteStore store;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public QuoteIssuer(QuoteStore store, Clock clock) {
        this(store, clock, () -> UUID.randomUUID().toString());
    }

    QuoteIssuer(QuoteStore store, Clock clock, Supplier<String> idGenerator) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Stores a new unconsumed quote for {@code ownerId} that expires {@code ttl} from now.
     * A colliding id is regenerated once; a second collision propagates.
     *
     * @throws DuplicateQuoteIdException if the regenerated id collides as well
     */
    public IssuedQuote issue(MoneyAmount amount, String ownerId, Duration ttl) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(ownerId, "ownerId");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant expiresAt = clock.instant().plus(ttl);
        QuoteRecord record = new QuoteRecord(amount.toString(), ownerId, expiresAt);

        String quoteId = idGenerator.get();
        try {
            store.put(quoteId, record);
        } catch (DuplicateQuoteIdException e) {
            logger.warn("Quote id collision on {}, regenerating", quoteId);
            quoteId = idGenerator.get();
            store.put(quoteId, record);
        }
        logger.debug("Issued quote {} for {} ({}), expires at {}", quoteId, ownerId, record.getAmount(), expiresAt);
        return new IssuedQuote(quoteId, record.getAmount());
    }
}
