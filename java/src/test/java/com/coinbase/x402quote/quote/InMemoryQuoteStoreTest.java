package com.coinbase.x402quote.quote;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryQuoteStoreTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_000);
    private static final Instant EXPIRY = T0.plusSeconds(300);

    private InMemoryQuoteStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryQuoteStore();
    }

    @Test
    void putRejectsDuplicateIds() {
        store.put("q1", new QuoteRecord("0.01", "c1", EXPIRY));

        DuplicateQuoteIdException e = assertThrows(DuplicateQuoteIdException.class,
                () -> store.put("q1", new QuoteRecord("0.02", "c2", EXPIRY)));
        assertEquals("q1", e.getQuoteId());
        assertEquals("0.01", store.get("q1").orElseThrow().getAmount());
    }

    @Test
    void getDoesNotMutate() {
        store.put("q1", new QuoteRecord("0.01", "c1", EXPIRY));

        assertFalse(store.get("q1").orElseThrow().isConsumed());
        assertFalse(store.get("q1").orElseThrow().isConsumed());
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    void consumeReturnsRecordBeforeConsumption() throws Exception {
        store.put("q1", new QuoteRecord("0.05", "c1", EXPIRY));

        QuoteRecord consumed = store.tryConsume("q1", "c1", T0.plusSeconds(1));

        assertEquals("0.05", consumed.getAmount());
        assertFalse(consumed.isConsumed());
        assertTrue(store.get("q1").orElseThrow().isConsumed());
    }

    @Test
    void unknownQuoteIsNotFound() {
        assertRejected(QuoteRejection.NOT_FOUND, "nope", "c1", T0);
    }

    @Test
    void secondConsumeIsAlreadyConsumed() throws Exception {
        store.put("q1", new QuoteRecord("0.05", "c1", EXPIRY));
        store.tryConsume("q1", "c1", T0);

        assertRejected(QuoteRejection.ALREADY_CONSUMED, "q1", "c1", T0.plusSeconds(1));
    }

    @Test
    void quoteIsBoundToItsOwner() {
        store.put("q1", new QuoteRecord("0.05", "alice", EXPIRY));

        assertRejected(QuoteRejection.OWNER_MISMATCH, "q1", "bob", T0);
        assertFalse(store.get("q1").orElseThrow().isConsumed());
    }

    @Test
    void quoteExpiresAtItsExpiryInstant() throws Exception {
        store.put("q1", new QuoteRecord("0.05", "c1", EXPIRY));

        assertRejected(QuoteRejection.EXPIRED, "q1", "c1", EXPIRY);
        assertRejected(QuoteRejection.EXPIRED, "q1", "c1", EXPIRY.plusSeconds(100));

        assertEquals("0.05", store.tryConsume("q1", "c1", EXPIRY.minusMillis(1)).getAmount());
    }

    @Test
    void expiryIsCheckedBeforeOwnerAndConsumption() throws Exception {
        store.put("q1", new QuoteRecord("0.05", "c1", EXPIRY));
        store.tryConsume("q1", "c1", T0);

        assertRejected(QuoteRejection.EXPIRED, "q1", "someone-else", EXPIRY);
        assertRejected(QuoteRejection.OWNER_MISMATCH, "q1", "someone-else", T0);
    }

    @Test
    void evictRemovesAllAndOnlyExpiredRecords() throws Exception {
        store.put("old", new QuoteRecord("0.01", "c1", T0.plusSeconds(10)));
        store.put("old-used", new QuoteRecord("0.01", "c1", T0.plusSeconds(10)));
        store.put("edge", new QuoteRecord("0.01", "c1", T0.plusSeconds(20)));
        store.put("fresh", new QuoteRecord("0.01", "c1", T0.plusSeconds(300)));
        store.tryConsume("old-used", "c1", T0);

        assertEquals(3, store.evictExpired(T0.plusSeconds(20)));

        assertEquals(1, store.size());
        assertTrue(store.get("fresh").isPresent());
    }

    @Test
    void repeatedEvictionConverges() {
        store.put("a", new QuoteRecord("0.01", "c1", T0.plusSeconds(10)));
        store.put("b", new QuoteRecord("0.01", "c1", T0.plusSeconds(500)));
        Instant now = T0.plusSeconds(100);

        assertEquals(1, store.evictExpired(now));
        assertEquals(0, store.evictExpired(now));
        assertEquals(0, store.evictExpired(now));
        assertEquals(1, store.size());
    }

    @Test
    void evictOnEmptyStoreIsNoOp() {
        assertEquals(0, store.evictExpired(T0));
        assertEquals(0, store.size());
    }

    private void assertRejected(QuoteRejection expected, String quoteId, String ownerId, Instant now) {
        QuoteRejectedException e = assertThrows(QuoteRejectedException.class,
                () -> store.tryConsume(quoteId, ownerId, now));
        assertEquals(expected, e.getReason());
        assertEquals(quoteId, e.getQuoteId());
    }
}
