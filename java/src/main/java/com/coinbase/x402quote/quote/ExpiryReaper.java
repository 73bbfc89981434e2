package com.coinbase.x402quote.quote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Periodically removes expired quotes from a {@link QuoteStore} on a daemon thread. */
public class ExpiryReaper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExpiryReaper.class);

    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(60);

    private final QuoteStore store;
    private final Clock clock;
    private final Duration period;
    private final ScheduledExecutorService scheduler;
    private boolean started;

    public ExpiryReaper(QuoteStore store, Clock clock, Duration period) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.period = period;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "x402-quote-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    /** Schedules {@link #sweep()} every period, the first run one period from now. */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Reaper already started");
        }
        started = true;
        long periodMs = period.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Quote reaper running every {}", period);
    }

    /** Runs one eviction pass now. */
    public int sweep() {
        Instant now = clock.instant();
        int removed = store.evictExpired(now);
        if (removed > 0) {
            logger.debug("Evicted {} expired quotes, {} remaining", removed, store.size());
        }
        return removed;
    }

    // an exception escaping a scheduled task would cancel all later runs
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            logger.warn("Quote eviction failed", e);
        }
    }

    public synchronized boolean isRunning() {
        return started && !scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Quote reaper did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
