package com.coinbase.examples.quoteserver;

import com.coinbase.x402quote.model.InvalidAmountException;
import com.coinbase.x402quote.model.MoneyAmount;
import com.coinbase.x402quote.model.Network;
import com.coinbase.x402quote.model.TokenDeployment;
import com.coinbase.x402quote.quote.ExpiryReaper;
import com.coinbase.x402quote.quote.QuoteIssuer;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/** Server settings read once from environment variables, with documented defaults. */
public final class QuoteServerConfig {

    static final String DEFAULT_PAY_TO = "0xBAc675C310721717Cd4A37F6cbeA1F081b1C2a07";
    static final Duration MAX_DURATION = Duration.ofDays(1);

    private final int port;
    private final URI baseUrl;
    private final String facilitatorUrl;
    private final Network network;
    private final String payTo;
    private final MoneyAmount nominalPrice;
    private final MoneyAmount unitPrice;
    private final Duration quoteTtl;
    private final Duration reaperPeriod;

    private QuoteServerConfig(int port, URI baseUrl, String facilitatorUrl, Network network, String payTo,
                              MoneyAmount nominalPrice, MoneyAmount unitPrice,
                              Duration quoteTtl, Duration reaperPeriod) {
        this.port = port;
        this.baseUrl = baseUrl;
        this.facilitatorUrl = facilitatorUrl;
        this.network = network;
        this.payTo = payTo;
        this.nominalPrice = nominalPrice;
        this.unitPrice = unitPrice;
        this.quoteTtl = quoteTtl;
        this.reaperPeriod = reaperPeriod;
    }

    /**
     * Reads PORT, BASE_URL, FACILITATOR_URL, NETWORK, PAY_TO, NOMINAL_PRICE, UNIT_PRICE,
     * QUOTE_TTL_SECONDS and REAPER_PERIOD_SECONDS.
     *
     * @throws IllegalArgumentException naming the first malformed variable
     */
    public static QuoteServerConfig fromEnv(Map<String, String> env) {
        long port = number(env, "PORT", 3001);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("PORT out of range: " + port);
        }
        URI baseUrl;
        try {
            baseUrl = URI.create(env.getOrDefault("BASE_URL", "https://localhost:3001/"));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("BASE_URL is not a valid URL", e);
        }
        if (baseUrl.getScheme() == null || baseUrl.getAuthority() == null) {
            throw new IllegalArgumentException("BASE_URL must be absolute: " + baseUrl);
        }
        Network network;
        try {
            network = Network.fromId(env.getOrDefault("NETWORK", Network.BASE_SEPOLIA.id()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("NETWORK: " + e.getMessage(), e);
        }
        int decimals = TokenDeployment.usdc(network).decimals();
        return new QuoteServerConfig(
                (int) port,
                baseUrl,
                env.getOrDefault("FACILITATOR_URL", "https://facilitator.x402.rs"),
                network,
                env.getOrDefault("PAY_TO", DEFAULT_PAY_TO),
                money(env, "NOMINAL_PRICE", "0.01", decimals),
                money(env, "UNIT_PRICE", "0.01", decimals),
                seconds(env, "QUOTE_TTL_SECONDS", QuoteIssuer.DEFAULT_TTL),
                seconds(env, "REAPER_PERIOD_SECONDS", ExpiryReaper.DEFAULT_PERIOD));
    }

    private static long number(Map<String, String> env, String name, long defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static Duration seconds(Map<String, String> env, String name, Duration defaultValue) {
        long seconds = number(env, name, defaultValue.getSeconds());
        if (seconds <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + seconds);
        }
        if (seconds > MAX_DURATION.getSeconds()) {
            throw new IllegalArgumentException(name + " must be at most " + MAX_DURATION.getSeconds() + ": " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    /** Parses a price that the network's token can represent exactly. */
    private static MoneyAmount money(Map<String, String> env, String name, String defaultValue, int decimals) {
        try {
            MoneyAmount amount = MoneyAmount.parse(env.getOrDefault(name, defaultValue));
            amount.toTokenAmount(decimals);
            return amount;
        } catch (InvalidAmountException e) {
            throw new IllegalArgumentException(name + ": " + e.getMessage(), e);
        }
    }

    public int port() { return port; }
    public URI baseUrl() { return baseUrl; }
    public String facilitatorUrl() { return facilitatorUrl; }
    public Network network() { return network; }
    public String payTo() { return payTo; }
    public MoneyAmount nominalPrice() { return nominalPrice; }
    public MoneyAmount unitPrice() { return unitPrice; }
    public Duration quoteTtl() { return quoteTtl; }
    public Duration reaperPeriod() { return reaperPeriod; }
}
