package com.coinbase.x402quote.model;

import java.util.Map;

/** A token contract on a network, used to build payment requirement templates. */
public final class TokenDeployment {
    private static final int USDC_DECIMALS = 6;

    private final Network network;
    private final String address;
    private final int decimals;
    private final Map<String, Object> eip712Domain;

    private TokenDeployment(Network network, String address, int decimals, Map<String, Object> eip712Domain) {
        this.network = network;
        this.address = address;
        this.decimals = decimals;
        this.eip712Domain = eip712Domain;
    }

    public static TokenDeployment usdc(Network network) {
        return new TokenDeployment(network, network.usdcAddress(), USDC_DECIMALS,
                Map.of("name", network.usdcName(), "version", "2"));
    }

    public Network network() {
        return network;
    }

    public String address() {
        return address;
    }

    public int decimals() {
        return decimals;
    }

    /**
     * Builds an "exact" scheme template paying {@code payTo}, priced at {@code nominal}
     * until a quote replaces the amount.
     */
    public PaymentRequirementsTemplate template(String payTo, MoneyAmount nominal) {
        return new PaymentRequirementsTemplate(
                PaymentRequirementsTemplate.EXACT_SCHEME,
                network.id(),
                nominal.toTokenAmount(decimals),
                payTo,
                address,
                decimals,
                eip712Domain,
                null,
                null,
                PaymentRequirementsTemplate.DEFAULT_MAX_TIMEOUT_SECONDS);
    }
}
