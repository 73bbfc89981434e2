package com.coinbase.x402quote.client;

import java.util.Objects;

/** Identifies a payment scheme+network pair that a facilitator supports. */
public class Kind {
    public final String scheme;    // e.g. "exact"
    public final String network;   // e.g. "base-sepolia"

    public Kind() {
        this.scheme = null;
        this.network = null;
    }

    public Kind(String scheme, String network) {
        this.scheme = scheme;
        this.network = network;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kind)) return false;
        Kind other = (Kind) o;
        return Objects.equals(scheme, other.scheme) && Objects.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, network);
    }
}
