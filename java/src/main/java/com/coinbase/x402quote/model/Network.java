package com.coinbase.x402quote.model;

/** Networks with a known USDC deployment. */
public enum Network {
    BASE_SEPOLIA("base-sepolia", "0x036CbD53842c5426634e7929541eC2318f3dCF7e", "USDC"),
    BASE("base", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", "USD Coin");

    private final String id;
    private final String usdcAddress;
    private final String usdcName;   // EIP-712 domain name of the USDC contract

    Network(String id, String usdcAddress, String usdcName) {
        this.id = id;
        this.usdcAddress = usdcAddress;
        this.usdcName = usdcName;
    }

    public String id() {
        return id;
    }

    String usdcAddress() {
        return usdcAddress;
    }

    String usdcName() {
        return usdcName;
    }

    /** Looks a network up by its x402 identifier, e.g. {@code "base-sepolia"}. */
    public static Network fromId(String id) {
        for (Network network : values()) {
            if (network.id.equalsIgnoreCase(id)) {
                return network;
            }
        }
        throw new IllegalArgumentException("Unsupported network: " + id);
    }
}
