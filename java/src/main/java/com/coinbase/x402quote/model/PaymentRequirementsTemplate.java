package com.coinbase.x402quote.model;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payment requirements of a protected route without the resource URL.
 * Immutable; {@link #toPaymentRequirements(URI)} yields a fresh, mutable wire object per request.
 */
public final class PaymentRequirementsTemplate {
    public static final String EXACT_SCHEME = "exact";
    public static final int DEFAULT_MAX_TIMEOUT_SECONDS = 60;

    private final String scheme;
    private final String network;
    private final String maxAmountRequired;
    private final String payTo;
    private final String asset;
    private final int assetDecimals;
    private final Map<String, Object> extra;
    private final String description;
    private final String mimeType;
    private final int maxTimeoutSeconds;

    public PaymentRequirementsTemplate(String scheme,
                                       String network,
                                       String maxAmountRequired,
                                       String payTo,
                                       String asset,
                                       int assetDecimals,
                                       Map<String, Object> extra,
                                       String description,
                                       String mimeType,
                                       int maxTimeoutSeconds) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.network = Objects.requireNonNull(network, "network");
        this.maxAmountRequired = Objects.requireNonNull(maxAmountRequired, "maxAmountRequired");
        this.payTo = Objects.requireNonNull(payTo, "payTo");
        this.asset = Objects.requireNonNull(asset, "asset");
        this.assetDecimals = assetDecimals;
        this.extra = extra == null ? Map.of() : Map.copyOf(extra);
        this.description = description;
        this.mimeType = mimeType;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
    }

    public PaymentRequirementsTemplate withDescription(String description) {
        return new PaymentRequirementsTemplate(scheme, network, maxAmountRequired, payTo, asset,
                assetDecimals, extra, description, mimeType, maxTimeoutSeconds);
    }

    public PaymentRequirementsTemplate withMimeType(String mimeType) {
        return new PaymentRequirementsTemplate(scheme, network, maxAmountRequired, payTo, asset,
                assetDecimals, extra, description, mimeType, maxTimeoutSeconds);
    }

    public PaymentRequirementsTemplate withMaxTimeoutSeconds(int maxTimeoutSeconds) {
        return new PaymentRequirementsTemplate(scheme, network, maxAmountRequired, payTo, asset,
                assetDecimals, extra, description, mimeType, maxTimeoutSeconds);
    }

    /** Nominal requirements for {@code resource}. */
    public PaymentRequirements toPaymentRequirements(URI resource) {
        PaymentRequirements req = new PaymentRequirements();
        req.scheme = scheme;
        req.network = network;
        req.maxAmountRequired = maxAmountRequired;
        req.resource = resource.toString();
        req.description = description == null ? "" : description;
        req.mimeType = mimeType == null ? "" : mimeType;
        req.payTo = payTo;
        req.maxTimeoutSeconds = maxTimeoutSeconds;
        req.asset = asset;
        req.extra = extra.isEmpty() ? null : new LinkedHashMap<>(extra);
        return req;
    }

    public String getScheme() { return scheme; }
    public String getNetwork() { return network; }
    public String getMaxAmountRequired() { return maxAmountRequired; }
    public String getPayTo() { return payTo; }
    public String getAsset() { return asset; }
    public int getAssetDecimals() { return assetDecimals; }
}
