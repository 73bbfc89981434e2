package com.coinbase.x402quote.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class TokenDeploymentTest {

    private static final String PAY_TO = "0xBAc675C310721717Cd4A37F6cbeA1F081b1C2a07";

    @Test
    void usdcTemplateCarriesNominalAmountInBaseUnits() {
        PaymentRequirementsTemplate template = TokenDeployment.usdc(Network.BASE_SEPOLIA)
                .template(PAY_TO, MoneyAmount.parse("0.01"));

        assertEquals("exact", template.getScheme());
        assertEquals("base-sepolia", template.getNetwork());
        assertEquals("10000", template.getMaxAmountRequired());
        assertEquals("0x036CbD53842c5426634e7929541eC2318f3dCF7e", template.getAsset());
        assertEquals(6, template.getAssetDecimals());
    }

    @Test
    void requirementsAreIndependentCopies() {
        PaymentRequirementsTemplate template = TokenDeployment.usdc(Network.BASE)
                .template(PAY_TO, MoneyAmount.parse("0.01"))
                .withMimeType("application/json");
        URI resource = URI.create("https://example.com/resource");

        PaymentRequirements first = template.toPaymentRequirements(resource);
        first.maxAmountRequired = "1";
        first.extra.put("name", "changed");
        PaymentRequirements second = template.toPaymentRequirements(resource);

        assertEquals("10000", second.maxAmountRequired);
        assertEquals("USD Coin", second.extra.get("name"));
        assertEquals("application/json", second.mimeType);
        assertEquals("https://example.com/resource", second.resource);
    }

    @Test
    void networkLookupByWireId() {
        assertEquals(Network.BASE_SEPOLIA, Network.fromId("base-sepolia"));
        assertThrows(IllegalArgumentException.class, () -> Network.fromId("solana"));
    }
}
