package com.coinbase.x402quote.client;

import com.coinbase.x402quote.model.PaymentPayload;
import com.coinbase.x402quote.model.PaymentRequirements;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.*;
import static com.github.tomakehurst.wiremock.client.WireMock.*;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HttpFacilitatorClientTest {

    static WireMockServer wm;
    HttpFacilitatorClient client;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);   // random port
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        client = new HttpFacilitatorClient("http://localhost:" + wm.port());
    }

    private PaymentPayload payload() {
        PaymentPayload payload = new PaymentPayload();
        payload.x402Version = 1;
        payload.scheme = "exact";
        payload.network = "base-sepolia";
        payload.payload = Map.of(
            "signature", "0xtest",
            "authorization", Map.of(
                "from", "0xPayer",
                "to", "0xReceiver",
                "value", "50000"
            )
        );
        return payload;
    }

    /** Requirements as finalized from a "0.05" quote on a 6 decimal token. */
    private PaymentRequirements quotedRequirements() {
        PaymentRequirements req = new PaymentRequirements();
        req.scheme = "exact";
        req.network = "base-sepolia";
        req.maxAmountRequired = "50000";
        req.resource = "https://localhost:3001/resource";
        req.payTo = "0xReceiver";
        req.asset = "0x036CbD53842c5426634e7929541eC2318f3dCF7e";
        return req;
    }

    @Test
    void constructorHandlesTrailingSlash() {
        HttpFacilitatorClient clientWithTrailingSlash =
            new HttpFacilitatorClient("http://localhost:" + wm.port() + "/");

        wm.stubFor(get(urlEqualTo("/supported"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"kinds\":[]}")));

        assertDoesNotThrow(() -> clientWithTrailingSlash.supported());
    }

    @Test
    void verifySendsQuotedRequirements() throws Exception {
        wm.stubFor(post(urlEqualTo("/verify"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"isValid\":true,\"payer\":\"0xPayer\"}")));

        VerificationResponse vr = client.verify(payload(), quotedRequirements());
        assertTrue(vr.isValid);
        assertEquals("0xPayer", vr.payer);

        wm.verify(postRequestedFor(urlEqualTo("/verify"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(matchingJsonPath("$.x402Version", equalTo("1")))
            .withRequestBody(matchingJsonPath("$.paymentRequirements.maxAmountRequired", equalTo("50000")))
            .withRequestBody(matchingJsonPath("$.paymentRequirements.resource",
                equalTo("https://localhost:3001/resource")))
            .withRequestBody(matchingJsonPath("$.paymentPayload.network", equalTo("base-sepolia"))));
    }

    @Test
    void settleHappyPath() throws Exception {
        wm.stubFor(post(urlEqualTo("/settle"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"success\":true,\"transaction\":\"0xabc\",\"network\":\"base-sepolia\",\"payer\":\"0xPayer\"}")));

        SettlementResponse sr = client.settle(payload(), quotedRequirements());
        assertTrue(sr.success);
        assertEquals("0xabc", sr.transaction);
        assertEquals("base-sepolia", sr.network);
        assertEquals("0xPayer", sr.toHeader().payer);
    }

    @Test
    void supportedEndpoint() throws Exception {
        wm.stubFor(get(urlEqualTo("/supported"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"kinds\":[{\"x402Version\":1,\"scheme\":\"exact\",\"network\":\"base-sepolia\"}]}")));

        Set<Kind> kinds = client.supported();
        assertEquals(Set.of(new Kind("exact", "base-sepolia")), kinds);
    }

    @Test
    void supportedEndpointWithMissingKinds() throws Exception {
        wm.stubFor(get(urlEqualTo("/supported"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"otherField\":123}")));

        assertTrue(client.supported().isEmpty());
    }

    @Test
    void verifyReportsInvalidReason() throws Exception {
        wm.stubFor(post(urlEqualTo("/verify"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"isValid\":false,\"invalidReason\":\"insufficient_funds\"}")));

        VerificationResponse response = client.verify(payload(), quotedRequirements());

        assertFalse(response.isValid);
        assertEquals("insufficient_funds", response.invalidReason);
    }

    @Test
    void settleWithError() throws Exception {
        wm.stubFor(post(urlEqualTo("/settle"))
            .willReturn(aResponse()
                .withHeader("Content-Type","application/json")
                .withBody("{\"success\":false,\"errorReason\":\"invalid_transaction_state\"}")));

        SettlementResponse response = client.settle(payload(), quotedRequirements());

        assertFalse(response.success);
        assertEquals("invalid_transaction_state", response.errorReason);
        assertNull(response.transaction);
    }

    @Test
    void unreachableFacilitatorThrows() {
        HttpFacilitatorClient badClient = new HttpFacilitatorClient("http://localhost:1");

        assertThrows(Exception.class, () -> badClient.verify(payload(), quotedRequirements()));
        assertThrows(Exception.class, () -> badClient.settle(payload(), quotedRequirements()));
        assertThrows(Exception.class, () -> badClient.supported());
    }

    @Test
    void verifyRejectsNon200Status() {
        wm.stubFor(post(urlEqualTo("/verify"))
            .willReturn(aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"isValid\":true}")));

        Exception ex = assertThrows(Exception.class, () -> client.verify(payload(), quotedRequirements()));
        assertTrue(ex.getMessage().contains("HTTP 201"));
    }

    @Test
    void settleRejectsNon200Status() {
        wm.stubFor(post(urlEqualTo("/settle"))
            .willReturn(aResponse()
                .withStatus(404)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"error\":\"not found\"}")));

        Exception ex = assertThrows(Exception.class, () -> client.settle(payload(), quotedRequirements()));
        assertTrue(ex.getMessage().contains("HTTP 404"));
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void supportedRejectsNon200Status() {
        wm.stubFor(get(urlEqualTo("/supported"))
            .willReturn(aResponse()
                .withStatus(500)
                .withBody("{\"error\":\"internal server error\"}")));

        Exception ex = assertThrows(Exception.class, () -> client.supported());
        assertTrue(ex.getMessage().contains("HTTP 500"));
    }
}
