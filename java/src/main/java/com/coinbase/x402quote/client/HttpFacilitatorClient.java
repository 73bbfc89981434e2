package com.coinbase.x402quote.client;

import com.coinbase.x402quote.model.PaymentPayload;
import com.coinbase.x402quote.model.PaymentRequirements;
import com.coinbase.x402quote.util.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** {@link FacilitatorClient} talking JSON over HTTP to a facilitator base URL. */
public class HttpFacilitatorClient implements FacilitatorClient {

    private static final int X402_VERSION = 1;
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final String baseUrl;

    /**
     * @param baseUrl facilitator root, e.g. {@code https://facilitator.x402.rs}; a trailing slash is ignored
     */
    public HttpFacilitatorClient(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
    }

    @Override
    public VerificationResponse verify(PaymentPayload paymentPayload,
                                       PaymentRequirements req)
            throws IOException, InterruptedException {
        String json = post("/verify", body(paymentPayload, req));
        return Json.MAPPER.readValue(json, VerificationResponse.class);
    }

    @Override
    public SettlementResponse settle(PaymentPayload paymentPayload,
                                     PaymentRequirements req)
            throws IOException, InterruptedException {
        String json = post("/settle", body(paymentPayload, req));
        return Json.MAPPER.readValue(json, SettlementResponse.class);
    }

    @Override
    public Set<Kind> supported() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/supported"))
                .timeout(TIMEOUT)
                .GET()
                .build();
        JsonNode root = Json.MAPPER.readTree(send(request));

        Set<Kind> kinds = new HashSet<>();
        JsonNode list = root.get("kinds");
        if (list == null || !list.isArray()) {
            return kinds;
        }
        for (JsonNode node : list) {
            kinds.add(Json.MAPPER.treeToValue(node, Kind.class));
        }
        return kinds;
    }

    private static Map<String, Object> body(PaymentPayload paymentPayload, PaymentRequirements req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("x402Version", X402_VERSION);
        body.put("paymentPayload", paymentPayload);
        body.put("paymentRequirements", req);
        return body;
    }

    private String post(String path, Map<String, Object> body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(Json.MAPPER.writeValueAsBytes(body)))
                .build();
        return send(request);
    }

    private String send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + ": " + response.body());
        }
        return response.body();
    }
}
