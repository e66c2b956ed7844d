package com.twinkle.x402.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinkle.x402.crypto.CryptoSigner;
import com.twinkle.x402.crypto.Hashes;
import com.twinkle.x402.model.PaymentPayload;
import com.twinkle.x402.model.PaymentRequiredResponse;
import com.twinkle.x402.model.PaymentRequirements;
import com.twinkle.x402.model.SettlementResponseHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Synchronous x402 purchase client built on Java 11 {@link HttpClient}.
 *
 * <ul>
 *   <li>{@code GET endpoint?q=query}: 200 is a free delivery</li>
 *   <li>402: requirements are read from the {@code PAYMENT-REQUIRED} header (v2) or the body (v1),
 *       an authorization is signed and the request is retried with the payment header</li>
 *   <li>any other status raises {@link IOException} carrying the status and body</li>
 * </ul>
 */
public class HttpPurchaseClient implements PurchaseClient {

    private static final Logger log = LoggerFactory.getLogger(HttpPurchaseClient.class);

    static final String PAYMENT_REQUIRED_HEADER = "PAYMENT-REQUIRED";
    static final String PAYMENT_HEADER_V1 = "X-PAYMENT";
    static final String PAYMENT_HEADER_V2 = "PAYMENT-SIGNATURE";
    static final String PAYMENT_RESPONSE_HEADER_V1 = "X-PAYMENT-RESPONSE";
    static final String PAYMENT_RESPONSE_HEADER_V2 = "PAYMENT-RESPONSE";

    private static final int DEFAULT_VALIDITY_SECONDS = 300;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpPurchaseClient() {
        this(Duration.ofSeconds(30));
    }

    public HttpPurchaseClient(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), timeout);
    }

    public HttpPurchaseClient(HttpClient http, ObjectMapper mapper, Duration timeout) {
        this.http = http;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public PurchaseResult purchase(String endpoint, String query, CryptoSigner payer)
            throws IOException, InterruptedException {
        URI uri = queryUri(endpoint, query);
        HttpResponse<String> first = http.send(get(uri).build(), HttpResponse.BodyHandlers.ofString());

        if (first.statusCode() == 200) {
            return PurchaseResult.free(readJson(first.body()));
        }
        if (first.statusCode() != 402) {
            throw new IOException("HTTP " + first.statusCode() + ": " + truncate(first.body()));
        }
        if (payer == null) {
            throw new IOException("HTTP 402 from " + endpoint + " but no payer credential is configured");
        }

        PaymentRequiredResponse challenge = parseChallenge(first);
        if (challenge.accepts == null || challenge.accepts.isEmpty()) {
            throw new IOException("Could not parse payment requirements from 402 response");
        }
        PaymentRequirements req = challenge.accepts.get(0);
        int version = challenge.x402Version > 0 ? challenge.x402Version : 1;

        PaymentPayload payment = sign(version, req, payer);
        String header = Base64.getEncoder().encodeToString(mapper.writeValueAsBytes(payment));
        log.debug("Paying {} {} on {} for {}", req.requestedAmount(), req.asset, req.network, endpoint);

        HttpResponse<String> paid = http.send(
                get(uri).header(PAYMENT_HEADER_V1, header).header(PAYMENT_HEADER_V2, header).build(),
                HttpResponse.BodyHandlers.ofString());
        if (paid.statusCode() != 200) {
            throw new IOException("Payment accepted but data fetch failed: HTTP "
                    + paid.statusCode() + ": " + truncate(paid.body()));
        }

        SettlementResponseHeader settlement = settlementHeader(paid).orElse(null);
        String cost = req.requestedAmount() != null ? req.requestedAmount() : "unknown";
        return new PurchaseResult(readJson(paid.body()), cost, true, settlement);
    }

    /* ------------------------------------------------------------------ */

    private PaymentPayload sign(int version, PaymentRequirements req, CryptoSigner payer) {
        long now = Instant.now().getEpochSecond();
        int validity = req.maxTimeoutSeconds != null ? req.maxTimeoutSeconds : DEFAULT_VALIDITY_SECONDS;

        Map<String, Object> authorization = new LinkedHashMap<>();
        authorization.put("from", payer.address());
        authorization.put("to", req.payTo);
        authorization.put("value", req.requestedAmount());
        authorization.put("validAfter", String.valueOf(now - 600));
        authorization.put("validBefore", String.valueOf(now + validity));
        authorization.put("nonce", Hashes.randomNonce());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("signature", payer.sign(authorization));
        body.put("authorization", authorization);
        return new PaymentPayload(version, req, body);
    }

    private PaymentRequiredResponse parseChallenge(HttpResponse<String> resp) throws IOException {
        Optional<String> encoded = resp.headers().firstValue(PAYMENT_REQUIRED_HEADER);
        if (encoded.isPresent()) {
            return mapper.readValue(Base64.getDecoder().decode(encoded.get()), PaymentRequiredResponse.class);
        }
        try {
            return mapper.readValue(resp.body(), PaymentRequiredResponse.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Could not parse payment requirements from 402 response", e);
        }
    }

    private Optional<SettlementResponseHeader> settlementHeader(HttpResponse<String> resp) throws IOException {
        Optional<String> encoded = resp.headers().firstValue(PAYMENT_RESPONSE_HEADER_V2)
                .or(() -> resp.headers().firstValue(PAYMENT_RESPONSE_HEADER_V1));
        if (encoded.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Base64.getDecoder().decode(encoded.get()),
                SettlementResponseHeader.class));
    }

    private JsonNode readJson(String body) throws IOException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IOException("Provider returned a non-JSON body: " + truncate(body), e);
        }
    }

    private HttpRequest.Builder get(URI uri) {
        return HttpRequest.newBuilder(uri).timeout(timeout).header("Accept", "application/json").GET();
    }

    private static URI queryUri(String endpoint, String query) {
        String sep = endpoint.contains("?") ? "&" : "?";
        return URI.create(endpoint + sep + "q=" + URLEncoder.encode(query, StandardCharsets.UTF_8));
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
