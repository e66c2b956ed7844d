package com.twinkle.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Signed payment authorization sent back to the provider on the retry request.
 * Base64-encoded JSON of this object travels in the payment header.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentPayload {
    public int x402Version;
    public String scheme;
    public String network;

    /** Scheme payload: {@code signature} plus the {@code authorization} that was signed. */
    public Map<String, Object> payload;

    /** Requirements this payment answers (v2 echoes them back). */
    public PaymentRequirements accepted;

    public PaymentPayload() {}

    public PaymentPayload(int x402Version, PaymentRequirements accepted, Map<String, Object> payload) {
        this.x402Version = x402Version;
        this.scheme = accepted.scheme;
        this.network = accepted.network;
        this.accepted = x402Version >= 2 ? accepted : null;
        this.payload = payload;
    }
}
