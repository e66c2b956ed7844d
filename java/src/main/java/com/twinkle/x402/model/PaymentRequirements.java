package com.twinkle.x402.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/** One acceptable way to pay for a provider endpoint, as advertised in a 402 challenge. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentRequirements {
    public String scheme;              // e.g. "exact"
    public String network;             // e.g. "eip155:103698795"
    public String maxAmountRequired;   // v1: atomic units
    public String amount;              // v2: atomic units
    public String payTo;               // provider wallet
    public String asset;               // token contract address
    public Integer maxTimeoutSeconds;
    public Map<String, Object> extra;  // scheme-specific, e.g. EIP-712 domain name/version

    /** Amount the provider asks for, whichever protocol version announced it. */
    public String requestedAmount() {
        if (amount != null && !amount.isBlank()) {
            return amount;
        }
        return maxAmountRequired;
    }
}
