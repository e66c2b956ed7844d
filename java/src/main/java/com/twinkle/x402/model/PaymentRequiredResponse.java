package com.twinkle.x402.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** HTTP 402 challenge returned by a pay-per-call provider. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentRequiredResponse {
    public int x402Version;
    public List<PaymentRequirements> accepts = new ArrayList<>();
    public String error;
    public String resource;
    public String description;
}
