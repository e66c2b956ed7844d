package com.twinkle.x402.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Settlement confirmation a provider returns base64-encoded in the payment response header
 * once the facilitator has settled the buyer's authorization.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettlementResponseHeader {
    /** Whether the settlement was successful. */
    public boolean success;

    /** Transaction hash of the settled payment. */
    public String transaction;

    /** Network the settlement happened on. */
    public String network;

    /** Wallet address that paid (can be null). */
    public String payer;

    /** Facilitator's reason when {@code success} is false. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String errorReason;

    /** Default constructor for Jackson. */
    public SettlementResponseHeader() {}

    public SettlementResponseHeader(boolean success, String transaction, String network, String payer) {
        this.success = success;
        this.transaction = transaction;
        this.network = network;
        this.payer = payer;
    }
}
