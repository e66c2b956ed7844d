package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Funds locked for one cart. The status moves once, from {@code locked} to
 * {@code released} or {@code refunded}; nothing else on the mandate changes.
 */
public final class PaymentMandate extends Mandate {
    public final String escrowId;
    public final String txHash;
    public final Amount amount;
    public final String provider;
    public final String x402Cost;

    private PaymentStatus status = PaymentStatus.LOCKED;
    private String settlementTxHash;

    PaymentMandate(String id, Instant timestamp, String cartId, String escrowId, String txHash,
                   Amount amount, String provider, String x402Cost) {
        super(id, MandateType.PAYMENT, timestamp, cartId);
        this.escrowId = escrowId;
        this.txHash = txHash;
        this.amount = amount;
        this.provider = provider;
        this.x402Cost = x402Cost;
    }

    @JsonProperty
    public synchronized PaymentStatus status() {
        return status;
    }

    @JsonProperty
    public synchronized String settlementTxHash() {
        return settlementTxHash;
    }

    /** @return false when the payment had already left {@code locked} */
    synchronized boolean settle(PaymentStatus outcome, String reference) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("settlement outcome must be released or refunded");
        }
        if (status.isTerminal()) {
            return false;
        }
        status = outcome;
        settlementTxHash = reference;
        return true;
    }
}
