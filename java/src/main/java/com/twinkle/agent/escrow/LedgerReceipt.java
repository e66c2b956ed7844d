package com.twinkle.agent.escrow;

import java.time.Instant;

/** Ledger answer to an escrow creation: the new id and the creating transaction. */
public class LedgerReceipt {
    public final long escrowId;
    public final String txHash;
    public final Instant sentAt;
    public final Instant receivedAt;

    public LedgerReceipt(long escrowId, String txHash, Instant sentAt, Instant receivedAt) {
        this.escrowId = escrowId;
        this.txHash = txHash;
        this.sentAt = sentAt;
        this.receivedAt = receivedAt;
    }
}
