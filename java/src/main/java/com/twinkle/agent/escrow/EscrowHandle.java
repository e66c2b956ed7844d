package com.twinkle.agent.escrow;

import java.time.Instant;

public class EscrowHandle {
    public final long escrowId;
    public final String reference;
    public final boolean encrypted;
    public final Instant sentAt;
    public final Instant receivedAt;

    public EscrowHandle(long escrowId, String reference, boolean encrypted, Instant sentAt, Instant receivedAt) {
        this.escrowId = escrowId;
        this.reference = reference;
        this.encrypted = encrypted;
        this.sentAt = sentAt;
        this.receivedAt = receivedAt;
    }
}
