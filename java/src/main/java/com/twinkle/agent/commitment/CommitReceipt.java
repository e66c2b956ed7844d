package com.twinkle.agent.commitment;

import java.time.Instant;

/** What the commitment primitive reports for one encrypted commit transaction. */
public class CommitReceipt {
    public final String reference;
    public final boolean success;
    public final Instant sentAt;
    public final Instant receivedAt;

    public CommitReceipt(String reference, boolean success, Instant sentAt, Instant receivedAt) {
        this.reference = reference;
        this.success = success;
        this.sentAt = sentAt;
        this.receivedAt = receivedAt;
    }
}
