package com.twinkle.agent.commitment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/** Immutable record of one commitment made during a run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommitmentResult {
    public final Layer layer;
    public final String txHash;
    public final boolean encrypted;
    public final Instant sentAt;
    public final Instant receivedAt;
    public final Instant decryptedAt;
    public final String dataPreview;

    /** Null for commitments that are not read back (escrow creation). */
    public final Boolean verified;

    public CommitmentResult(Layer layer, String txHash, boolean encrypted, Instant sentAt, Instant receivedAt,
                            Instant decryptedAt, String dataPreview, Boolean verified) {
        this.layer = layer;
        this.txHash = txHash;
        this.encrypted = encrypted;
        this.sentAt = sentAt;
        this.receivedAt = receivedAt;
        this.decryptedAt = decryptedAt;
        this.dataPreview = dataPreview;
        this.verified = verified;
    }

    @JsonIgnore
    public boolean isVerified() {
        return Boolean.TRUE.equals(verified);
    }

    /** Commit-to-decrypt latency, or commit-to-receipt when never decrypted. */
    public long roundTripMillis() {
        if (sentAt == null) {
            return 0;
        }
        Instant end = decryptedAt != null ? decryptedAt : receivedAt;
        return end == null ? 0 : Duration.between(sentAt, end).toMillis();
    }
}
