package com.twinkle.agent.commitment;

import java.time.Instant;

public class VerificationResult {
    public final boolean verified;
    public final String observedPayload;
    public final Instant decryptedAt;
    public final int attempts;

    public VerificationResult(boolean verified, String observedPayload, Instant decryptedAt, int attempts) {
        this.verified = verified;
        this.observedPayload = observedPayload;
        this.decryptedAt = decryptedAt;
        this.attempts = attempts;
    }
}
