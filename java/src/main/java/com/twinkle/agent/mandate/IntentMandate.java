package com.twinkle.agent.mandate;

import java.time.Instant;
import java.util.List;

/** Root of a chain: what the buyer wants and what it may spend. */
public final class IntentMandate extends Mandate {
    public final String description;
    public final Amount budget;
    public final long ttlSeconds;
    public final Instant expiresAt;
    public final List<String> allowedProviders;

    IntentMandate(String id, Instant timestamp, String description, Amount budget,
                  long ttlSeconds, List<String> allowedProviders) {
        super(id, MandateType.INTENT, timestamp, null);
        this.description = description;
        this.budget = budget;
        this.ttlSeconds = ttlSeconds;
        this.expiresAt = timestamp.plusSeconds(ttlSeconds);
        this.allowedProviders = allowedProviders == null ? null : List.copyOf(allowedProviders);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
