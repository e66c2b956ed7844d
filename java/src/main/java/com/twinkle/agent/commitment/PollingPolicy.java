package com.twinkle.agent.commitment;

import java.time.Duration;

/** Bounded patience for the asynchronous decryption oracle. */
public final class PollingPolicy {

    public static final PollingPolicy DEFAULT = new PollingPolicy(Duration.ofSeconds(1), 15, Duration.ofSeconds(30));

    public final Duration interval;
    public final int maxAttempts;
    public final Duration timeout;

    public PollingPolicy(Duration interval, int maxAttempts, Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (interval.isNegative() || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("interval must be >= 0 and timeout > 0");
        }
        this.interval = interval;
        this.maxAttempts = maxAttempts;
        this.timeout = timeout;
    }
}
