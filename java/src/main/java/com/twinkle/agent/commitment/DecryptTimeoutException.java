package com.twinkle.agent.commitment;

import com.twinkle.agent.TwinkleException;

public class DecryptTimeoutException extends TwinkleException {
    private final String reference;

    public DecryptTimeoutException(String reference, int attempts, long elapsedMillis, Throwable lastError) {
        super("Decrypt timeout after " + attempts + " attempt(s) / " + elapsedMillis + "ms for " + reference,
                lastError);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
