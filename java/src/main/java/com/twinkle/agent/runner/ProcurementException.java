package com.twinkle.agent.runner;

import com.twinkle.agent.TwinkleException;

/** A run aborted on a failure in a correctness-critical step (ledger, registry). */
public class ProcurementException extends TwinkleException {
    public ProcurementException(String message, Throwable cause) {
        super(message, cause);
    }
}
