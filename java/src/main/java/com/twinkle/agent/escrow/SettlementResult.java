package com.twinkle.agent.escrow;

public class SettlementResult {
    public final long escrowId;
    public final SettlementOutcome outcome;
    public final String reference;

    /** False when a pay request was downgraded because the delivery proof did not match. */
    public final boolean proofMatched;

    public SettlementResult(long escrowId, SettlementOutcome outcome, String reference, boolean proofMatched) {
        this.escrowId = escrowId;
        this.outcome = outcome;
        this.reference = reference;
        this.proofMatched = proofMatched;
    }
}
