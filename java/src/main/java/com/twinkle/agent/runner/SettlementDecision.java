package com.twinkle.agent.runner;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Quality-gate verdict for one escrow, committed in the settlement batch. */
public class SettlementDecision {

    public enum Action {
        PAY, REFUND;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public final long escrowId;
    public final Action action;
    public final double score;

    public SettlementDecision(long escrowId, Action action, double score) {
        this.escrowId = escrowId;
        this.action = action;
        this.score = score;
    }
}
