package com.twinkle.agent.escrow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SettlementOutcome {
    PAID, REFUNDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
