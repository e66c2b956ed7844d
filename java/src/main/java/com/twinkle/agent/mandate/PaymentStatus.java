package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PaymentStatus {
    LOCKED, RELEASED, REFUNDED;

    public boolean isTerminal() {
        return this != LOCKED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
