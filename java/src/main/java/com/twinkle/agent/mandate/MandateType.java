package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MandateType {
    INTENT, CART, PAYMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
