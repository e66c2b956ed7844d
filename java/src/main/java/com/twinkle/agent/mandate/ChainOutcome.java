package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChainOutcome {
    SUCCESS, FAILURE, EXPIRED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
