package com.twinkle.agent.oracle;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Sensitivity {
    HIGH, MEDIUM, LOW;

    static Sensitivity parse(String value, Sensitivity fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
