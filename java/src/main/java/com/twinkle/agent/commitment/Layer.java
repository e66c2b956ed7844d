package com.twinkle.agent.commitment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Checkpoints of a run at which confidentiality can be applied. */
public enum Layer {
    STRATEGY, ESCROW, QUERY, SETTLEMENT;

    public static Set<Layer> all() {
        return EnumSet.allOf(Layer.class);
    }

    public static Optional<Layer> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Layer layer : values()) {
            if (layer.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
