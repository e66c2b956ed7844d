package com.twinkle.agent.oracle;

import com.twinkle.agent.commitment.Layer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Layers a run encrypts, after sanitizing the policy oracle's advice. */
public final class EncryptionDecision {

    static final String DEFAULT_REASONING = "Full encryption applied for maximum privacy.";
    static final List<String> DEFAULT_THREATS = List.of("Strategy front-running", "Provider collusion");

    public final Set<Layer> layers;
    public final String reasoning;
    public final List<String> threatModel;
    public final Sensitivity sensitivityLevel;

    public EncryptionDecision(Set<Layer> layers, String reasoning, List<String> threatModel,
                              Sensitivity sensitivityLevel) {
        this.layers = Collections.unmodifiableSet(layers.isEmpty() ? Layer.all() : EnumSet.copyOf(layers));
        this.reasoning = reasoning;
        this.threatModel = List.copyOf(threatModel);
        this.sensitivityLevel = sensitivityLevel;
    }

    /** Every layer on, used whenever the oracle is unavailable. */
    public static EncryptionDecision allLayers() {
        return new EncryptionDecision(Layer.all(), DEFAULT_REASONING, DEFAULT_THREATS, Sensitivity.HIGH);
    }

    /**
     * Keeps the recognised layer names of {@code advice}; no recognised layer means all four.
     * Missing fields take the full-encryption defaults.
     */
    public static EncryptionDecision from(EncryptionAdvice advice) {
        if (advice == null) {
            return allLayers();
        }
        Set<Layer> layers = EnumSet.noneOf(Layer.class);
        if (advice.layers != null) {
            for (String name : advice.layers) {
                Layer.parse(name).ifPresent(layers::add);
            }
        }
        return new EncryptionDecision(
                layers,
                advice.reasoning != null && !advice.reasoning.isBlank() ? advice.reasoning : DEFAULT_REASONING,
                advice.threatModel != null ? advice.threatModel : DEFAULT_THREATS,
                Sensitivity.parse(advice.sensitivityLevel, Sensitivity.HIGH));
    }

    public boolean includes(Layer layer) {
        return layers.contains(layer);
    }
}
