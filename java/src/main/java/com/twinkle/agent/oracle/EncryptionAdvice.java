package com.twinkle.agent.oracle;

import java.util.List;

/** Raw answer of an {@link EncryptionPolicyOracle}; any field may be missing or malformed. */
public class EncryptionAdvice {
    public List<String> layers;
    public String reasoning;
    public List<String> threatModel;
    public String sensitivityLevel;

    public EncryptionAdvice() {}

    public EncryptionAdvice(List<String> layers, String reasoning, List<String> threatModel, String sensitivityLevel) {
        this.layers = layers;
        this.reasoning = reasoning;
        this.threatModel = threatModel;
        this.sensitivityLevel = sensitivityLevel;
    }
}
