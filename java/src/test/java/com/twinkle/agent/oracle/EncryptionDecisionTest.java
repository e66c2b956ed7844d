package com.twinkle.agent.oracle;

import com.twinkle.agent.commitment.Layer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EncryptionDecisionTest {

    @Test
    void keepsRecognisedLayers() {
        EncryptionDecision d = EncryptionDecision.from(new EncryptionAdvice(
                List.of("strategy", " Query ", "telemetry"), "public market data", List.of("front-running"), "low"));

        assertEquals(EnumSet.of(Layer.STRATEGY, Layer.QUERY), d.layers);
        assertTrue(d.includes(Layer.QUERY));
        assertFalse(d.includes(Layer.ESCROW));
        assertEquals(Sensitivity.LOW, d.sensitivityLevel);
        assertEquals("public market data", d.reasoning);
    }

    @Test
    void nothingUsableMeansAllLayers() {
        EncryptionDecision empty = EncryptionDecision.from(new EncryptionAdvice(List.of(), null, null, null));
        EncryptionDecision junk = EncryptionDecision.from(new EncryptionAdvice(Arrays.asList("bogus", null), "", null, "extreme"));
        EncryptionDecision missing = EncryptionDecision.from(null);

        for (EncryptionDecision d : List.of(empty, junk, missing)) {
            assertEquals(Layer.all(), d.layers);
            assertEquals(Sensitivity.HIGH, d.sensitivityLevel);
            assertEquals(EncryptionDecision.DEFAULT_REASONING, d.reasoning);
        }
    }
}
