package com.twinkle.agent.config;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TwinkleSettingsTest {

    @Test
    void classpathDefaults() {
        TwinkleSettings s = TwinkleSettings.load(TwinkleSettings.classpathDefaults(), Map.of());

        assertEquals(5, s.qualityThreshold);
        assertEquals(0, new BigDecimal("0.10").compareTo(s.escrowUnitAmount));
        assertEquals("USDC", s.asset);
        assertEquals(Duration.ofHours(1), s.escrowDeadline);
        assertEquals(Duration.ofHours(24), s.gracePeriod);
        assertEquals(15, s.decryptPolling.maxAttempts);
        assertEquals(Duration.ofSeconds(1), s.decryptPolling.interval);
        assertFalse(s.useX402);
        assertEquals("data-query", s.service);
    }

    @Test
    void environmentOverridesProperties() {
        TwinkleSettings s = TwinkleSettings.load(TwinkleSettings.classpathDefaults(), Map.of(
                "TWINKLE_QUALITY_THRESHOLD", "7.5",
                "TWINKLE_ESCROW_UNIT_AMOUNT", "0.25",
                "TWINKLE_X402_ENABLED", "true",
                "TWINKLE_DECRYPT_MAX_ATTEMPTS", "3"));

        assertEquals(7.5, s.qualityThreshold);
        assertEquals(0, new BigDecimal("0.25").compareTo(s.escrowUnitAmount));
        assertTrue(s.useX402);
        assertEquals(3, s.decryptPolling.maxAttempts);
    }

    @Test
    void missingKeysFallBack() {
        TwinkleSettings s = TwinkleSettings.load(new Properties(), Map.of());
        assertEquals("USDC", s.asset);
        assertEquals(Duration.ofMinutes(10), s.intentTtl);
    }

    @Test
    void envNames() {
        assertEquals("TWINKLE_ESCROW_GRACE_PERIOD_SECONDS", TwinkleSettings.envName("escrow.grace-period-seconds"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> TwinkleSettings.load(new Properties(),
                Map.of("TWINKLE_QUALITY_THRESHOLD", "11")));
        assertThrows(IllegalArgumentException.class, () -> TwinkleSettings.load(new Properties(),
                Map.of("TWINKLE_ESCROW_UNIT_AMOUNT", "zero")));
        assertThrows(IllegalArgumentException.class,
                () -> TwinkleSettings.builder().escrowUnitAmount(BigDecimal.ZERO).build());
    }

    @Test
    void toBuilderCopies() {
        TwinkleSettings base = TwinkleSettings.builder().asset("EURC").build();
        TwinkleSettings copy = base.toBuilder().qualityThreshold(8).build();
        assertEquals("EURC", copy.asset);
        assertEquals(8, copy.qualityThreshold);
    }
}
