package com.twinkle.agent.config;

import com.twinkle.agent.commitment.PollingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Procurement settings: {@code twinkle.properties} on the classpath, overridden by
 * {@code TWINKLE_*} environment variables.
 */
public final class TwinkleSettings {

    private static final Logger log = LoggerFactory.getLogger(TwinkleSettings.class);

    static final String RESOURCE = "twinkle.properties";

    public final double qualityThreshold;
    public final BigDecimal escrowUnitAmount;
    public final String asset;
    public final Duration escrowDeadline;
    public final Duration gracePeriod;
    public final Duration intentTtl;
    public final PollingPolicy decryptPolling;
    public final boolean useX402;
    public final Duration httpTimeout;
    public final String service;

    private TwinkleSettings(Builder b) {
        this.qualityThreshold = b.qualityThreshold;
        this.escrowUnitAmount = b.escrowUnitAmount;
        this.asset = b.asset;
        this.escrowDeadline = b.escrowDeadline;
        this.gracePeriod = b.gracePeriod;
        this.intentTtl = b.intentTtl;
        this.decryptPolling = b.decryptPolling;
        this.useX402 = b.useX402;
        this.httpTimeout = b.httpTimeout;
        this.service = b.service;
    }

    /** Classpath defaults plus the process environment. */
    public static TwinkleSettings load() {
        return load(classpathDefaults(), System.getenv());
    }

    public static TwinkleSettings load(Properties defaults, Map<String, String> env) {
        Source src = new Source(defaults, env);
        return builder()
                .qualityThreshold(src.decimal("quality-threshold").doubleValue())
                .escrowUnitAmount(src.decimal("escrow.unit-amount"))
                .asset(src.string("escrow.asset"))
                .escrowDeadline(Duration.ofSeconds(src.integer("escrow.deadline-seconds")))
                .gracePeriod(Duration.ofSeconds(src.integer("escrow.grace-period-seconds")))
                .intentTtl(Duration.ofSeconds(src.integer("intent.ttl-seconds")))
                .decryptPolling(new PollingPolicy(
                        Duration.ofMillis(src.integer("decrypt.interval-millis")),
                        (int) src.integer("decrypt.max-attempts"),
                        Duration.ofMillis(src.integer("decrypt.timeout-millis"))))
                .useX402(Boolean.parseBoolean(src.string("x402.enabled")))
                .httpTimeout(Duration.ofSeconds(src.integer("http.timeout-seconds")))
                .service(src.string("service"))
                .build();
    }

    static Properties classpathDefaults() {
        Properties props = new Properties();
        try (InputStream in = TwinkleSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath, using built-in defaults", RESOURCE);
                return props;
            }
            props.load(in);
            return props;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
    }

    /** {@code escrow.unit-amount} becomes {@code TWINKLE_ESCROW_UNIT_AMOUNT}. */
    static String envName(String key) {
        return "TWINKLE_" + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .qualityThreshold(qualityThreshold)
                .escrowUnitAmount(escrowUnitAmount)
                .asset(asset)
                .escrowDeadline(escrowDeadline)
                .gracePeriod(gracePeriod)
                .intentTtl(intentTtl)
                .decryptPolling(decryptPolling)
                .useX402(useX402)
                .httpTimeout(httpTimeout)
                .service(service);
    }

    private static final class Source {
        private final Properties defaults;
        private final Map<String, String> env;

        Source(Properties defaults, Map<String, String> env) {
            this.defaults = defaults;
            this.env = env;
        }

        String string(String key) {
            String value = env.get(envName(key));
            if (value == null || value.isBlank()) {
                value = defaults.getProperty(key);
            }
            if (value == null || value.isBlank()) {
                value = Builder.FALLBACKS.getProperty(key);
            }
            return value.trim();
        }

        BigDecimal decimal(String key) {
            try {
                return new BigDecimal(string(key));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting " + key + " is not a number: " + string(key), e);
            }
        }

        long integer(String key) {
            return decimal(key).longValueExact();
        }
    }

    public static final class Builder {
        static final Properties FALLBACKS = new Properties();

        static {
            FALLBACKS.setProperty("quality-threshold", "5");
            FALLBACKS.setProperty("escrow.unit-amount", "0.10");
            FALLBACKS.setProperty("escrow.asset", "USDC");
            FALLBACKS.setProperty("escrow.deadline-seconds", "3600");
            FALLBACKS.setProperty("escrow.grace-period-seconds", "86400");
            FALLBACKS.setProperty("intent.ttl-seconds", "600");
            FALLBACKS.setProperty("decrypt.interval-millis", "1000");
            FALLBACKS.setProperty("decrypt.max-attempts", "15");
            FALLBACKS.setProperty("decrypt.timeout-millis", "30000");
            FALLBACKS.setProperty("x402.enabled", "false");
            FALLBACKS.setProperty("http.timeout-seconds", "30");
            FALLBACKS.setProperty("service", "data-query");
        }

        private double qualityThreshold = 5;
        private BigDecimal escrowUnitAmount = new BigDecimal("0.10");
        private String asset = "USDC";
        private Duration escrowDeadline = Duration.ofHours(1);
        private Duration gracePeriod = Duration.ofHours(24);
        private Duration intentTtl = Duration.ofMinutes(10);
        private PollingPolicy decryptPolling = PollingPolicy.DEFAULT;
        private boolean useX402;
        private Duration httpTimeout = Duration.ofSeconds(30);
        private String service = "data-query";

        private Builder() {}

        public Builder qualityThreshold(double v) { this.qualityThreshold = v; return this; }
        public Builder escrowUnitAmount(BigDecimal v) { this.escrowUnitAmount = v; return this; }
        public Builder asset(String v) { this.asset = v; return this; }
        public Builder escrowDeadline(Duration v) { this.escrowDeadline = v; return this; }
        public Builder gracePeriod(Duration v) { this.gracePeriod = v; return this; }
        public Builder intentTtl(Duration v) { this.intentTtl = v; return this; }
        public Builder decryptPolling(PollingPolicy v) { this.decryptPolling = v; return this; }
        public Builder useX402(boolean v) { this.useX402 = v; return this; }
        public Builder httpTimeout(Duration v) { this.httpTimeout = v; return this; }
        public Builder service(String v) { this.service = v; return this; }

        public TwinkleSettings build() {
            if (qualityThreshold < 0 || qualityThreshold > 10) {
                throw new IllegalArgumentException("quality threshold must be within [0, 10]: " + qualityThreshold);
            }
            if (escrowUnitAmount.signum() <= 0) {
                throw new IllegalArgumentException("escrow unit amount must be positive");
            }
            return new TwinkleSettings(this);
        }
    }
}
