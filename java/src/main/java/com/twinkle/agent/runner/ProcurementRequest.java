package com.twinkle.agent.runner;

import com.twinkle.agent.event.EventListener;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Input of one procurement run. Unset optional fields fall back to the orchestrator's settings. */
public final class ProcurementRequest {
    public final String query;
    public final BigDecimal budget;
    /** Settlement token contract. */
    public final String token;
    public final List<ProviderConfig> providers;
    public final String category;
    public final Double qualityThreshold;
    public final Boolean useX402;
    public final EventListener listener;

    private ProcurementRequest(Builder b) {
        this.query = Objects.requireNonNull(b.query, "query");
        this.budget = Objects.requireNonNull(b.budget, "budget");
        this.token = Objects.requireNonNull(b.token, "token");
        this.providers = List.copyOf(b.providers);
        this.category = b.category;
        this.qualityThreshold = b.qualityThreshold;
        this.useX402 = b.useX402;
        this.listener = b.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String query;
        private BigDecimal budget;
        private String token;
        private final List<ProviderConfig> providers = new ArrayList<>();
        private String category;
        private Double qualityThreshold;
        private Boolean useX402;
        private EventListener listener;

        private Builder() {}

        public Builder query(String query) { this.query = query; return this; }
        public Builder budget(String budget) { this.budget = new BigDecimal(budget); return this; }
        public Builder budget(BigDecimal budget) { this.budget = budget; return this; }
        public Builder token(String token) { this.token = token; return this; }
        public Builder provider(ProviderConfig provider) { this.providers.add(provider); return this; }
        public Builder providers(List<ProviderConfig> providers) { this.providers.addAll(providers); return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder qualityThreshold(double threshold) { this.qualityThreshold = threshold; return this; }
        public Builder useX402(boolean useX402) { this.useX402 = useX402; return this; }
        public Builder listener(EventListener listener) { this.listener = listener; return this; }

        public ProcurementRequest build() {
            return new ProcurementRequest(this);
        }
    }
}
