package com.twinkle.agent.marketplace;

import com.twinkle.agent.runner.ProviderConfig;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/** One category of work in a marketplace session: its query, budget and the agents bidding for it. */
public final class Act {
    public final String category;
    public final String query;
    public final BigDecimal budget;
    public final List<ProviderConfig> providers;

    public Act(String category, String query, BigDecimal budget, List<ProviderConfig> providers) {
        this.category = Objects.requireNonNull(category, "category");
        this.query = Objects.requireNonNull(query, "query");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.providers = List.copyOf(providers);
        if (this.providers.isEmpty()) {
            throw new IllegalArgumentException("act " + category + " has no providers");
        }
    }
}
