package com.twinkle.agent.runner;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/** A candidate provider: who it is, where to buy from it, and what it asks. */
public final class ProviderConfig {
    public final String name;
    public final String endpoint;
    public final BigDecimal price;
    public final List<String> dataSources;
    /** Wallet the provider is paid to. */
    public final String address;

    public ProviderConfig(String name, String endpoint, BigDecimal price, List<String> dataSources, String address) {
        this.name = Objects.requireNonNull(name, "name");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.price = Objects.requireNonNull(price, "price");
        this.dataSources = List.copyOf(dataSources);
        this.address = Objects.requireNonNull(address, "address");
    }
}
