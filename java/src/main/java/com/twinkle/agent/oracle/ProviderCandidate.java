package com.twinkle.agent.oracle;

import java.math.BigDecimal;
import java.util.List;

public class ProviderCandidate {
    public final String name;
    public final BigDecimal price;
    public final List<String> capabilities;

    public ProviderCandidate(String name, BigDecimal price, List<String> capabilities) {
        this.name = name;
        this.price = price;
        this.capabilities = List.copyOf(capabilities);
    }
}
