package com.twinkle.agent.oracle;

public class ProviderSelection {
    public final String name;
    public final String reason;

    public ProviderSelection(String name, String reason) {
        this.name = name;
        this.reason = reason;
    }
}
