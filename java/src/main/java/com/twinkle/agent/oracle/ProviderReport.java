package com.twinkle.agent.oracle;

import com.fasterxml.jackson.databind.JsonNode;

public class ProviderReport {
    public final String name;
    public final JsonNode analysis;

    public ProviderReport(String name, JsonNode analysis) {
        this.name = name;
        this.analysis = analysis;
    }
}
