package com.twinkle.agent.registry;

import java.util.Map;

public class AgentRegistration {
    public final String uri;
    public final Map<String, String> metadata;

    public AgentRegistration(String uri, Map<String, String> metadata) {
        this.uri = uri;
        this.metadata = Map.copyOf(metadata);
    }
}
