package com.twinkle.agent.registry;

/** Signed reputation delta for one agent, with up to two tags. */
public class Feedback {
    public final long agentId;
    public final int value;
    public final int decimals;
    public final String tag1;
    public final String tag2;
    public final String endpoint;

    public Feedback(long agentId, int value, String tag1, String tag2) {
        this(agentId, value, 0, tag1, tag2, "");
    }

    public Feedback(long agentId, int value, int decimals, String tag1, String tag2, String endpoint) {
        this.agentId = agentId;
        this.value = value;
        this.decimals = decimals;
        this.tag1 = tag1;
        this.tag2 = tag2;
        this.endpoint = endpoint;
    }
}
