package com.twinkle.agent.commitment;

import java.util.List;

public class CommitmentStats {
    public final int encryptions;
    public final int messages;
    public final List<Layer> layers;

    public CommitmentStats(int encryptions, int messages, List<Layer> layers) {
        this.encryptions = encryptions;
        this.messages = messages;
        this.layers = List.copyOf(layers);
    }
}
