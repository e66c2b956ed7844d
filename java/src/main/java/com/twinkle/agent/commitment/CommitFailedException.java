package com.twinkle.agent.commitment;

import com.twinkle.agent.TwinkleException;

public class CommitFailedException extends TwinkleException {
    private final Layer layer;

    public CommitFailedException(Layer layer, String message) {
        super(message);
        this.layer = layer;
    }

    public CommitFailedException(Layer layer, String message, Throwable cause) {
        super(message, cause);
        this.layer = layer;
    }

    public Layer layer() {
        return layer;
    }
}
