package com.twinkle.agent.mandate;

import com.twinkle.agent.TwinkleException;

public class NoIntentException extends TwinkleException {
    public NoIntentException() {
        super("Must create intent before cart");
    }
}
