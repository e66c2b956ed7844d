package com.twinkle.agent.escrow;

import com.twinkle.agent.TwinkleException;

public class IllegalEscrowStateException extends TwinkleException {
    public IllegalEscrowStateException(String message) {
        super(message);
    }
}
