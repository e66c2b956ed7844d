package com.twinkle.agent.escrow;

import com.twinkle.agent.TwinkleException;

public class EscrowNotFoundException extends TwinkleException {
    public EscrowNotFoundException(long escrowId) {
        super("Unknown escrow #" + escrowId);
    }
}
