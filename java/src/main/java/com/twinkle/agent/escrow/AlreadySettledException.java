package com.twinkle.agent.escrow;

import com.twinkle.agent.TwinkleException;

public class AlreadySettledException extends TwinkleException {
    public AlreadySettledException(long escrowId, EscrowStatus status) {
        super("Escrow #" + escrowId + " already " + status);
    }
}
