package com.twinkle.agent.escrow;

/** On-ledger escrow states, in contract order. Settled and Refunded are terminal. */
public enum EscrowStatus {
    CREATED,
    RESPONSE_SUBMITTED,
    SETTLED,
    REFUNDED;

    public boolean isTerminal() {
        return this == SETTLED || this == REFUNDED;
    }
}
