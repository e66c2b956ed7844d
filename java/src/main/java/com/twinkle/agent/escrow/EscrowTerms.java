package com.twinkle.agent.escrow;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/** Parameters of a conditional payment from the buyer to one seller. */
public final class EscrowTerms {
    public final String seller;
    public final String token;
    /** Token base units. */
    public final BigInteger amount;
    public final Instant deadline;
    public final String requestHash;
    /** Whether the creating transaction goes through the encrypted-transaction path. */
    public final boolean encrypted;

    public EscrowTerms(String seller, String token, BigInteger amount, Instant deadline,
                       String requestHash, boolean encrypted) {
        this.seller = Objects.requireNonNull(seller, "seller");
        this.token = Objects.requireNonNull(token, "token");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.requestHash = Objects.requireNonNull(requestHash, "requestHash");
        this.encrypted = encrypted;
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("escrow amount must be positive");
        }
    }

    public EscrowTerms encrypted(boolean value) {
        return new EscrowTerms(seller, token, amount, deadline, requestHash, value);
    }
}
