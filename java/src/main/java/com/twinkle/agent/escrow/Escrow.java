package com.twinkle.agent.escrow;

import java.math.BigInteger;
import java.time.Instant;

/** Local mirror of one escrow. Guarded by its own monitor; see {@link EscrowAccessor}. */
public final class Escrow {
    private final long id;
    private final String buyer;
    private final String seller;
    private final String token;
    private final BigInteger amount;
    private final Instant deadline;
    private final String requestHash;
    private final String creationTx;

    private String responseHash;
    private EscrowStatus status = EscrowStatus.CREATED;
    private String settlementTx;

    Escrow(long id, String buyer, EscrowTerms terms, String creationTx) {
        this.id = id;
        this.buyer = buyer;
        this.seller = terms.seller;
        this.token = terms.token;
        this.amount = terms.amount;
        this.deadline = terms.deadline;
        this.requestHash = terms.requestHash;
        this.creationTx = creationTx;
    }

    public long id() { return id; }
    public String buyer() { return buyer; }
    public String seller() { return seller; }
    public String token() { return token; }
    public BigInteger amount() { return amount; }
    public Instant deadline() { return deadline; }
    public String requestHash() { return requestHash; }
    public String creationTx() { return creationTx; }

    public synchronized String responseHash() { return responseHash; }
    public synchronized EscrowStatus status() { return status; }
    public synchronized String settlementTx() { return settlementTx; }

    void responseSubmitted(String hash) {
        responseHash = hash;
        status = EscrowStatus.RESPONSE_SUBMITTED;
    }

    void terminate(EscrowStatus terminal, String tx) {
        status = terminal;
        settlementTx = tx;
    }
}
