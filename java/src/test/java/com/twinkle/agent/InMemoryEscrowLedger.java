package com.twinkle.agent;

import com.twinkle.agent.escrow.EscrowLedger;
import com.twinkle.agent.escrow.EscrowTerms;
import com.twinkle.agent.escrow.LedgerReceipt;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** Ledger that records every call instead of sending transactions. */
public class InMemoryEscrowLedger implements EscrowLedger {

    public static final String BUYER = "0x00000000000000000000000000000000000000b1";

    private final Clock clock;
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger txs = new AtomicInteger();
    private final List<EscrowTerms> created = new ArrayList<>();
    private final Map<Long, String> responses = new ConcurrentHashMap<>();
    private final Map<Long, AtomicInteger> settleCalls = new ConcurrentHashMap<>();
    private final Map<Long, Boolean> payouts = new ConcurrentHashMap<>();
    private final List<Long> refunds = new ArrayList<>();

    /** Escrow creation raises an I/O error. */
    public volatile boolean failCreates;

    public InMemoryEscrowLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryEscrowLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String buyer() {
        return BUYER;
    }

    @Override
    public synchronized LedgerReceipt createEscrow(EscrowTerms terms) throws IOException {
        if (failCreates) {
            throw new IOException("execution reverted");
        }
        Instant sent = clock.instant();
        created.add(terms);
        return new LedgerReceipt(ids.incrementAndGet(), tx(), sent, clock.instant());
    }

    @Override
    public String submitResponse(long escrowId, String responseHash) {
        responses.put(escrowId, responseHash);
        return tx();
    }

    @Override
    public String settle(long escrowId, boolean matched) {
        settleCalls.computeIfAbsent(escrowId, id -> new AtomicInteger()).incrementAndGet();
        payouts.put(escrowId, matched);
        return tx();
    }

    @Override
    public synchronized String claimRefund(long escrowId) {
        refunds.add(escrowId);
        return tx();
    }

    @Override
    public synchronized String emergencyRefund(long escrowId) {
        refunds.add(escrowId);
        return tx();
    }

    public synchronized List<EscrowTerms> created() {
        return List.copyOf(created);
    }

    public String response(long escrowId) {
        return responses.get(escrowId);
    }

    public int settleCalls(long escrowId) {
        AtomicInteger n = settleCalls.get(escrowId);
        return n == null ? 0 : n.get();
    }

    /** True when the escrow paid the seller, false when refunded, null when never settled. */
    public Boolean paidOut(long escrowId) {
        return payouts.get(escrowId);
    }

    public synchronized List<Long> refunds() {
        return List.copyOf(refunds);
    }

    private String tx() {
        return String.format("0xtx%04d", txs.incrementAndGet());
    }
}
