package com.twinkle.agent.marketplace;

import com.twinkle.agent.mandate.MandateChain;

import java.time.Instant;
import java.util.List;

/** Combined audit record of a marketplace session. */
public class MarketplaceReceipt {

    public static class Totals {
        public int escrowsCreated;
        public String paid;
        public String refunded;
        public int encryptionCount;
        public int purchaseProtocolUsageCount;
        /** Same as {@link #escrowsCreated}: every hired agent gets exactly one escrow. */
        public int agentsHired;
        public int agentsPaid;
        public int agentsRefunded;
    }

    public String id;
    public Instant startedAt;
    public long durationMs;
    public List<ActResult> acts;
    public Totals totals = new Totals();
    public List<MandateChain> mandateChains;

    /** Each act's synthesis prefixed with {@code [category]}, separated by blank lines. */
    public String synthesis;
}
