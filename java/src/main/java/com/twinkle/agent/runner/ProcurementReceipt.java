package com.twinkle.agent.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.twinkle.agent.mandate.MandateChain;
import com.twinkle.agent.oracle.EncryptionDecision;

import java.time.Instant;
import java.util.List;

/** Audit record of one run. Reporting tooling reads this shape; keep field names stable. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcurementReceipt {

    /** Summary of one message commitment as shown on the receipt. */
    public static class Proof {
        public final String txHash;
        public final String originalHex;
        public final boolean verified;
        public final long timing;

        public Proof(String txHash, String originalHex, boolean verified, long timing) {
            this.txHash = txHash;
            this.originalHex = originalHex;
            this.verified = verified;
            this.timing = timing;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Commitments {
        public Proof strategy;
        public Proof query;
        public Proof settlements;
    }

    public static class Totals {
        public String paid;
        public String refunded;
        public int encryptionCount;
        public int commitMessageCount;
        public int purchaseProtocolUsageCount;
        public int escrowsCreated;
        public int agentsPaid;
        public int agentsRefunded;
    }

    public String id;
    public String query;
    public Instant startedAt;
    public long durationMs;
    public EncryptionDecision encryptionDecision;
    public Commitments commitments = new Commitments();
    public List<ProviderResult> providers;
    public String synthesis;
    public MandateChain mandateChain;
    public Totals totals = new Totals();
}
