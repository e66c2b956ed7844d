package com.twinkle.agent.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.twinkle.agent.escrow.SettlementOutcome;

import java.math.BigDecimal;
import java.util.List;

/** Everything the receipt records about one provider that reached settlement. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderResult {

    public static class Purchase {
        public BigDecimal amount;
        public String endpoint;
        public boolean x402Used;
        public String x402Cost;
        public String x402Transaction;
    }

    public static class EscrowInfo {
        public long id;
        public BigDecimal amount;
        public boolean biteEncrypted;
        public String txHash;
        public long timingMs;
    }

    public static class Delivery {
        public String hash;
        public double qualityScore;
        public boolean passed;
        public String reasoning;
        public JsonNode analysis;
    }

    public static class Settlement {
        public SettlementOutcome action;
        public String txHash;
    }

    public static class Reputation {
        public int score;
        public List<String> tags;
        /** Null when the registry rejected the feedback. */
        public String txHash;
    }

    public String name;
    public long agentId;
    public String address;
    public Purchase x402 = new Purchase();
    public EscrowInfo escrow = new EscrowInfo();
    public Delivery delivery = new Delivery();
    public Settlement settlement = new Settlement();
    public Reputation reputation = new Reputation();

    @JsonIgnore
    public boolean isPaid() {
        return settlement.action == SettlementOutcome.PAID;
    }
}
