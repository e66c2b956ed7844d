package com.twinkle.agent.runner;

import com.twinkle.agent.commitment.CommitmentResult;
import com.twinkle.agent.commitment.CommitmentStats;
import com.twinkle.agent.mandate.Amount;
import com.twinkle.agent.mandate.MandateChain;
import com.twinkle.agent.oracle.EncryptionDecision;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Folds a finished run into its {@link ProcurementReceipt}. */
final class ReceiptAssembler {

    private static final AtomicLong COUNTER = new AtomicLong();

    private ReceiptAssembler() {}

    static ProcurementReceipt assemble(String query, Instant startedAt, Instant finishedAt,
                                       EncryptionDecision decision,
                                       CommitmentResult strategy, CommitmentResult queryCommit,
                                       CommitmentResult settlements,
                                       List<ProviderResult> providers, String synthesis,
                                       MandateChain chain, CommitmentStats stats) {
        ProcurementReceipt receipt = new ProcurementReceipt();
        receipt.id = "twinkle-receipt-" + COUNTER.incrementAndGet() + "-" + finishedAt.toEpochMilli();
        receipt.query = query;
        receipt.startedAt = startedAt;
        receipt.durationMs = Duration.between(startedAt, finishedAt).toMillis();
        receipt.encryptionDecision = decision;
        receipt.commitments.strategy = proof(strategy);
        receipt.commitments.query = proof(queryCommit);
        receipt.commitments.settlements = proof(settlements);
        receipt.providers = List.copyOf(providers);
        receipt.synthesis = synthesis;
        receipt.mandateChain = chain;

        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal refunded = BigDecimal.ZERO;
        int agentsPaid = 0;
        for (ProviderResult p : providers) {
            if (p.isPaid()) {
                paid = paid.add(p.escrow.amount);
                agentsPaid++;
            } else {
                refunded = refunded.add(p.escrow.amount);
            }
        }

        ProcurementReceipt.Totals totals = receipt.totals;
        totals.paid = Amount.format(paid);
        totals.refunded = Amount.format(refunded);
        totals.encryptionCount = stats.encryptions;
        totals.commitMessageCount = stats.messages;
        totals.purchaseProtocolUsageCount = (int) providers.stream().filter(p -> p.x402.x402Used).count();
        totals.escrowsCreated = providers.size();
        totals.agentsPaid = agentsPaid;
        totals.agentsRefunded = providers.size() - agentsPaid;
        return receipt;
    }

    private static ProcurementReceipt.Proof proof(CommitmentResult commitment) {
        if (commitment == null) {
            return null;
        }
        return new ProcurementReceipt.Proof(commitment.txHash, commitment.dataPreview, commitment.isVerified(),
                commitment.roundTripMillis());
    }
}
