package com.twinkle.agent.marketplace;

import com.twinkle.agent.event.EventListener;
import com.twinkle.agent.mandate.Amount;
import com.twinkle.agent.runner.ProcurementOrchestrator;
import com.twinkle.agent.runner.ProcurementReceipt;
import com.twinkle.agent.runner.ProcurementRequest;
import com.twinkle.agent.runner.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs a sequence of acts, one procurement each, and folds their receipts into a
 * {@link MarketplaceReceipt}. Acts run one after another; a failing act aborts the session.
 */
public class MarketplaceRunner {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceRunner.class);

    private final ProcurementOrchestrator orchestrator;
    private final Clock clock;

    public MarketplaceRunner(ProcurementOrchestrator orchestrator) {
        this(orchestrator, Clock.systemUTC());
    }

    public MarketplaceRunner(ProcurementOrchestrator orchestrator, Clock clock) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.clock = clock;
    }

    /**
     * @param token settlement token for every act
     * @param listener receives the events of every act, may be null
     */
    public MarketplaceReceipt run(List<Act> acts, String token, EventListener listener) throws InterruptedException {
        Instant start = clock.instant();
        List<ActResult> results = new ArrayList<>();

        for (int i = 0; i < acts.size(); i++) {
            Act act = acts.get(i);
            log.info("ACT {}: {} ({} agents, budget {})", i + 1, act.category, act.providers.size(),
                    act.budget.toPlainString());
            Instant actStart = clock.instant();
            ProcurementRequest.Builder request = ProcurementRequest.builder()
                    .query(act.query)
                    .budget(act.budget)
                    .token(token)
                    .providers(act.providers)
                    .category(act.category);
            if (listener != null) {
                request.listener(listener);
            }
            ProcurementReceipt receipt = orchestrator.run(request.build());
            results.add(new ActResult(act.category, receipt,
                    Duration.between(actStart, clock.instant()).toMillis()));
        }

        MarketplaceReceipt receipt = combine(start, results);
        log.info("Marketplace complete: {} act(s), {} hired, {} paid, {} refunded, paid {} / refunded {}",
                results.size(), receipt.totals.agentsHired, receipt.totals.agentsPaid,
                receipt.totals.agentsRefunded, receipt.totals.paid, receipt.totals.refunded);
        return receipt;
    }

    MarketplaceReceipt combine(Instant start, List<ActResult> acts) {
        Instant end = clock.instant();
        MarketplaceReceipt receipt = new MarketplaceReceipt();
        receipt.id = "twinkle-marketplace-" + end.toEpochMilli();
        receipt.startedAt = start;
        receipt.durationMs = Duration.between(start, end).toMillis();
        receipt.acts = List.copyOf(acts);

        BigDecimal paid = BigDecimal.ZERO;
        BigDecimal refunded = BigDecimal.ZERO;
        MarketplaceReceipt.Totals totals = receipt.totals;
        for (ActResult act : acts) {
            ProcurementReceipt.Totals t = act.receipt.totals;
            paid = paid.add(new BigDecimal(t.paid));
            refunded = refunded.add(new BigDecimal(t.refunded));
            totals.escrowsCreated += t.escrowsCreated;
            totals.encryptionCount += t.encryptionCount;
            totals.purchaseProtocolUsageCount += t.purchaseProtocolUsageCount;
            for (ProviderResult p : act.receipt.providers) {
                if (p.isPaid()) {
                    totals.agentsPaid++;
                } else {
                    totals.agentsRefunded++;
                }
            }
        }
        totals.agentsHired = totals.escrowsCreated;
        totals.paid = Amount.format(paid);
        totals.refunded = Amount.format(refunded);

        receipt.mandateChains = acts.stream()
                .map(a -> a.receipt.mandateChain)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        receipt.synthesis = acts.stream()
                .map(a -> "[" + a.category + "] " + a.receipt.synthesis)
                .collect(Collectors.joining("\n\n"));
        return receipt;
    }
}
