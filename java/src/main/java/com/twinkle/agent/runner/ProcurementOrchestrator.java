package com.twinkle.agent.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinkle.agent.commitment.CommitmentLayer;
import com.twinkle.agent.commitment.CommitmentPrimitive;
import com.twinkle.agent.commitment.CommitmentResult;
import com.twinkle.agent.commitment.Layer;
import com.twinkle.agent.commitment.Sleeper;
import com.twinkle.agent.config.TwinkleSettings;
import com.twinkle.agent.escrow.EscrowAccessor;
import com.twinkle.agent.escrow.EscrowHandle;
import com.twinkle.agent.escrow.EscrowLedger;
import com.twinkle.agent.escrow.EscrowTerms;
import com.twinkle.agent.escrow.SettlementOutcome;
import com.twinkle.agent.escrow.SettlementResult;
import com.twinkle.agent.event.EventLog;
import com.twinkle.agent.event.EventType;
import com.twinkle.agent.mandate.Amount;
import com.twinkle.agent.mandate.CartMandate;
import com.twinkle.agent.mandate.ChainOutcome;
import com.twinkle.agent.mandate.IntentMandate;
import com.twinkle.agent.mandate.MandateTracker;
import com.twinkle.agent.mandate.PaymentMandate;
import com.twinkle.agent.mandate.PaymentStatus;
import com.twinkle.agent.oracle.EncryptionDecision;
import com.twinkle.agent.oracle.EncryptionPolicyOracle;
import com.twinkle.agent.oracle.ProviderCandidate;
import com.twinkle.agent.oracle.ProviderReport;
import com.twinkle.agent.oracle.ProviderSelection;
import com.twinkle.agent.oracle.ProviderSelectionOracle;
import com.twinkle.agent.oracle.QualityAssessment;
import com.twinkle.agent.oracle.QualityOracle;
import com.twinkle.agent.oracle.SynthesisOracle;
import com.twinkle.agent.registry.AgentRegistration;
import com.twinkle.agent.registry.Feedback;
import com.twinkle.agent.registry.IdentityRegistry;
import com.twinkle.agent.registry.ReputationRegistry;
import com.twinkle.x402.client.HttpPurchaseClient;
import com.twinkle.x402.client.PurchaseClient;
import com.twinkle.x402.client.PurchaseResult;
import com.twinkle.x402.crypto.CryptoSigner;
import com.twinkle.x402.crypto.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static com.twinkle.agent.event.EventLog.fields;

/**
 * Runs one procurement end to end.
 *
 * <pre>
 * 0  intent mandate            6  escrows (+ encrypted layer) and payment mandates
 * 1  encryption policy         7  delivery and quality gate
 * 2  strategy commitment       8  settlement batch commitment
 * 3  query commitment          9  settlement, payment mandates, reputation
 * 4  discovery and carts       10 synthesis and receipt
 * 5  purchases
 * </pre>
 *
 * <p>Phases run in order. A provider whose purchase fails is dropped for the rest of the run;
 * a failing commitment, escrow or registry call aborts the run and leaves already-created
 * escrows and locked payments as they are. Purchases can fan out on {@link Builder#purchaseExecutor};
 * everything else is sequential per provider in configuration order.
 */
public class ProcurementOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProcurementOrchestrator.class);

    static final String NO_SYNTHESIS = "No passing results to synthesize.";
    static final String SYNTHESIS_FALLBACK = "Analysis synthesis completed.";

    static final int REPUTATION_PAID = 80;
    static final int REPUTATION_REFUNDED = -40;

    private final CommitmentPrimitive commitments;
    private final EscrowLedger ledger;
    private final EscrowAccessor escrows;
    private final PurchaseClient purchases;
    private final IdentityRegistry identity;
    private final ReputationRegistry reputation;
    private final EncryptionPolicyOracle encryptionOracle;
    private final ProviderSelectionOracle selectionOracle;
    private final QualityOracle qualityOracle;
    private final SynthesisOracle synthesisOracle;
    private final CryptoSigner payer;
    private final TwinkleSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Executor purchaseExecutor;
    private final ObjectMapper mapper;

    private ProcurementOrchestrator(Builder b) {
        this.settings = b.settings != null ? b.settings : TwinkleSettings.builder().build();
        this.commitments = Objects.requireNonNull(b.commitments, "commitments");
        this.ledger = Objects.requireNonNull(b.ledger, "ledger");
        this.purchases = b.purchases != null ? b.purchases : new HttpPurchaseClient(settings.httpTimeout);
        this.identity = Objects.requireNonNull(b.identity, "identity");
        this.reputation = Objects.requireNonNull(b.reputation, "reputation");
        this.qualityOracle = Objects.requireNonNull(b.qualityOracle, "qualityOracle");
        this.encryptionOracle = b.encryptionOracle;
        this.selectionOracle = b.selectionOracle;
        this.synthesisOracle = b.synthesisOracle;
        this.payer = b.payer;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.SYSTEM;
        this.purchaseExecutor = b.purchaseExecutor;
        this.mapper = b.mapper != null ? b.mapper : JsonSupport.newObjectMapper();
        this.escrows = new EscrowAccessor(ledger, clock, settings.gracePeriod);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Escrow handle shared by every run of this orchestrator; exposed for refunds and audits. */
    public EscrowAccessor escrows() {
        return escrows;
    }

    /**
     * Executes phases 0 to 10 for {@code request}.
     *
     * @throws com.twinkle.agent.commitment.CommitFailedException if a selected layer cannot be committed
     * @throws com.twinkle.agent.commitment.DecryptTimeoutException if a commitment never decrypts
     * @throws ProcurementException if the ledger or identity registry fails
     * @throws InterruptedException if the calling thread is interrupted
     */
    public ProcurementReceipt run(ProcurementRequest request) throws InterruptedException {
        Run run = new Run(request);
        try {
            return run.execute();
        } catch (IOException e) {
            throw new ProcurementException("Procurement aborted: " + e.getMessage(), e);
        }
    }

    /** State of a single execution of {@link #run}. */
    private final class Run {
        private final ProcurementRequest request;
        private final double threshold;
        private final boolean useX402;
        private final String service;
        private final EventLog events = new EventLog(clock);
        private final MandateTracker mandates = new MandateTracker(clock);
        private final CommitmentLayer layer;
        private final Instant startedAt = clock.instant();

        Run(ProcurementRequest request) {
            this.request = request;
            this.threshold = request.qualityThreshold != null ? request.qualityThreshold : settings.qualityThreshold;
            this.useX402 = request.useX402 != null ? request.useX402 : settings.useX402;
            this.service = request.category != null ? request.category : settings.service;
            if (request.listener != null) {
                events.onEvent(request.listener);
            }
            this.layer = new CommitmentLayer(commitments, events, mapper, settings.decryptPolling, clock, sleeper);
        }

        ProcurementReceipt execute() throws IOException, InterruptedException {
            // Phase 0
            log.info("[Phase 0] Intent mandate");
            IntentMandate intent = mandates.createIntent(request.query, new Amount(request.budget, settings.asset),
                    settings.intentTtl.getSeconds());
            events.emit(EventType.AP2_INTENT, "mandate-tracking", fields(
                    "mandateId", intent.id,
                    "chainId", mandates.chain().chainId,
                    "description", intent.description,
                    "budget", intent.budget.toString()));
            events.emit(EventType.AGENT_START, "initialization", fields(
                    "query", request.query,
                    "budget", request.budget,
                    "buyerAddress", ledger.buyer(),
                    "providerCount", request.providers.size(),
                    "useX402", useX402,
                    "category", request.category,
                    "mandateChainId", mandates.chain().chainId));

            // Phase 1
            log.info("[Phase 1] Encryption analysis");
            EncryptionDecision decision = decideEncryption();
            events.emit(EventType.ENCRYPTION_DECISION, "encryption-analysis", fields(
                    "layers", decision.layers.stream().map(Layer::wireName).collect(Collectors.toList()),
                    "reasoning", decision.reasoning,
                    "threatModel", decision.threatModel,
                    "sensitivityLevel", decision.sensitivityLevel.wireName()));
            log.info("  layers {} ({})", decision.layers, decision.sensitivityLevel.wireName());

            // Phase 2
            CommitmentResult strategyCommit = null;
            if (decision.includes(Layer.STRATEGY)) {
                log.info("[Phase 2] Strategy commitment");
                strategyCommit = layer.commitStrategy(strategyPlan());
            }

            // Phase 3
            CommitmentResult queryCommit = null;
            if (decision.includes(Layer.QUERY)) {
                log.info("[Phase 3] Query commitment");
                queryCommit = layer.commitQuery(request.query);
            }

            // Phase 4
            log.info("[Phase 4] Provider discovery");
            List<Engagement> engaged = discover();

            // Phase 5
            log.info("[Phase 5] Data purchase{}", useX402 ? " [x402]" : "");
            List<Engagement> delivered = purchaseAll(engaged);

            // Phase 6
            log.info("[Phase 6] Escrows");
            for (Engagement e : delivered) {
                lockFunds(e, decision.includes(Layer.ESCROW));
            }

            // Phase 7
            log.info("[Phase 7] Delivery and quality gate");
            List<SettlementDecision> verdicts = new ArrayList<>();
            for (Engagement e : delivered) {
                verdicts.add(evaluate(e));
            }

            // Phase 8
            CommitmentResult settlementsCommit = null;
            if (decision.includes(Layer.SETTLEMENT)) {
                log.info("[Phase 8] Settlement batch commitment");
                settlementsCommit = layer.commitSettlements(verdicts);
            }

            // Phase 9
            log.info("[Phase 9] Settlement");
            for (Engagement e : delivered) {
                settle(e);
            }

            // Phase 10
            log.info("[Phase 10] Synthesis and receipt");
            List<ProviderResult> results = delivered.stream().map(e -> e.result).collect(Collectors.toList());
            String synthesis = synthesize(results);

            boolean anyPaid = results.stream().anyMatch(ProviderResult::isPaid);
            mandates.complete(anyPaid ? ChainOutcome.SUCCESS : ChainOutcome.FAILURE);
            events.emit(EventType.AP2_COMPLETE, "mandate-tracking", fields(
                    "chainId", mandates.chain().chainId,
                    "outcome", mandates.chain().outcome().wireName(),
                    "mandateCount", mandates.chain().mandates().size()));

            ProcurementReceipt receipt = ReceiptAssembler.assemble(request.query, startedAt, clock.instant(),
                    decision, strategyCommit, queryCommit, settlementsCommit, results, synthesis,
                    mandates.chain(), layer.stats());
            log.info("[Receipt] {} paid={} refunded={} encryptions={} mandates={} ({})", receipt.id,
                    receipt.totals.paid, receipt.totals.refunded, receipt.totals.encryptionCount,
                    mandates.chain().mandates().size(), mandates.chain().outcome().wireName());
            events.emit(EventType.AGENT_RECEIPT, "complete", fields("receipt", receipt));
            return receipt;
        }

        private EncryptionDecision decideEncryption() throws InterruptedException {
            if (encryptionOracle == null) {
                return EncryptionDecision.allLayers();
            }
            try {
                return EncryptionDecision.from(encryptionOracle.analyze(request.query));
            } catch (IOException | RuntimeException e) {
                log.warn("Encryption policy oracle unavailable, encrypting every layer: {}", e.toString());
                return EncryptionDecision.allLayers();
            }
        }

        private Map<String, Object> strategyPlan() {
            List<Map<String, Object>> providers = request.providers.stream()
                    .map(p -> fields("name", p.name, "price", p.price, "endpoint", p.endpoint))
                    .collect(Collectors.toList());
            return fields(
                    "query", request.query,
                    "budget", request.budget,
                    "providers", providers,
                    "qualityThreshold", threshold,
                    "useX402", useX402,
                    "timestamp", clock.millis());
        }

        private List<Engagement> discover() throws IOException, InterruptedException {
            List<Engagement> engaged = new ArrayList<>();
            for (ProviderConfig p : request.providers) {
                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put("name", p.name);
                metadata.put("capability", String.join(",", p.dataSources));
                metadata.put("price", p.price.toPlainString());
                metadata.put("wallet", p.address);
                long agentId = identity.register(new AgentRegistration(
                        "twinkle://" + p.name.toLowerCase(Locale.ROOT), metadata));
                events.emit(EventType.PROVIDER_DISCOVERED, "discovery", fields(
                        "name", p.name, "agentId", agentId, "address", p.address, "price", p.price));
                log.info("  registered {} (agentId {}, {} {})", p.name, agentId, p.price, settings.asset);
                engaged.add(new Engagement(p, agentId));
            }

            List<ProviderSelection> selected = selectProviders();
            events.emit(EventType.PROVIDER_SELECTED, "discovery", fields(
                    "selected", selected.stream().map(s -> s.name).collect(Collectors.toList()),
                    "reasons", selected.stream().map(s -> fields("name", s.name, "reason", s.reason))
                            .collect(Collectors.toList())));

            for (Engagement e : engaged) {
                e.cart = mandates.createCart(e.provider.address, e.provider.name,
                        new Amount(e.provider.price, settings.asset), service, e.provider.endpoint);
                events.emit(EventType.AP2_CART, "mandate-tracking", fields(
                        "mandateId", e.cart.id,
                        "parentId", e.cart.parentId,
                        "provider", e.cart.providerName,
                        "price", e.cart.totalPrice.toString()));
            }
            return engaged;
        }

        private List<ProviderSelection> selectProviders() throws InterruptedException {
            List<ProviderCandidate> candidates = request.providers.stream()
                    .map(p -> new ProviderCandidate(p.name, p.price, p.dataSources))
                    .collect(Collectors.toList());
            List<ProviderSelection> fallback = candidates.stream()
                    .map(c -> new ProviderSelection(c.name, "Within budget"))
                    .collect(Collectors.toList());
            if (selectionOracle == null) {
                return fallback;
            }
            try {
                List<ProviderSelection> selected = selectionOracle.select(candidates,
                        new Amount(request.budget, settings.asset), request.query);
                return selected != null ? selected : fallback;
            } catch (IOException | RuntimeException e) {
                log.warn("Provider selection oracle unavailable: {}", e.toString());
                return fallback;
            }
        }

        private List<Engagement> purchaseAll(List<Engagement> engaged) throws InterruptedException {
            if (purchaseExecutor == null) {
                List<Engagement> delivered = new ArrayList<>();
                for (Engagement e : engaged) {
                    if (purchase(e)) {
                        delivered.add(e);
                    }
                }
                return delivered;
            }

            List<CompletableFuture<Boolean>> pending = new ArrayList<>();
            for (Engagement e : engaged) {
                pending.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return purchase(e);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(ie);
                    }
                }, purchaseExecutor));
            }
            List<Engagement> delivered = new ArrayList<>();
            for (int i = 0; i < engaged.size(); i++) {
                try {
                    if (pending.get(i).join()) {
                        delivered.add(engaged.get(i));
                    }
                } catch (CompletionException ce) {
                    if (ce.getCause() instanceof InterruptedException) {
                        throw (InterruptedException) ce.getCause();
                    }
                    throw ce;
                }
            }
            return delivered;
        }

        /** @return whether the provider delivered; failures are recorded and the provider dropped */
        private boolean purchase(Engagement e) throws InterruptedException {
            ProviderConfig p = e.provider;
            events.emit(EventType.X402_CHALLENGE, "data-purchase", fields(
                    "provider", p.name, "endpoint", p.endpoint, "price", p.price, "useX402", useX402));
            try {
                PurchaseResult result = purchases.purchase(p.endpoint, request.query, useX402 ? payer : null);
                if (result == null || result.data == null || result.data.isMissingNode() || result.data.isNull()) {
                    throw new IOException("empty delivery");
                }
                e.purchase = result;
                if (useX402 && result.x402Used) {
                    events.emit(EventType.X402_PAYMENT, "data-purchase", fields(
                            "provider", p.name,
                            "cost", result.paymentCost,
                            "method", "EIP-3009 transferWithAuthorization"));
                }
                events.emit(EventType.X402_SUCCESS, "data-purchase", fields(
                        "provider", p.name,
                        "hasAnalysis", result.data.has("analysis"),
                        "x402Used", result.x402Used,
                        "x402Cost", result.paymentCost));
                log.info("  {}: received analysis{}", p.name,
                        result.x402Used ? " [x402 paid " + result.paymentCost + "]" : "");
                return true;
            } catch (IOException | RuntimeException ex) {
                events.emit(EventType.AGENT_ERROR, "data-purchase", fields(
                        "provider", p.name, "error", String.valueOf(ex.getMessage())));
                log.warn("  {}: purchase failed, dropping provider: {}", p.name, ex.toString());
                return false;
            }
        }

        private void lockFunds(Engagement e, boolean encrypt) throws IOException, InterruptedException {
            ProviderConfig p = e.provider;
            Amount unit = new Amount(settings.escrowUnitAmount, settings.asset);
            EscrowTerms terms = new EscrowTerms(
                    p.address,
                    request.token,
                    unit.toAtomic(),
                    clock.instant().plus(settings.escrowDeadline),
                    Hashes.sha256(request.query + "-" + p.name + "-" + clock.millis()),
                    encrypt);

            EscrowHandle handle;
            if (encrypt) {
                CommitmentLayer.EncryptedEscrow created = layer.createEncryptedEscrow(escrows, terms);
                handle = created.handle;
                e.escrowCommitment = created.commitment;
            } else {
                handle = escrows.create(terms);
                e.escrowCommitment = new CommitmentResult(Layer.ESCROW, handle.reference, false,
                        handle.sentAt, handle.receivedAt, null, "escrow:" + handle.escrowId, null);
            }
            e.escrow = handle;
            e.deliveryHash = Hashes.sha256(deliveryJson(e.purchase.data));

            events.emit(EventType.ESCROW_CREATED, "escrow-creation", fields(
                    "provider", p.name,
                    "escrowId", handle.escrowId,
                    "amount", Amount.format(unit.amount),
                    "biteEncrypted", encrypt,
                    "txHash", handle.reference), e.escrowCommitment);

            e.payment = mandates.createPayment(e.cart.id, String.valueOf(handle.escrowId), handle.reference, unit,
                    p.address, e.purchase.paymentCost);
            events.emit(EventType.AP2_PAYMENT, "mandate-tracking", fields(
                    "mandateId", e.payment.id,
                    "parentId", e.payment.parentId,
                    "escrowId", handle.escrowId,
                    "status", PaymentStatus.LOCKED.wireName()));
            log.info("  {} {} {} {} -> escrow #{}", encrypt ? "[encrypted]" : "[plain]", p.name,
                    Amount.format(unit.amount), unit.asset, handle.escrowId);
        }

        private SettlementDecision evaluate(Engagement e) throws IOException, InterruptedException {
            ProviderConfig p = e.provider;
            escrows.submitDelivery(e.escrow.escrowId, e.deliveryHash);
            events.emit(EventType.ESCROW_RESPONSE, "delivery", fields(
                    "provider", p.name, "escrowId", e.escrow.escrowId, "deliveryHash", e.deliveryHash));

            JsonNode analysis = analysisOf(e.purchase.data);
            QualityAssessment quality;
            try {
                QualityAssessment raw = qualityOracle.evaluate(analysis, p.name, threshold, request.category);
                quality = raw != null ? raw.against(threshold) : QualityAssessment.unavailable(threshold, "no answer");
            } catch (IOException | RuntimeException ex) {
                log.warn("  {}: quality oracle failed, using neutral score: {}", p.name, ex.toString());
                quality = QualityAssessment.unavailable(threshold, ex.getMessage());
            }
            e.quality = quality;
            events.emit(EventType.QUALITY_EVALUATED, "quality-gate", fields(
                    "provider", p.name,
                    "score", quality.score,
                    "passed", quality.passed,
                    "reasoning", quality.reasoning));
            log.info("  {}: score {}/10 {}", p.name, quality.score, quality.passed ? "PASSED" : "FAILED");

            e.decision = new SettlementDecision(e.escrow.escrowId,
                    quality.passed ? SettlementDecision.Action.PAY : SettlementDecision.Action.REFUND, quality.score);
            return e.decision;
        }

        private void settle(Engagement e) throws IOException, InterruptedException {
            ProviderConfig p = e.provider;
            long escrowId = e.escrow.escrowId;
            SettlementResult settled = e.decision.action == SettlementDecision.Action.PAY
                    ? escrows.verifyAndSettle(escrowId, e.deliveryHash)
                    : escrows.settle(escrowId, SettlementOutcome.REFUNDED);
            boolean paid = settled.outcome == SettlementOutcome.PAID;

            mandates.settlePayment(e.payment.id, paid ? PaymentStatus.RELEASED : PaymentStatus.REFUNDED,
                    settled.reference);
            events.emit(EventType.ESCROW_SETTLED, "settlement", fields(
                    "provider", p.name,
                    "escrowId", escrowId,
                    "action", (paid ? SettlementDecision.Action.PAY : SettlementDecision.Action.REFUND).wireName(),
                    "decision", e.decision.action.wireName(),
                    "proofMatched", settled.proofMatched,
                    "txHash", settled.reference));
            events.emit(EventType.AP2_SETTLED, "mandate-tracking", fields(
                    "mandateId", e.payment.id,
                    "escrowId", escrowId,
                    "outcome", (paid ? PaymentStatus.RELEASED : PaymentStatus.REFUNDED).wireName(),
                    "txHash", settled.reference));
            log.info("  {}: {} {} {} (escrow #{})", p.name, paid ? "PAID" : "REFUNDED",
                    Amount.format(settings.escrowUnitAmount), settings.asset, escrowId);

            int delta = paid ? REPUTATION_PAID : REPUTATION_REFUNDED;
            List<String> tags = paid ? List.of("quality", "reliable") : List.of("quality", "poor");
            String feedbackTx = null;
            try {
                feedbackTx = reputation.submit(new Feedback(e.agentId, delta, tags.get(0), tags.get(1)));
            } catch (IOException | RuntimeException ex) {
                events.emit(EventType.AGENT_ERROR, "settlement", fields(
                        "provider", p.name, "error", "reputation: " + ex.getMessage()));
                log.warn("  {}: reputation feedback not recorded: {}", p.name, ex.toString());
            }
            events.emit(EventType.REPUTATION_UPDATED, "settlement", fields(
                    "provider", p.name, "agentId", e.agentId, "score", delta, "tags", tags));

            e.result = toResult(e, settled, delta, tags, feedbackTx);
        }

        private String synthesize(List<ProviderResult> results) throws InterruptedException {
            List<ProviderReport> passing = results.stream()
                    .filter(r -> r.delivery.passed)
                    .map(r -> new ProviderReport(r.name, r.delivery.analysis))
                    .collect(Collectors.toList());
            String synthesis = NO_SYNTHESIS;
            if (!passing.isEmpty()) {
                synthesis = SYNTHESIS_FALLBACK;
                if (synthesisOracle != null) {
                    try {
                        String text = synthesisOracle.synthesize(passing, request.query);
                        if (text != null && !text.isBlank()) {
                            synthesis = text;
                        }
                    } catch (IOException | RuntimeException ex) {
                        log.warn("Synthesis oracle failed: {}", ex.toString());
                    }
                }
                log.info("  synthesized {} result(s)", passing.size());
            }
            events.emit(EventType.SYNTHESIS_COMPLETE, "synthesis", fields(
                    "inputCount", passing.size(), "synthesis", synthesis));
            return synthesis;
        }

        private ProviderResult toResult(Engagement e, SettlementResult settled, int delta, List<String> tags,
                                        String feedbackTx) {
            ProviderResult r = new ProviderResult();
            r.name = e.provider.name;
            r.agentId = e.agentId;
            r.address = e.provider.address;

            r.x402.amount = e.provider.price;
            r.x402.endpoint = e.provider.endpoint;
            r.x402.x402Used = e.purchase.x402Used;
            r.x402.x402Cost = e.purchase.paymentCost;
            r.x402.x402Transaction = e.purchase.settlement != null ? e.purchase.settlement.transaction : null;

            r.escrow.id = e.escrow.escrowId;
            r.escrow.amount = settings.escrowUnitAmount;
            r.escrow.biteEncrypted = e.escrowCommitment.encrypted;
            r.escrow.txHash = e.escrow.reference;
            r.escrow.timingMs = e.escrowCommitment.roundTripMillis();

            r.delivery.hash = e.deliveryHash;
            r.delivery.qualityScore = e.quality.score;
            r.delivery.passed = e.quality.passed;
            r.delivery.reasoning = e.quality.reasoning;
            r.delivery.analysis = analysisOf(e.purchase.data);

            r.settlement.action = settled.outcome;
            r.settlement.txHash = settled.reference;

            r.reputation.score = delta;
            r.reputation.tags = tags;
            r.reputation.txHash = feedbackTx;
            return r;
        }

        private String deliveryJson(JsonNode data) {
            try {
                return mapper.writeValueAsString(analysisOf(data));
            } catch (JsonProcessingException ex) {
                // a tree read by Jackson always writes back
                throw new IllegalStateException(ex);
            }
        }
    }

    private static JsonNode analysisOf(JsonNode data) {
        return data.has("analysis") ? data.get("analysis") : data;
    }

    /** One provider's progress through a run. */
    private static final class Engagement {
        final ProviderConfig provider;
        final long agentId;
        CartMandate cart;
        PurchaseResult purchase;
        EscrowHandle escrow;
        CommitmentResult escrowCommitment;
        String deliveryHash;
        PaymentMandate payment;
        QualityAssessment quality;
        SettlementDecision decision;
        ProviderResult result;

        Engagement(ProviderConfig provider, long agentId) {
            this.provider = provider;
            this.agentId = agentId;
        }
    }

    public static final class Builder {
        private CommitmentPrimitive commitments;
        private EscrowLedger ledger;
        private PurchaseClient purchases;
        private IdentityRegistry identity;
        private ReputationRegistry reputation;
        private EncryptionPolicyOracle encryptionOracle;
        private ProviderSelectionOracle selectionOracle;
        private QualityOracle qualityOracle;
        private SynthesisOracle synthesisOracle;
        private CryptoSigner payer;
        private TwinkleSettings settings;
        private Clock clock;
        private Sleeper sleeper;
        private Executor purchaseExecutor;
        private ObjectMapper mapper;

        private Builder() {}

        public Builder commitments(CommitmentPrimitive v) { this.commitments = v; return this; }
        public Builder ledger(EscrowLedger v) { this.ledger = v; return this; }
        /** Defaults to an {@link HttpPurchaseClient} with the settings' HTTP timeout. */
        public Builder purchases(PurchaseClient v) { this.purchases = v; return this; }
        public Builder identity(IdentityRegistry v) { this.identity = v; return this; }
        public Builder reputation(ReputationRegistry v) { this.reputation = v; return this; }
        public Builder encryptionOracle(EncryptionPolicyOracle v) { this.encryptionOracle = v; return this; }
        public Builder selectionOracle(ProviderSelectionOracle v) { this.selectionOracle = v; return this; }
        public Builder qualityOracle(QualityOracle v) { this.qualityOracle = v; return this; }
        public Builder synthesisOracle(SynthesisOracle v) { this.synthesisOracle = v; return this; }
        /** Payer credential for x402 purchases. */
        public Builder payer(CryptoSigner v) { this.payer = v; return this; }
        public Builder settings(TwinkleSettings v) { this.settings = v; return this; }
        public Builder clock(Clock v) { this.clock = v; return this; }
        public Builder sleeper(Sleeper v) { this.sleeper = v; return this; }
        /** Runs phase 5 purchases concurrently on this executor; sequential when unset. */
        public Builder purchaseExecutor(Executor v) { this.purchaseExecutor = v; return this; }
        public Builder mapper(ObjectMapper v) { this.mapper = v; return this; }

        public ProcurementOrchestrator build() {
            return new ProcurementOrchestrator(this);
        }
    }
}
