package com.twinkle.agent.escrow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Buyer-side handle on the escrow ledger.
 *
 * <p>Enforces {@code Created -> ResponseSubmitted -> Settled | Refunded} locally before any
 * transaction is sent, so an escrow is settled at most once even when several threads
 * race on the same id. Each escrow is guarded by its own monitor; ledger calls for one
 * escrow are serialized, calls for different escrows are not.
 */
public class EscrowAccessor {

    private static final Logger log = LoggerFactory.getLogger(EscrowAccessor.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofHours(24);

    private final EscrowLedger ledger;
    private final Clock clock;
    private final Duration gracePeriod;
    private final Map<Long, Escrow> escrows = new ConcurrentHashMap<>();

    public EscrowAccessor(EscrowLedger ledger) {
        this(ledger, Clock.systemUTC(), DEFAULT_GRACE_PERIOD);
    }

    public EscrowAccessor(EscrowLedger ledger, Clock clock, Duration gracePeriod) {
        this.ledger = ledger;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
    }

    /**
     * Creates a pending escrow. With {@code terms.encrypted} the ledger sends the creation
     * through the encrypted-transaction path; callers that need the run's encryption
     * accounting go through {@code CommitmentLayer.createEncryptedEscrow}.
     */
    public EscrowHandle create(EscrowTerms terms) throws IOException, InterruptedException {
        LedgerReceipt receipt = ledger.createEscrow(terms);
        Escrow escrow = new Escrow(receipt.escrowId, ledger.buyer(), terms, receipt.txHash);
        if (escrows.putIfAbsent(receipt.escrowId, escrow) != null) {
            throw new IllegalEscrowStateException("Ledger reused escrow id #" + receipt.escrowId);
        }
        log.debug("Escrow #{} created for {} ({} units, encrypted={})",
                receipt.escrowId, terms.seller, terms.amount, terms.encrypted);
        return new EscrowHandle(receipt.escrowId, receipt.txHash, terms.encrypted, receipt.sentAt, receipt.receivedAt);
    }

    /** Seller delivery: stores the response hash and moves the escrow to ResponseSubmitted. */
    public String submitDelivery(long escrowId, String deliveryHash) throws IOException, InterruptedException {
        Escrow escrow = get(escrowId);
        synchronized (escrow) {
            if (escrow.status() != EscrowStatus.CREATED) {
                throw new IllegalEscrowStateException("Escrow #" + escrowId + " cannot accept a delivery in state "
                        + escrow.status());
            }
            String tx = ledger.submitResponse(escrowId, deliveryHash);
            escrow.responseSubmitted(deliveryHash);
            return tx;
        }
    }

    /**
     * Settles a delivered escrow without a delivery proof. {@code REFUNDED} returns the funds
     * to the buyer; {@code PAID} has nothing to compare against and therefore also refunds.
     *
     * @throws AlreadySettledException if the escrow is already terminal
     * @throws IllegalEscrowStateException if no delivery was submitted
     */
    public SettlementResult settle(long escrowId, SettlementOutcome outcome) throws IOException, InterruptedException {
        return settle(escrowId, outcome, null);
    }

    /**
     * Settles a delivered escrow. {@code PAID} releases funds only if {@code deliveryProof}
     * equals the submitted response hash; a mismatch is an expected outcome with an untrusted
     * seller and settles as a refund.
     *
     * @throws AlreadySettledException if the escrow is already terminal
     * @throws IllegalEscrowStateException if no delivery was submitted
     */
    public SettlementResult settle(long escrowId, SettlementOutcome outcome, String deliveryProof)
            throws IOException, InterruptedException {
        Escrow escrow = get(escrowId);
        synchronized (escrow) {
            requireSettleable(escrow);
            boolean matched = deliveryProof != null && deliveryProof.equalsIgnoreCase(escrow.responseHash());
            if (outcome == SettlementOutcome.PAID && !matched) {
                log.warn("Escrow #{}: delivery proof mismatch, refunding", escrowId);
                return finish(escrow, SettlementOutcome.REFUNDED, false);
            }
            return finish(escrow, outcome, matched);
        }
    }

    /** Shorthand for {@code settle(escrowId, PAID, deliveryProof)}. */
    public SettlementResult verifyAndSettle(long escrowId, String deliveryProof)
            throws IOException, InterruptedException {
        return settle(escrowId, SettlementOutcome.PAID, deliveryProof);
    }

    /** Buyer refund after the deadline. No-op on a terminal escrow. */
    public Optional<String> claimRefund(long escrowId) throws IOException, InterruptedException {
        Escrow escrow = get(escrowId);
        synchronized (escrow) {
            if (escrow.status().isTerminal()) {
                return Optional.empty();
            }
            if (!clock.instant().isAfter(escrow.deadline())) {
                throw new IllegalEscrowStateException("Escrow #" + escrowId + " deadline not reached");
            }
            String tx = ledger.claimRefund(escrowId);
            escrow.terminate(EscrowStatus.REFUNDED, tx);
            return Optional.of(tx);
        }
    }

    /** Administrative refund once {@code deadline + gracePeriod} has passed. No-op on a terminal escrow. */
    public Optional<String> emergencyRefund(long escrowId) throws IOException, InterruptedException {
        Escrow escrow = get(escrowId);
        synchronized (escrow) {
            if (escrow.status().isTerminal()) {
                return Optional.empty();
            }
            Instant unlock = escrow.deadline().plus(gracePeriod);
            if (!clock.instant().isAfter(unlock)) {
                throw new IllegalEscrowStateException("Escrow #" + escrowId + " grace period runs until " + unlock);
            }
            String tx = ledger.emergencyRefund(escrowId);
            escrow.terminate(EscrowStatus.REFUNDED, tx);
            return Optional.of(tx);
        }
    }

    public Escrow get(long escrowId) {
        Escrow escrow = escrows.get(escrowId);
        if (escrow == null) {
            throw new EscrowNotFoundException(escrowId);
        }
        return escrow;
    }

    private static void requireSettleable(Escrow escrow) {
        EscrowStatus status = escrow.status();
        if (status.isTerminal()) {
            throw new AlreadySettledException(escrow.id(), status);
        }
        if (status != EscrowStatus.RESPONSE_SUBMITTED) {
            throw new IllegalEscrowStateException("Escrow #" + escrow.id() + " has no delivery to settle");
        }
    }

    private SettlementResult finish(Escrow escrow, SettlementOutcome outcome, boolean proofMatched)
            throws IOException, InterruptedException {
        boolean pay = outcome == SettlementOutcome.PAID;
        String tx = ledger.settle(escrow.id(), pay);
        escrow.terminate(pay ? EscrowStatus.SETTLED : EscrowStatus.REFUNDED, tx);
        return new SettlementResult(escrow.id(), outcome, tx, proofMatched);
    }
}
