package com.twinkle.agent.escrow;

import com.twinkle.agent.InMemoryEscrowLedger;
import com.twinkle.agent.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class EscrowAccessorTest {

    MutableClock clock;
    InMemoryEscrowLedger ledger;
    EscrowAccessor escrows;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        ledger = new InMemoryEscrowLedger(clock);
        escrows = new EscrowAccessor(ledger, clock, Duration.ofHours(24));
    }

    private long create() throws Exception {
        EscrowTerms terms = new EscrowTerms("0xSeller", "0xUSDC", BigInteger.valueOf(100_000),
                clock.instant().plus(Duration.ofHours(1)), "0xrequest", false);
        return escrows.create(terms).escrowId;
    }

    @Test
    void createThenDeliverThenPay() throws Exception {
        long id = create();
        assertEquals(EscrowStatus.CREATED, escrows.get(id).status());
        assertEquals(InMemoryEscrowLedger.BUYER, escrows.get(id).buyer());

        escrows.submitDelivery(id, "0xdelivery");
        assertEquals(EscrowStatus.RESPONSE_SUBMITTED, escrows.get(id).status());
        assertEquals("0xdelivery", ledger.response(id));

        SettlementResult result = escrows.verifyAndSettle(id, "0xdelivery");
        assertEquals(SettlementOutcome.PAID, result.outcome);
        assertTrue(result.proofMatched);
        assertEquals(EscrowStatus.SETTLED, escrows.get(id).status());
        assertEquals(result.reference, escrows.get(id).settlementTx());
        assertEquals(Boolean.TRUE, ledger.paidOut(id));
    }

    @Test
    void refundSettlesWithoutPaying() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xdelivery");

        SettlementResult result = escrows.settle(id, SettlementOutcome.REFUNDED);

        assertEquals(SettlementOutcome.REFUNDED, result.outcome);
        assertEquals(EscrowStatus.REFUNDED, escrows.get(id).status());
        assertEquals(Boolean.FALSE, ledger.paidOut(id));
    }

    @Test
    void proofMismatchDegradesToRefund() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xdelivery");

        SettlementResult result = escrows.verifyAndSettle(id, "0xsomething-else");

        assertEquals(SettlementOutcome.REFUNDED, result.outcome);
        assertFalse(result.proofMatched);
        assertEquals(EscrowStatus.REFUNDED, escrows.get(id).status());
    }

    @Test
    void payWithoutProofRefunds() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xgarbage-that-nobody-verified");

        SettlementResult result = escrows.settle(id, SettlementOutcome.PAID);

        assertEquals(SettlementOutcome.REFUNDED, result.outcome);
        assertFalse(result.proofMatched);
        assertEquals(EscrowStatus.REFUNDED, escrows.get(id).status());
        assertEquals(Boolean.FALSE, ledger.paidOut(id));
    }

    @Test
    void payWithMatchingProofReleasesFunds() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xABCDEF");

        SettlementResult result = escrows.settle(id, SettlementOutcome.PAID, "0xabcdef");

        assertEquals(SettlementOutcome.PAID, result.outcome);
        assertTrue(result.proofMatched);
        assertEquals(Boolean.TRUE, ledger.paidOut(id));
    }

    @Test
    void settleBeforeDeliveryIsIllegal() throws Exception {
        long id = create();
        assertThrows(IllegalEscrowStateException.class, () -> escrows.settle(id, SettlementOutcome.PAID));
        assertEquals(0, ledger.settleCalls(id));
    }

    @Test
    void secondSettleFailsAndMovesNothing() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xd");
        escrows.verifyAndSettle(id, "0xd");

        assertThrows(AlreadySettledException.class, () -> escrows.settle(id, SettlementOutcome.REFUNDED));
        assertThrows(AlreadySettledException.class, () -> escrows.verifyAndSettle(id, "0xd"));
        assertEquals(1, ledger.settleCalls(id));
        assertEquals(EscrowStatus.SETTLED, escrows.get(id).status());
    }

    @Test
    void deliveryIsAcceptedOnce() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xd");
        assertThrows(IllegalEscrowStateException.class, () -> escrows.submitDelivery(id, "0xother"));
    }

    @Test
    void concurrentSettlesMoveFundsOnce() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xd");

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<SettlementResult>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                SettlementOutcome outcome = i % 2 == 0 ? SettlementOutcome.PAID : SettlementOutcome.REFUNDED;
                Callable<SettlementResult> task = () -> {
                    go.await();
                    return escrows.settle(id, outcome, "0xd");
                };
                attempts.add(pool.submit(task));
            }
            go.countDown();

            int settled = 0;
            int rejected = 0;
            for (Future<SettlementResult> f : attempts) {
                try {
                    f.get();
                    settled++;
                } catch (ExecutionException e) {
                    assertTrue(e.getCause() instanceof AlreadySettledException);
                    rejected++;
                }
            }
            assertEquals(1, settled);
            assertEquals(threads - 1, rejected);
            assertEquals(1, ledger.settleCalls(id));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void claimRefundOnlyAfterDeadline() throws Exception {
        long id = create();
        assertThrows(IllegalEscrowStateException.class, () -> escrows.claimRefund(id));

        clock.advance(Duration.ofHours(1).plusSeconds(1));
        Optional<String> tx = escrows.claimRefund(id);

        assertTrue(tx.isPresent());
        assertEquals(EscrowStatus.REFUNDED, escrows.get(id).status());
        assertEquals(List.of(id), ledger.refunds());
        // terminal: a second claim is a no-op
        assertTrue(escrows.claimRefund(id).isEmpty());
        assertTrue(escrows.emergencyRefund(id).isEmpty());
        assertEquals(1, ledger.refunds().size());
    }

    @Test
    void emergencyRefundWaitsForGracePeriod() throws Exception {
        long id = create();
        clock.advance(Duration.ofHours(2));
        assertThrows(IllegalEscrowStateException.class, () -> escrows.emergencyRefund(id));

        clock.advance(Duration.ofHours(24));
        assertTrue(escrows.emergencyRefund(id).isPresent());
        assertEquals(EscrowStatus.REFUNDED, escrows.get(id).status());
    }

    @Test
    void refundOfSettledEscrowIsANoOp() throws Exception {
        long id = create();
        escrows.submitDelivery(id, "0xd");
        escrows.verifyAndSettle(id, "0xd");
        clock.advance(Duration.ofDays(3));

        assertTrue(escrows.claimRefund(id).isEmpty());
        assertTrue(ledger.refunds().isEmpty());
    }

    @Test
    void unknownEscrow() {
        assertThrows(EscrowNotFoundException.class, () -> escrows.get(42));
    }

    @Test
    void ledgerFailurePropagates() {
        ledger.failCreates = true;
        assertThrows(IOException.class, this::create);
    }
}
