package com.twinkle.agent.commitment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinkle.agent.FakeCommitmentPrimitive;
import com.twinkle.agent.InMemoryEscrowLedger;
import com.twinkle.agent.escrow.EscrowAccessor;
import com.twinkle.agent.escrow.EscrowTerms;
import com.twinkle.agent.event.AgentEvent;
import com.twinkle.agent.event.EventLog;
import com.twinkle.agent.event.EventType;
import com.twinkle.x402.crypto.Hashes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommitmentLayerTest {

    final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    final PollingPolicy fast = new PollingPolicy(Duration.ZERO, 15, Duration.ofSeconds(30));

    FakeCommitmentPrimitive primitive;
    EventLog events;
    List<Duration> sleeps;
    CommitmentLayer layer;

    @BeforeEach
    void setUp() {
        primitive = new FakeCommitmentPrimitive(clock);
        events = new EventLog(clock);
        sleeps = new ArrayList<>();
        layer = new CommitmentLayer(primitive, events, new ObjectMapper(), fast, clock, sleeps::add);
    }

    @Test
    void queryCommitRoundTripsAndVerifies() throws Exception {
        CommitmentResult result = layer.commitQuery("Analyze SOL");

        assertEquals(Layer.QUERY, result.layer);
        assertTrue(result.encrypted);
        assertTrue(result.isVerified());
        assertEquals(Hashes.utf8Hex("Analyze SOL"), primitive.payloads().get(0));
        assertEquals(List.of(EventType.BITE_ENCRYPTING, EventType.BITE_COMMITTED, EventType.BITE_VERIFIED),
                events.all().stream().map(e -> e.type).collect(java.util.stream.Collectors.toList()));
        AgentEvent verified = events.ofType(EventType.BITE_VERIFIED).get(0);
        assertSame(result, verified.commitment);
        assertEquals("query", verified.data.get("layer"));
    }

    @Test
    void strategyPayloadIsTheSerializedPlan() throws Exception {
        Map<String, Object> plan = EventLog.fields("query", "q", "budget", "0.10");
        layer.commitStrategy(plan);

        assertEquals(Hashes.utf8Hex("{\"query\":\"q\",\"budget\":\"0.10\"}"), primitive.payloads().get(0));
    }

    @Test
    void previewIsFirstFortyHexChars() throws Exception {
        CommitmentResult result = layer.commitQuery("a fairly long query that runs past twenty bytes");
        assertEquals(40, result.dataPreview.length());
        assertTrue(Hashes.utf8Hex("a fairly long query that runs past twenty bytes").startsWith(result.dataPreview));
    }

    @Test
    void tamperedDecryptionIsNotVerified() throws Exception {
        primitive.tamperWith = "deadbeef";
        CommitmentResult result = layer.commitQuery("q");
        assertFalse(result.isVerified());
        assertEquals(Boolean.FALSE, result.verified);
    }

    @Test
    void tamperedDecryptionOfEmptyQueryIsNotVerified() throws Exception {
        primitive.tamperWith = "deadbeef";
        assertFalse(layer.commitQuery("").isVerified());
    }

    @Test
    void emptyQueryRoundTripVerifies() throws Exception {
        assertTrue(layer.commitQuery("").isVerified());
    }

    @Test
    void paddedDecryptionStillVerifies() throws Exception {
        // the decrypted payload may carry trailing padding; containment is accepted
        primitive.padding = "0000";
        assertTrue(layer.commitQuery("q").isVerified());
    }

    @Test
    void matchingIgnoresPrefixAndCase() {
        assertTrue(CommitmentLayer.matches("0xABCDEF", "abcdef"));
        assertTrue(CommitmentLayer.matches("abcdef", "0xabcdef"));
        assertFalse(CommitmentLayer.matches("0xabcd", "abcdef"));
        // lenient: any decrypted payload containing the expected one verifies
        assertTrue(CommitmentLayer.matches("0x11abcdef22", "abcdef"));
        // an empty expectation only matches an empty payload
        assertTrue(CommitmentLayer.matches("0x", ""));
        assertFalse(CommitmentLayer.matches("0xdeadbeef", "0x"));
    }

    @Test
    void pollsUntilDecryptionIsReady() throws Exception {
        primitive.notReadyAttempts = 3;
        CommitReceipt receipt = layer.commit("abcd", Layer.QUERY);

        VerificationResult result = layer.decryptAndVerify(receipt.reference, "abcd", fast);

        assertTrue(result.verified);
        assertEquals(4, result.attempts);
        assertEquals(3, sleeps.size());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        primitive.neverDecrypt = true;
        CommitReceipt receipt = layer.commit("abcd", Layer.QUERY);
        PollingPolicy three = new PollingPolicy(Duration.ofMillis(10), 3, Duration.ofSeconds(30));

        DecryptTimeoutException ex = assertThrows(DecryptTimeoutException.class,
                () -> layer.decryptAndVerify(receipt.reference, "abcd", three));

        assertEquals(receipt.reference, ex.reference());
        assertTrue(ex.getMessage().contains("3 attempt(s)"));
        assertEquals(3, primitive.polls(receipt.reference));
        assertEquals(2, sleeps.size());
    }

    @Test
    void stopsWhenTheNextPollWouldPassTheTimeout() throws Exception {
        primitive.neverDecrypt = true;
        CommitReceipt receipt = layer.commit("abcd", Layer.QUERY);
        PollingPolicy slow = new PollingPolicy(Duration.ofSeconds(30), 15, Duration.ofSeconds(30));

        assertThrows(DecryptTimeoutException.class, () -> layer.decryptAndVerify(receipt.reference, "abcd", slow));
        assertEquals(1, primitive.polls(receipt.reference));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void commitFailuresRaise() {
        primitive.failCommits = true;
        CommitFailedException io = assertThrows(CommitFailedException.class, () -> layer.commitQuery("q"));
        assertEquals(Layer.QUERY, io.layer());
        assertTrue(io.getCause() instanceof java.io.IOException);

        primitive.failCommits = false;
        primitive.rejectCommits = true;
        CommitFailedException rejected = assertThrows(CommitFailedException.class,
                () -> layer.commitSettlements(List.of()));
        assertEquals(Layer.SETTLEMENT, rejected.layer());
        assertEquals(0, layer.stats().encryptions);
    }

    @Test
    void encryptedEscrowCountsAsEncryptionNotMessage() throws Exception {
        InMemoryEscrowLedger ledger = new InMemoryEscrowLedger(clock);
        EscrowAccessor escrows = new EscrowAccessor(ledger, clock, Duration.ofHours(24));
        EscrowTerms terms = new EscrowTerms("0xSeller", "0xUSDC", BigInteger.valueOf(100_000),
                clock.instant().plusSeconds(3600), "0xreq", false);

        CommitmentLayer.EncryptedEscrow created = layer.createEncryptedEscrow(escrows, terms);
        layer.commitQuery("q");

        assertTrue(created.handle.encrypted);
        assertTrue(ledger.created().get(0).encrypted);
        assertNull(created.commitment.verified);
        assertEquals("escrow:" + created.handle.escrowId, created.commitment.dataPreview);

        CommitmentStats stats = layer.stats();
        assertEquals(2, stats.encryptions);
        assertEquals(1, stats.messages);
        assertEquals(List.of(Layer.ESCROW, Layer.QUERY), stats.layers);
    }
}
