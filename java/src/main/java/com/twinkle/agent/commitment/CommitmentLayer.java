package com.twinkle.agent.commitment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twinkle.agent.escrow.EscrowAccessor;
import com.twinkle.agent.escrow.EscrowHandle;
import com.twinkle.agent.escrow.EscrowTerms;
import com.twinkle.agent.event.EventLog;
import com.twinkle.agent.event.EventType;
import com.twinkle.x402.crypto.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.twinkle.agent.event.EventLog.fields;

/**
 * Commit-then-reveal wrapper around a {@link CommitmentPrimitive} for one run.
 *
 * <p>Every commit is followed by a bounded decrypt-and-verify poll. The instance owns the
 * run's encryption accounting, so a new layer is built per run.
 */
public class CommitmentLayer {

    private static final Logger log = LoggerFactory.getLogger(CommitmentLayer.class);

    private static final int PREVIEW_HEX_CHARS = 40;

    private final CommitmentPrimitive primitive;
    private final EventLog events;
    private final ObjectMapper mapper;
    private final PollingPolicy polling;
    private final Clock clock;
    private final Sleeper sleeper;

    private final AtomicInteger encryptions = new AtomicInteger();
    private final AtomicInteger messages = new AtomicInteger();
    private final Set<Layer> activeLayers = new LinkedHashSet<>();

    public CommitmentLayer(CommitmentPrimitive primitive, EventLog events, ObjectMapper mapper,
                           PollingPolicy polling, Clock clock, Sleeper sleeper) {
        this.primitive = primitive;
        this.events = events;
        this.mapper = mapper;
        this.polling = polling;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /** Layer 1: the serialized execution plan, committed before anything is bought. */
    public CommitmentResult commitStrategy(Object plan) throws InterruptedException {
        String json = toJson(plan, Layer.STRATEGY);
        return commitAndVerify(Layer.STRATEGY, "strategy-commitment", Hashes.utf8Hex(json),
                fields("preview", abbreviate(json, 100)));
    }

    /** Layer 3: the raw query text. */
    public CommitmentResult commitQuery(String query) throws InterruptedException {
        return commitAndVerify(Layer.QUERY, "encrypted-query", Hashes.utf8Hex(query),
                fields("preview", abbreviate(query, 80)));
    }

    /** Layer 4: every settlement decision of the run in one batch, revealed together. */
    public CommitmentResult commitSettlements(List<?> decisions) throws InterruptedException {
        String json = toJson(decisions, Layer.SETTLEMENT);
        return commitAndVerify(Layer.SETTLEMENT, "settlement-batch", Hashes.utf8Hex(json),
                fields("count", decisions.size()));
    }

    /**
     * Layer 2: creates an escrow through the encrypted-transaction path. The creation call
     * itself is what stays confidential; nothing is read back.
     */
    public EncryptedEscrow createEncryptedEscrow(EscrowAccessor escrows, EscrowTerms terms)
            throws IOException, InterruptedException {
        events.emit(EventType.BITE_ENCRYPTING, "encrypted-escrow", fields(
                "layer", Layer.ESCROW.wireName(),
                "seller", terms.seller,
                "amount", terms.amount.toString()));

        EscrowHandle handle = escrows.create(terms.encrypted(true));
        encryptions.incrementAndGet();
        markActive(Layer.ESCROW);

        CommitmentResult result = new CommitmentResult(Layer.ESCROW, handle.reference, true,
                handle.sentAt, handle.receivedAt, null, "escrow:" + handle.escrowId, null);
        events.emit(EventType.BITE_COMMITTED, "encrypted-escrow", fields(
                "txHash", handle.reference,
                "escrowId", handle.escrowId,
                "timing", result.roundTripMillis(),
                "layer", Layer.ESCROW.wireName()), result);
        return new EncryptedEscrow(handle, result);
    }

    /**
     * Commits hex data under the given layer.
     *
     * @throws CommitFailedException if the primitive raises or reports a failed commit
     */
    public CommitReceipt commit(String hexPayload, Layer layer) throws InterruptedException {
        CommitReceipt receipt;
        try {
            receipt = primitive.commitEncrypted(hexPayload);
        } catch (IOException e) {
            throw new CommitFailedException(layer, "Commit failed for layer " + layer.wireName() + ": "
                    + e.getMessage(), e);
        }
        if (receipt == null || !receipt.success) {
            throw new CommitFailedException(layer, "Commit failed for layer " + layer.wireName()
                    + (receipt == null ? "" : " (tx " + receipt.reference + ")"));
        }
        encryptions.incrementAndGet();
        messages.incrementAndGet();
        markActive(layer);
        return receipt;
    }

    /**
     * Polls for the decrypted payload of {@code reference} and compares it with what was committed.
     * Both sides are compared without {@code 0x} and case; a decrypted payload that contains the
     * expected one also counts as verified, since the oracle may return it padded.
     *
     * @throws DecryptTimeoutException if no decryption arrives within the policy's attempts or timeout
     */
    public VerificationResult decryptAndVerify(String reference, String expectedPayload, PollingPolicy policy)
            throws InterruptedException {
        Instant start = clock.instant();
        Instant deadline = start.plus(policy.timeout);
        IOException last = null;
        int attempt = 0;

        while (attempt < policy.maxAttempts) {
            attempt++;
            try {
                String observed = primitive.decryptCommitment(reference);
                if (observed != null) {
                    return new VerificationResult(matches(observed, expectedPayload), observed,
                            clock.instant(), attempt);
                }
            } catch (IOException e) {
                last = e;
                log.debug("Decrypt attempt {}/{} for {} not ready: {}", attempt, policy.maxAttempts,
                        reference, e.getMessage());
            }
            if (attempt >= policy.maxAttempts || !clock.instant().plus(policy.interval).isBefore(deadline)) {
                break;
            }
            sleeper.sleep(policy.interval);
        }
        throw new DecryptTimeoutException(reference, attempt,
                Duration.between(start, clock.instant()).toMillis(), last);
    }

    public CommitmentStats stats() {
        synchronized (activeLayers) {
            return new CommitmentStats(encryptions.get(), messages.get(), new ArrayList<>(activeLayers));
        }
    }

    static boolean matches(String observed, String expected) {
        String o = normalize(observed);
        String e = normalize(expected);
        if (e.isEmpty()) {
            return o.isEmpty();
        }
        return o.equals(e) || o.contains(e);
    }

    private CommitmentResult commitAndVerify(Layer layer, String phase, String hex, Map<String, Object> detail)
            throws InterruptedException {
        Map<String, Object> encrypting = fields("layer", layer.wireName(), "dataSize", hex.length());
        encrypting.putAll(detail);
        events.emit(EventType.BITE_ENCRYPTING, phase, encrypting);

        CommitReceipt receipt = commit(hex, layer);
        events.emit(EventType.BITE_COMMITTED, phase, fields(
                "txHash", receipt.reference,
                "timing", Duration.between(receipt.sentAt, receipt.receivedAt).toMillis(),
                "layer", layer.wireName()));

        VerificationResult verification = decryptAndVerify(receipt.reference, hex, polling);
        CommitmentResult result = new CommitmentResult(layer, receipt.reference, true, receipt.sentAt,
                receipt.receivedAt, verification.decryptedAt, hex.substring(0, Math.min(PREVIEW_HEX_CHARS, hex.length())),
                verification.verified);
        events.emit(EventType.BITE_VERIFIED, phase, fields(
                "txHash", receipt.reference,
                "verified", verification.verified,
                "layer", layer.wireName()), result);

        log.info("[{}] committed {} (verified={})", layer.wireName(), receipt.reference, verification.verified);
        return result;
    }

    private void markActive(Layer layer) {
        synchronized (activeLayers) {
            activeLayers.add(layer);
        }
    }

    private String toJson(Object value, Layer layer) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CommitFailedException(layer, "Could not serialize " + layer.wireName() + " payload", e);
        }
    }

    private static String normalize(String hex) {
        String h = hex.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("0x") ? h.substring(2) : h;
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    /** Escrow created through the encrypted path, with its commitment record. */
    public static final class EncryptedEscrow {
        public final EscrowHandle handle;
        public final CommitmentResult commitment;

        EncryptedEscrow(EscrowHandle handle, CommitmentResult commitment) {
            this.handle = handle;
            this.commitment = commitment;
        }
    }
}
