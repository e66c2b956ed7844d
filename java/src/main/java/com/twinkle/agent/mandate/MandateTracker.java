package com.twinkle.agent.mandate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Builds the mandate chain of a single run.
 *
 * <p>Carts must hang off the run's intent and payments off an existing cart; the only
 * mutations after creation are the payment settlement and the chain completion.
 */
public class MandateTracker {

    public static final long DEFAULT_TTL_SECONDS = 300;

    private final Clock clock;
    private final MandateChain chain;
    private final Map<String, Mandate> byId = new ConcurrentHashMap<>();
    private volatile IntentMandate intent;

    public MandateTracker() {
        this(Clock.systemUTC());
    }

    public MandateTracker(Clock clock) {
        this.clock = clock;
        this.chain = new MandateChain(newId("chain"), clock.instant());
    }

    public synchronized IntentMandate createIntent(String description, Amount budget, long ttlSeconds,
                                                   List<String> allowedProviders) {
        IntentMandate created = new IntentMandate(newId("mandate"), clock.instant(), description, budget,
                ttlSeconds, allowedProviders);
        intent = created;
        record(created);
        return created;
    }

    public IntentMandate createIntent(String description, Amount budget, long ttlSeconds) {
        return createIntent(description, budget, ttlSeconds, null);
    }

    public IntentMandate createIntent(String description, Amount budget) {
        return createIntent(description, budget, DEFAULT_TTL_SECONDS, null);
    }

    public CartMandate createCart(String provider, String providerName, Amount price, String service,
                                  String x402Endpoint) {
        IntentMandate parent = intent;
        if (parent == null) {
            throw new NoIntentException();
        }
        CartMandate.LineItem item = new CartMandate.LineItem(service, price, providerName + " " + service);
        CartMandate cart = new CartMandate(newId("mandate"), clock.instant(), parent.id, provider,
                providerName, List.of(item), x402Endpoint);
        record(cart);
        return cart;
    }

    public PaymentMandate createPayment(String cartId, String escrowId, String txHash, Amount amount,
                                        String provider, String x402Cost) {
        Mandate parent = byId.get(cartId);
        if (!(parent instanceof CartMandate)) {
            throw new UnknownMandateException(MandateType.CART, cartId);
        }
        PaymentMandate payment = new PaymentMandate(newId("mandate"), clock.instant(), cartId, escrowId,
                txHash, amount, provider, x402Cost);
        record(payment);
        return payment;
    }

    /**
     * Moves a locked payment to its terminal status. Unknown ids and already-settled
     * payments are left untouched: the escrow, not this chain, is the source of truth.
     *
     * @return whether the payment changed
     */
    public boolean settlePayment(String paymentId, PaymentStatus outcome, String reference) {
        Mandate mandate = byId.get(paymentId);
        if (!(mandate instanceof PaymentMandate)) {
            return false;
        }
        return ((PaymentMandate) mandate).settle(outcome, reference);
    }

    /**
     * Writes the chain outcome. {@code success} and {@code failure} need every payment to be
     * terminal; {@code expired} may close a chain with payments still locked.
     */
    public synchronized void complete(ChainOutcome outcome) {
        if (chain.outcome() != null) {
            throw new IllegalStateException("Chain " + chain.chainId + " already completed as "
                    + chain.outcome().wireName());
        }
        if (outcome != ChainOutcome.EXPIRED) {
            long locked = payments().stream().filter(p -> !p.status().isTerminal()).count();
            if (locked > 0) {
                throw new IllegalStateException(locked + " payment mandate(s) still locked");
            }
        }
        chain.complete(outcome, clock.instant());
    }

    public MandateChain chain() {
        return chain;
    }

    public Optional<IntentMandate> intent() {
        return Optional.ofNullable(intent);
    }

    public Optional<Mandate> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public <T extends Mandate> List<T> byType(MandateType type, Class<T> kind) {
        return chain.mandates().stream()
                .filter(m -> m.type == type)
                .map(kind::cast)
                .collect(Collectors.toList());
    }

    public List<CartMandate> carts() {
        return byType(MandateType.CART, CartMandate.class);
    }

    public List<PaymentMandate> payments() {
        return byType(MandateType.PAYMENT, PaymentMandate.class);
    }

    private void record(Mandate mandate) {
        byId.put(mandate.id, mandate);
        chain.append(mandate);
    }

    private String newId(String prefix) {
        return prefix + "_" + clock.millis() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }
}
