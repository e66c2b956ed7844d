package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Accountability record of one run: Intent, then Carts, then Payments. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MandateChain {
    public final String chainId;
    public final Instant created;

    private final List<Mandate> mandates = new ArrayList<>();
    private Instant completed;
    private ChainOutcome outcome;

    MandateChain(String chainId, Instant created) {
        this.chainId = chainId;
        this.created = created;
    }

    @JsonProperty
    public synchronized List<Mandate> mandates() {
        return List.copyOf(mandates);
    }

    @JsonProperty
    public synchronized Instant completed() {
        return completed;
    }

    @JsonProperty
    public synchronized ChainOutcome outcome() {
        return outcome;
    }

    synchronized void append(Mandate mandate) {
        mandates.add(mandate);
    }

    synchronized void complete(ChainOutcome outcome, Instant at) {
        this.outcome = outcome;
        this.completed = at;
    }
}
