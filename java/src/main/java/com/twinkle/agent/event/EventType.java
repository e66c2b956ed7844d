package com.twinkle.agent.event;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle events of a procurement run, with their wire names. */
public enum EventType {
    AGENT_START("agent:start"),
    ENCRYPTION_DECISION("encryption:decision"),
    BITE_ENCRYPTING("bite:encrypting"),
    BITE_COMMITTED("bite:committed"),
    BITE_VERIFIED("bite:verified"),
    PROVIDER_DISCOVERED("provider:discovered"),
    PROVIDER_SELECTED("provider:selected"),
    X402_CHALLENGE("x402:challenge"),
    X402_PAYMENT("x402:payment"),
    X402_SUCCESS("x402:success"),
    ESCROW_CREATED("escrow:created"),
    ESCROW_RESPONSE("escrow:response"),
    ESCROW_SETTLED("escrow:settled"),
    QUALITY_EVALUATED("quality:evaluated"),
    REPUTATION_UPDATED("reputation:updated"),
    SYNTHESIS_COMPLETE("synthesis:complete"),
    AGENT_RECEIPT("agent:receipt"),
    AGENT_ERROR("agent:error"),
    AP2_INTENT("ap2:intent"),
    AP2_CART("ap2:cart"),
    AP2_PAYMENT("ap2:payment"),
    AP2_SETTLED("ap2:settled"),
    AP2_COMPLETE("ap2:complete");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
