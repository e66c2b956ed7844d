package com.twinkle.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.twinkle.agent.commitment.CommitmentResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One entry of the event log. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentEvent {
    public final EventType type;
    public final Instant timestamp;
    public final String phase;
    public final Map<String, Object> data;

    /** Commitment the event refers to, when it has one. */
    public final CommitmentResult commitment;

    public AgentEvent(EventType type, Instant timestamp, String phase,
                      Map<String, Object> data, CommitmentResult commitment) {
        this.type = type;
        this.timestamp = timestamp;
        this.phase = phase;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.commitment = commitment;
    }

    @Override
    public String toString() {
        return type.wireName() + "@" + phase + " " + data;
    }
}
