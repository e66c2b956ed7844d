package com.twinkle.agent.mandate;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** Common header of every entry in a mandate chain. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class Mandate {
    public final String id;
    public final MandateType type;
    public final Instant timestamp;

    /** Id of the mandate this one was issued under; null for the intent. */
    public final String parentId;

    protected Mandate(String id, MandateType type, Instant timestamp, String parentId) {
        this.id = id;
        this.type = type;
        this.timestamp = timestamp;
        this.parentId = parentId;
    }
}
