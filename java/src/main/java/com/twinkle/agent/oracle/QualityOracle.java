package com.twinkle.agent.oracle;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/** Scores a delivered analysis. Implementations need not clamp; callers normalize. */
public interface QualityOracle {
    QualityAssessment evaluate(JsonNode delivery, String providerName, double threshold, String category)
            throws IOException, InterruptedException;
}
