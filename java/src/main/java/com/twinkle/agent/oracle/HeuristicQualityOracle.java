package com.twinkle.agent.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Deterministic scorer for deliveries shaped like {@code {summary, confidence, dataPoints,
 * recommendations}}: confidence times ten, half a point per data point (at most +2.5), one
 * point for recommendations, minus two for a summary under 40 characters.
 */
public class HeuristicQualityOracle implements QualityOracle {

    private static final int MAX_DATA_POINTS = 5;
    private static final int SHALLOW_SUMMARY = 40;

    @Override
    public QualityAssessment evaluate(JsonNode delivery, String providerName, double threshold, String category) {
        JsonNode analysis = delivery != null && delivery.has("analysis") ? delivery.get("analysis") : delivery;
        if (analysis == null || !analysis.isObject()) {
            return new QualityAssessment(0, false, providerName + ": no analysis delivered").against(threshold);
        }

        double score = analysis.path("confidence").asDouble(0) * 10;

        JsonNode points = analysis.path("dataPoints");
        int count = points.isArray() ? points.size() : points.asInt(0);
        score += Math.min(count, MAX_DATA_POINTS) * 0.5;

        JsonNode recommendations = analysis.path("recommendations");
        if (recommendations.isArray() && recommendations.size() > 0) {
            score += 1;
        }
        if (analysis.path("summary").asText("").length() < SHALLOW_SUMMARY) {
            score -= 2;
        }

        String reasoning = String.format("%s: confidence %.2f, %d data point(s)%s",
                providerName, analysis.path("confidence").asDouble(0), count,
                category != null ? " [" + category + "]" : "");
        return new QualityAssessment(score, score >= threshold, reasoning).against(threshold);
    }
}
