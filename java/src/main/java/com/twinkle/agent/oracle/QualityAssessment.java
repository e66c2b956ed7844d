package com.twinkle.agent.oracle;

/** Quality score of one delivery on a 0-10 scale. */
public final class QualityAssessment {

    static final double NEUTRAL_SCORE = 5;

    public final double score;
    public final boolean passed;
    public final String reasoning;

    public QualityAssessment(double score, boolean passed, String reasoning) {
        this.score = score;
        this.passed = passed;
        this.reasoning = reasoning;
    }

    /**
     * Clamps the score into [0, 10] and recomputes {@code passed} as {@code score >= threshold},
     * whatever the oracle claimed. A non-finite score is treated as neutral (5).
     */
    public QualityAssessment against(double threshold) {
        double s = Double.isFinite(score) ? Math.min(10, Math.max(0, score)) : NEUTRAL_SCORE;
        String why = reasoning != null && !reasoning.isBlank() ? reasoning : "Score: " + s + "/" + threshold;
        return new QualityAssessment(s, s >= threshold, why);
    }

    /** Stand-in when the oracle is unreachable. */
    public static QualityAssessment unavailable(double threshold, String cause) {
        return new QualityAssessment(NEUTRAL_SCORE, false, "Quality oracle unavailable: " + cause).against(threshold);
    }
}
