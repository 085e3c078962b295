package com.trender.pipeline.scoring;

/**
 * Weights of the momentum formula: {@code recencyWeight * recency + starWeight * normalizedStars}.
 *
 * <p>The formula has changed several times; keep every weight here rather than at call sites.</p>
 *
 * @param recencyWeight weight of the age-based recency score
 * @param starWeight    weight of the cohort-normalized star count
 */
public record ScoringPolicy(double recencyWeight, double starWeight) {

    public static final ScoringPolicy DEFAULT = new ScoringPolicy(0.7, 0.3);

    private static final double EPSILON = 1e-6;

    public ScoringPolicy {
        if (recencyWeight < 0 || starWeight < 0) {
            throw new IllegalArgumentException(
                    "Momentum weights must be non-negative: recency=" + recencyWeight + ", stars=" + starWeight);
        }
        if (Math.abs(recencyWeight + starWeight - 1.0) > EPSILON) {
            throw new IllegalArgumentException(
                    "Momentum weights must sum to 1.0: recency=" + recencyWeight + ", stars=" + starWeight);
        }
    }

    /**
     * Blended momentum in [0, 1], rounded to four decimals.
     */
    public double momentum(double recencyScore, double normalizedStars) {
        double raw = recencyWeight * recencyScore + starWeight * normalizedStars;
        return MetricsCalculator.round(raw, 4);
    }
}
