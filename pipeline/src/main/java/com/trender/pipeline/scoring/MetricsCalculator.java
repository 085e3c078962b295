package com.trender.pipeline.scoring;

import com.trender.pipeline.model.ActivityMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Ranking metrics: recency decay, cohort-normalized stars, star velocity and activity.
 * All functions are pure; age-dependent ones take {@code now} explicitly.
 */
public final class MetricsCalculator {

    /** Score for a repository whose creation time is unknown. */
    static final double UNKNOWN_AGE_RECENCY = 0.01;

    private MetricsCalculator() {
    }

    /**
     * Step-function decay on whole days since creation:
     * <pre>
     *   <= 14 days  1.00
     *   <= 30 days  0.85
     *   <= 60 days  0.60
     *   <= 90 days  0.35
     *   <= 180 days 0.15
     *   <= 365 days 0.05
     *   older       0.01
     * </pre>
     */
    public static double recencyScore(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return UNKNOWN_AGE_RECENCY;
        }
        long ageDays = Duration.between(createdAt, now).toDays();
        if (ageDays <= 14) {
            return 1.0;
        } else if (ageDays <= 30) {
            return 0.85;
        } else if (ageDays <= 60) {
            return 0.60;
        } else if (ageDays <= 90) {
            return 0.35;
        } else if (ageDays <= 180) {
            return 0.15;
        } else if (ageDays <= 365) {
            return 0.05;
        }
        return 0.01;
    }

    /**
     * Stars divided by the cohort maximum, in [0, 1]. Zero when the cohort has no stars.
     */
    public static double normalizedStars(long stars, long cohortMaxStars) {
        if (cohortMaxStars <= 0 || stars <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) stars / cohortMaxStars);
    }

    /**
     * Recent star growth as a percentage of current stars, two decimals.
     */
    public static double starVelocity(long currentStars, long starsGained) {
        if (currentStars <= 0) {
            return 0.0;
        }
        return round((double) starsGained / currentStars * 100, 2);
    }

    /**
     * Weighted activity: commits 0.4, closed issues 0.3, contributors 0.3. Two decimals.
     */
    public static double activityScore(ActivityMetrics activity) {
        double raw = activity.commitsLast7Days() * 0.4
                + activity.issuesClosedLast7Days() * 0.3
                + activity.activeContributors() * 0.3;
        return round(raw, 2);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
