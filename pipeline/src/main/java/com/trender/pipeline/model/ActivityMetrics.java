package com.trender.pipeline.model;

/**
 * Recent activity counts for a repository, fetched alongside the README.
 */
public record ActivityMetrics(
        int commitsLast7Days,
        int issuesClosedLast7Days,
        int activeContributors
) {

    public static final ActivityMetrics NONE = new ActivityMetrics(0, 0, 0);
}
