package com.trender.pipeline.loader;

/**
 * A staging row with its scores and ranks for one snapshot date.
 *
 * @param row             extracted staging row
 * @param recencyScore    age-based decay, 0-1
 * @param normalizedStars stars divided by the cohort maximum, 0-1
 * @param momentumScore   policy-weighted blend of recency and normalized stars
 * @param starVelocity    stars gained since the previous snapshot, as a percentage
 * @param activityScore   weighted recent activity
 * @param starRank        1-based position by stars across the extract (audit only)
 * @param overallRank     1-based position by momentum across the extract
 * @param languageRank    1-based position by momentum within the row's language
 */
public record RankedRepository(
        StagingRow row,
        double recencyScore,
        double normalizedStars,
        double momentumScore,
        double starVelocity,
        double activityScore,
        int starRank,
        int overallRank,
        int languageRank
) {}
