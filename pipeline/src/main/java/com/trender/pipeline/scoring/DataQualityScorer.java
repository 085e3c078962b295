package com.trender.pipeline.scoring;

import com.trender.pipeline.model.ActivityMetrics;
import com.trender.pipeline.model.RepositoryCandidate;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Data-quality score of a repository record, 0.0-1.0:
 * {@code 0.4 * completeness + 0.3 * freshness + 0.3 * validity}, rounded to two decimals.
 */
public final class DataQualityScorer {

    static final double COMPLETENESS_WEIGHT = 0.4;
    static final double FRESHNESS_WEIGHT = 0.3;
    static final double VALIDITY_WEIGHT = 0.3;

    static final Set<String> VALID_LANGUAGES = Set.of(
            "Python", "TypeScript", "JavaScript", "Go", "Java",
            "C++", "C", "Ruby", "PHP", "C#", "Rust", "Swift");

    private static final int REQUIRED_FIELDS = 6;
    private static final int OPTIONAL_FIELDS = 5;

    private DataQualityScorer() {
    }

    public static double score(RepositoryCandidate repo, ActivityMetrics activity, Instant now) {
        double total = COMPLETENESS_WEIGHT * completeness(repo, activity)
                + FRESHNESS_WEIGHT * freshness(repo.updatedAt(), now)
                + VALIDITY_WEIGHT * validity(repo);
        return MetricsCalculator.round(total, 2);
    }

    /**
     * Required fields (name, URL, language, stars, created, updated) carry 70%, optional
     * fields (description, forks, open issues, recent commits, contributors) 30%.
     * A field counts only when it is non-null, non-blank and non-zero.
     */
    static double completeness(RepositoryCandidate repo, ActivityMetrics activity) {
        long required = Stream.of(
                        hasText(repo.fullName()),
                        hasText(repo.htmlUrl()),
                        hasText(repo.language()),
                        isNonZero(repo.stargazersCount()),
                        repo.createdAt() != null,
                        repo.updatedAt() != null)
                .filter(Boolean::booleanValue)
                .count();
        long optional = Stream.of(
                        hasText(repo.description()),
                        isNonZero(repo.forksCount()),
                        isNonZero(repo.openIssuesCount()),
                        activity.commitsLast7Days() != 0,
                        activity.activeContributors() != 0)
                .filter(Boolean::booleanValue)
                .count();

        return (double) required / REQUIRED_FIELDS * 0.7 + (double) optional / OPTIONAL_FIELDS * 0.3;
    }

    /**
     * Step function on whole days since the last update; 0.5 when unknown.
     */
    static double freshness(Instant updatedAt, Instant now) {
        if (updatedAt == null) {
            return 0.5;
        }
        long days = Duration.between(updatedAt, now).toDays();
        if (days <= 1) {
            return 1.0;
        } else if (days <= 7) {
            return 0.9;
        } else if (days <= 30) {
            return 0.7;
        } else if (days <= 90) {
            return 0.5;
        }
        return 0.3;
    }

    /**
     * Starts at 1.0 and subtracts: negative stars 0.3; negative forks 0.2, or forks above
     * twice the stars 0.1; created after updated 0.2; missing or unrecognized language 0.1.
     */
    static double validity(RepositoryCandidate repo) {
        long stars = repo.stargazersCount() != null ? repo.stargazersCount() : 0;
        long forks = repo.forksCount() != null ? repo.forksCount() : 0;

        // penalties in hundredths to keep the arithmetic exact
        int penalty = 0;
        if (stars < 0) {
            penalty += 30;
        }
        if (forks < 0) {
            penalty += 20;
        } else if (stars > 0 && forks > stars * 2) {
            penalty += 10;
        }
        if (repo.createdAt() != null && repo.updatedAt() != null
                && repo.createdAt().isAfter(repo.updatedAt())) {
            penalty += 20;
        }
        if (repo.language() == null || !VALID_LANGUAGES.contains(repo.language())) {
            penalty += 10;
        }
        return Math.max(0, 100 - penalty) / 100.0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean isNonZero(Long value) {
        return value != null && value != 0;
    }
}
