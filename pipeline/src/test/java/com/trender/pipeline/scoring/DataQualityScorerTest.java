package com.trender.pipeline.scoring;

import com.trender.pipeline.model.ActivityMetrics;
import com.trender.pipeline.model.RepositoryCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DataQualityScorer}.
 */
class DataQualityScorerTest {

    private static final Instant T0 = Instant.parse("2025-02-01T00:00:00Z");

    private static RepositoryCandidate repo(String language, Long stars, Long forks, Long issues,
                                            String description, Instant createdAt, Instant updatedAt) {
        return new RepositoryCandidate("a/b", "https://github.com/a/b", language, description,
                stars, forks, issues, createdAt, updatedAt, List.of(), new RepositoryCandidate.Owner("a"));
    }

    @Test
    @DisplayName("Complete required fields, no optional fields, fresh and valid scores 0.88")
    void score_endToEnd() {
        Instant updated = T0.plus(Duration.ofDays(1));
        RepositoryCandidate candidate = repo("Go", 120L, null, null, null, T0, updated);

        double score = DataQualityScorer.score(candidate, ActivityMetrics.NONE, updated);

        // 0.4 * 0.7 + 0.3 * 1.0 + 0.3 * 1.0
        assertEquals(0.88, score);
    }

    @Test
    @DisplayName("Fully populated, fresh and valid record scores 1.0")
    void score_perfect() {
        RepositoryCandidate candidate = repo("Python", 500L, 40L, 12L, "A web framework", T0, T0);

        assertEquals(1.0, DataQualityScorer.score(candidate, new ActivityMetrics(8, 2, 4), T0));
    }

    @Test
    @DisplayName("Score stays within [0, 1] for an empty record")
    void score_bounds() {
        RepositoryCandidate empty = new RepositoryCandidate(null, null, null, null, null, null, null,
                null, null, null, null);

        double score = DataQualityScorer.score(empty, ActivityMetrics.NONE, T0);

        assertTrue(score >= 0.0 && score <= 1.0, "score out of bounds: " + score);
        // 0.4 * 0 + 0.3 * 0.5 + 0.3 * 0.9
        assertEquals(0.42, score);
    }

    @Test
    @DisplayName("Zero counts and blank strings do not count as present")
    void completeness_zeroAndBlankAreAbsent() {
        RepositoryCandidate candidate = repo("Go", 0L, 0L, 0L, "  ", T0, T0);

        // 5 of 6 required (stars missing), none optional
        assertEquals(5.0 / 6 * 0.7, DataQualityScorer.completeness(candidate, ActivityMetrics.NONE), 1e-9);
    }

    @Test
    @DisplayName("Freshness: updated 1 day ago scores 1.0, 8 days ago scores 0.7")
    void freshness_boundaries() {
        Instant now = T0.plus(Duration.ofDays(100));

        assertEquals(1.0, DataQualityScorer.freshness(now.minus(Duration.ofDays(1)), now));
        assertEquals(0.9, DataQualityScorer.freshness(now.minus(Duration.ofDays(7)), now));
        assertEquals(0.7, DataQualityScorer.freshness(now.minus(Duration.ofDays(8)), now));
        assertEquals(0.5, DataQualityScorer.freshness(now.minus(Duration.ofDays(90)), now));
        assertEquals(0.3, DataQualityScorer.freshness(now.minus(Duration.ofDays(91)), now));
        assertEquals(0.5, DataQualityScorer.freshness(null, now));
    }

    @Test
    @DisplayName("Validity: forks above twice the stars and an unknown language score 0.8")
    void validity_penaltyComposition() {
        RepositoryCandidate candidate = repo("Unknown", 100L, 300L, 0L, null, T0, T0);

        assertEquals(0.8, DataQualityScorer.validity(candidate));
    }

    @Test
    @DisplayName("Validity: negative counts and inverted timestamps stack, floored at zero")
    void validity_stackedPenalties() {
        RepositoryCandidate inverted = repo("Go", -1L, -5L, 0L, null, T0.plus(Duration.ofDays(2)), T0);
        RepositoryCandidate noLanguage = repo(null, 10L, 1L, 0L, null, T0, T0);

        // 0.3 stars + 0.2 forks + 0.2 timestamps
        assertEquals(0.3, DataQualityScorer.validity(inverted));
        assertEquals(0.9, DataQualityScorer.validity(noLanguage));
    }
}
