package com.trender.pipeline.model;

/**
 * A candidate after enrichment: README, activity counts, Render detection and
 * the data-quality score computed from all of them.
 *
 * @param candidate        source attributes
 * @param cohortLanguage   language the repository is ranked under; the candidate's own
 *                         language, or the marker cohort tag for marker-file projects
 * @param readmeContent    truncated README text, {@code null} when the repository has none
 * @param activity         recent activity counts
 * @param renderUsage      marker-file detection result
 * @param dataQualityScore 0.0-1.0 score, rounded to two decimals
 */
public record EnrichedRepository(
        RepositoryCandidate candidate,
        String cohortLanguage,
        String readmeContent,
        ActivityMetrics activity,
        RenderUsage renderUsage,
        double dataQualityScore
) {

    public EnrichedRepository {
        cohortLanguage = cohortLanguage != null ? cohortLanguage : candidate.language();
        activity = activity != null ? activity : ActivityMetrics.NONE;
        renderUsage = renderUsage != null ? renderUsage : RenderUsage.notInUse();
    }

    public String fullName() {
        return candidate.fullName();
    }

    public EnrichedRepository withDataQualityScore(double score) {
        return new EnrichedRepository(candidate, cohortLanguage, readmeContent, activity, renderUsage, score);
    }

    public RepositorySummary toSummary() {
        return new RepositorySummary(candidate.fullName(), cohortLanguage, candidate.starCount());
    }
}
