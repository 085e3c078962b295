package com.trender.pipeline.loader;

import com.trender.pipeline.detection.RenderUsageDetector;
import com.trender.pipeline.model.ActivityMetrics;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Stream;

/**
 * A row read back from {@code stg_repos_validated}, plus the star count of the
 * repository's previous snapshot when one exists.
 */
public record StagingRow(
        String fullName,
        String url,
        String language,
        String description,
        String readmeContent,
        long stars,
        Long forks,
        Long openIssues,
        Instant createdAt,
        Instant updatedAt,
        ActivityMetrics activity,
        double dataQualityScore,
        boolean usesRender,
        String renderCategory,
        List<String> renderServices,
        List<String> renderDatabases,
        int serviceCount,
        int complexityScore,
        boolean hasBlueprintButton,
        Long previousStars
) {

    public StagingRow {
        activity = activity != null ? activity : ActivityMetrics.NONE;
        renderServices = renderServices == null ? List.of() : List.copyOf(renderServices);
        renderDatabases = renderDatabases == null ? List.of() : List.copyOf(renderDatabases);
    }

    public boolean isMarkerCohort() {
        return RenderUsageDetector.MARKER_COHORT.equals(language);
    }

    /**
     * Stars gained since the previous snapshot; zero on the first snapshot.
     */
    public long starsGained() {
        return previousStars != null ? stars - previousStars : 0;
    }

    /**
     * Distinct declared service and database types, in declaration order.
     */
    public List<String> serviceTypes() {
        return List.copyOf(new LinkedHashSet<>(
                Stream.concat(renderServices.stream(), renderDatabases.stream()).toList()));
    }
}
