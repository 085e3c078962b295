package com.trender.pipeline.loader;

import com.google.cloud.bigquery.QueryParameterValue;
import com.trender.pipeline.detection.RenderUsageDetector;
import com.trender.pipeline.model.ActivityMetrics;
import com.trender.pipeline.model.EnrichedRepository;
import com.trender.pipeline.model.RenderUsage;
import com.trender.pipeline.model.RepositoryCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write path of the staging layer. One row per repository in
 * {@code stg_repos_validated}, upserted by full name.
 */
public class StagingStore {

    private static final Logger logger = LoggerFactory.getLogger(StagingStore.class);

    static final String KEY_COLUMN = "repo_full_name";

    private final BigQueryWarehouse warehouse;

    public StagingStore(BigQueryWarehouse warehouse) {
        this.warehouse = warehouse;
    }

    /**
     * Inserts the repository, or overwrites every mutable column of its existing row and
     * refreshes {@code loaded_at}. Replaying the same record leaves one up-to-date row.
     */
    public void upsert(EnrichedRepository repository) throws InterruptedException {
        Map<String, QueryParameterValue> parameters = parameters(repository);
        String sql = BigQueryWarehouse.mergeStatement(
                warehouse.qualified(warehouse.stagingDataset(), WarehouseTables.STG_REPOS_VALIDATED),
                BigQueryWarehouse.boundColumns(parameters.keySet()),
                List.of(KEY_COLUMN),
                "loaded_at");

        warehouse.executeDml(sql, parameters);
        logger.debug("Staged {} (quality {})", repository.fullName(), repository.dataQualityScore());
    }

    static Map<String, QueryParameterValue> parameters(EnrichedRepository repository) {
        RepositoryCandidate candidate = repository.candidate();
        ActivityMetrics activity = repository.activity();
        RenderUsage usage = repository.renderUsage();

        Map<String, QueryParameterValue> p = new LinkedHashMap<>();
        p.put(KEY_COLUMN, QueryParameterValue.string(candidate.fullName()));
        p.put("repo_url", QueryParameterValue.string(candidate.htmlUrl()));
        p.put("language", QueryParameterValue.string(repository.cohortLanguage()));
        p.put("primary_language", QueryParameterValue.string(candidate.language()));
        p.put("description", QueryParameterValue.string(candidate.description()));
        p.put("readme_content", QueryParameterValue.string(repository.readmeContent()));
        p.put("stars", QueryParameterValue.int64(candidate.starCount()));
        p.put("forks", QueryParameterValue.int64(candidate.forksCount()));
        p.put("open_issues", QueryParameterValue.int64(candidate.openIssuesCount()));
        p.put("created_at", BigQueryWarehouse.timestamp(candidate.createdAt()));
        p.put("updated_at", BigQueryWarehouse.timestamp(candidate.updatedAt()));
        p.put("commits_last_7_days", QueryParameterValue.int64(activity.commitsLast7Days()));
        p.put("issues_closed_last_7_days", QueryParameterValue.int64(activity.issuesClosedLast7Days()));
        p.put("active_contributors", QueryParameterValue.int64(activity.activeContributors()));
        p.put("data_quality_score", QueryParameterValue.float64(repository.dataQualityScore()));
        p.put("uses_render", QueryParameterValue.bool(usage.usesRender()));
        p.put("render_category", QueryParameterValue.string(
                usage.category() != null ? usage.category().value() : null));
        p.put("render_services", BigQueryWarehouse.stringArray(usage.services()));
        p.put("render_databases", BigQueryWarehouse.stringArray(usage.databases()));
        p.put("service_count", QueryParameterValue.int64(usage.serviceCount()));
        p.put("render_complexity_score", QueryParameterValue.int64(usage.complexityScore()));
        p.put("has_blueprint_button", QueryParameterValue.bool(usage.hasBlueprintButton()));
        p.put("blueprint_quality_score", QueryParameterValue.int64(
                RenderUsageDetector.blueprintQualityScore(usage)));
        p.put("documentation_score", QueryParameterValue.int64(RenderUsageDetector.documentationScore(
                candidate.description(), repository.readmeContent(), usage)));
        return p;
    }
}
