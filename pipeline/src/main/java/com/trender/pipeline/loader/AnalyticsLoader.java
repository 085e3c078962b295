package com.trender.pipeline.loader;

import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.QueryParameterValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads ranked rows into the analytics star schema.
 *
 * <p>Per row: upsert {@code dim_repositories}, look up the repository and language keys,
 * upsert the {@code fact_repo_snapshots} row for the snapshot date, and for Render projects
 * one {@code fact_render_usage} row per declared service type. A missing key skips the row
 * (or the service type) rather than inventing one; a warehouse error or a failed job fails
 * only that row.</p>
 */
public class AnalyticsLoader {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsLoader.class);

    private final BigQueryWarehouse warehouse;

    public AnalyticsLoader(BigQueryWarehouse warehouse) {
        this.warehouse = warehouse;
    }

    public LoadResult load(List<RankedRepository> ranked, LocalDate snapshotDate) throws InterruptedException {
        int loaded = 0;
        int skipped = 0;
        int failed = 0;
        int usageRows = 0;

        for (RankedRepository repository : ranked) {
            String fullName = repository.row().fullName();
            try {
                upsertDimension(repository.row());

                Optional<Long> repoKey = lookupRepoKey(fullName);
                Optional<Long> languageKey = lookupLanguageKey(repository.row().language());
                if (repoKey.isEmpty() || languageKey.isEmpty()) {
                    logger.warn("Skipping {}: no {} key found", fullName,
                            repoKey.isEmpty() ? "repository" : "language '" + repository.row().language() + "'");
                    skipped++;
                    continue;
                }

                upsertSnapshot(repository, repoKey.get(), languageKey.get(), snapshotDate);
                if (repository.row().usesRender()) {
                    usageRows += upsertUsage(repository.row(), repoKey.get(), snapshotDate);
                }
                loaded++;
            } catch (BigQueryException | JobException e) {
                logger.error("Failed to load {} into analytics: {}", fullName, e.getMessage());
                failed++;
            }
        }

        LoadResult result = new LoadResult(loaded, skipped, failed, usageRows);
        logger.info("Analytics load for {}: {} loaded, {} skipped, {} failed, {} usage rows",
                snapshotDate, loaded, skipped, failed, usageRows);
        return result;
    }

    // =========================================================================
    // Dimension
    // =========================================================================

    void upsertDimension(StagingRow row) throws InterruptedException {
        Map<String, QueryParameterValue> parameters = new LinkedHashMap<>();
        parameters.put("repo_full_name", QueryParameterValue.string(row.fullName()));
        parameters.put("repo_url", QueryParameterValue.string(row.url()));
        parameters.put("description", QueryParameterValue.string(row.description()));
        parameters.put("readme_content", QueryParameterValue.string(row.readmeContent()));
        parameters.put("language", QueryParameterValue.string(row.language()));
        parameters.put("created_at", BigQueryWarehouse.timestamp(row.createdAt()));
        parameters.put("uses_render", QueryParameterValue.bool(row.usesRender()));
        parameters.put("render_category", QueryParameterValue.string(row.renderCategory()));

        Map<String, String> source = new LinkedHashMap<>();
        source.put("repo_key", "FARM_FINGERPRINT(@repo_full_name)");
        source.putAll(BigQueryWarehouse.boundColumns(parameters.keySet()));
        source.put("is_current", "TRUE");

        String sql = BigQueryWarehouse.mergeStatement(
                warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.DIM_REPOSITORIES),
                source, List.of("repo_full_name"), "updated_at");
        warehouse.executeDml(sql, parameters);
    }

    Optional<Long> lookupRepoKey(String fullName) throws InterruptedException {
        String sql = "SELECT repo_key FROM "
                + warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.DIM_REPOSITORIES)
                + " WHERE repo_full_name = @repo_full_name AND is_current = TRUE LIMIT 1";
        return warehouse.queryForLong(sql,
                Map.of("repo_full_name", QueryParameterValue.string(fullName)), "repo_key");
    }

    Optional<Long> lookupLanguageKey(String language) throws InterruptedException {
        if (language == null) {
            return Optional.empty();
        }
        String sql = "SELECT language_key FROM "
                + warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.DIM_LANGUAGES)
                + " WHERE language_name = @language_name LIMIT 1";
        return warehouse.queryForLong(sql,
                Map.of("language_name", QueryParameterValue.string(language)), "language_key");
    }

    // =========================================================================
    // Facts
    // =========================================================================

    void upsertSnapshot(RankedRepository repository, long repoKey, long languageKey, LocalDate snapshotDate)
            throws InterruptedException {
        StagingRow row = repository.row();
        Map<String, QueryParameterValue> parameters = new LinkedHashMap<>();
        parameters.put("repo_key", QueryParameterValue.int64(repoKey));
        parameters.put("language_key", QueryParameterValue.int64(languageKey));
        parameters.put("snapshot_date", BigQueryWarehouse.date(snapshotDate));
        parameters.put("stars", QueryParameterValue.int64(row.stars()));
        parameters.put("forks", QueryParameterValue.int64(row.forks()));
        parameters.put("star_velocity", QueryParameterValue.float64(repository.starVelocity()));
        parameters.put("activity_score", QueryParameterValue.float64(repository.activityScore()));
        parameters.put("momentum_score", QueryParameterValue.float64(repository.momentumScore()));
        parameters.put("recency_score", QueryParameterValue.float64(repository.recencyScore()));
        parameters.put("commits_last_7_days", QueryParameterValue.int64(row.activity().commitsLast7Days()));
        parameters.put("issues_closed_last_7_days", QueryParameterValue.int64(row.activity().issuesClosedLast7Days()));
        parameters.put("active_contributors", QueryParameterValue.int64(row.activity().activeContributors()));
        parameters.put("rank_overall", QueryParameterValue.int64(repository.overallRank()));
        parameters.put("rank_in_language", QueryParameterValue.int64(repository.languageRank()));
        parameters.put("star_rank", QueryParameterValue.int64(repository.starRank()));

        String sql = BigQueryWarehouse.mergeStatement(
                warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.FACT_REPO_SNAPSHOTS),
                BigQueryWarehouse.boundColumns(parameters.keySet()),
                List.of("repo_key", "language_key", "snapshot_date"), null);
        warehouse.executeDml(sql, parameters);
    }

    /**
     * @return usage rows written; service types without a service dimension entry are skipped
     */
    int upsertUsage(StagingRow row, long repoKey, LocalDate snapshotDate) throws InterruptedException {
        String lookupSql = "SELECT service_key FROM "
                + warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.DIM_RENDER_SERVICES)
                + " WHERE service_type = @service_type LIMIT 1";
        String target = warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.FACT_RENDER_USAGE);

        int written = 0;
        for (String serviceType : row.serviceTypes()) {
            Optional<Long> serviceKey = warehouse.queryForLong(lookupSql,
                    Map.of("service_type", QueryParameterValue.string(serviceType)), "service_key");
            if (serviceKey.isEmpty()) {
                logger.debug("No service key for '{}' ({}), skipping usage row", serviceType, row.fullName());
                continue;
            }

            Map<String, QueryParameterValue> parameters = new LinkedHashMap<>();
            parameters.put("repo_key", QueryParameterValue.int64(repoKey));
            parameters.put("service_key", QueryParameterValue.int64(serviceKey.get()));
            parameters.put("snapshot_date", BigQueryWarehouse.date(snapshotDate));
            parameters.put("service_count", QueryParameterValue.int64(row.serviceCount()));
            parameters.put("complexity_score", QueryParameterValue.int64(row.complexityScore()));
            parameters.put("has_blueprint", QueryParameterValue.bool(row.hasBlueprintButton()));

            String sql = BigQueryWarehouse.mergeStatement(target,
                    BigQueryWarehouse.boundColumns(parameters.keySet()),
                    List.of("repo_key", "service_key", "snapshot_date"), null);
            warehouse.executeDml(sql, parameters);
            written++;
        }
        return written;
    }
}
