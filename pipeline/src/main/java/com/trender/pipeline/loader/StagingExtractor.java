package com.trender.pipeline.loader;

import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryParameterValue;
import com.trender.pipeline.detection.RenderUsageDetector;
import com.trender.pipeline.model.ActivityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read path of the staging layer: selects the rows that feed the analytics load.
 *
 * <p>General rows must reach the quality threshold and are capped at the top N per
 * language by stars. Marker-cohort rows are always included. Rows come back ordered by
 * stars descending then full name, which is the extraction order ranking ties fall back on.</p>
 */
public class StagingExtractor {

    private static final Logger logger = LoggerFactory.getLogger(StagingExtractor.class);

    static final String COLUMNS = "repo_full_name, repo_url, language, description, readme_content, "
            + "stars, forks, open_issues, created_at, updated_at, "
            + "commits_last_7_days, issues_closed_last_7_days, active_contributors, data_quality_score, "
            + "uses_render, render_category, render_services, render_databases, service_count, "
            + "render_complexity_score, has_blueprint_button";

    private final BigQueryWarehouse warehouse;

    public StagingExtractor(BigQueryWarehouse warehouse) {
        this.warehouse = warehouse;
    }

    /**
     * @param qualityThreshold minimum data-quality score for general rows
     * @param perLanguageLimit maximum general rows per language
     * @return rows deduplicated by full name, in extraction order
     */
    public List<StagingRow> extract(double qualityThreshold, int perLanguageLimit) throws InterruptedException {
        Map<String, QueryParameterValue> parameters = Map.of(
                "threshold", QueryParameterValue.float64(qualityThreshold),
                "per_language_limit", QueryParameterValue.int64(perLanguageLimit),
                "marker_cohort", QueryParameterValue.string(RenderUsageDetector.MARKER_COHORT));

        List<FieldValueList> rows = warehouse.queryRows(extractSql(), parameters);

        Map<String, StagingRow> unique = new LinkedHashMap<>();
        for (FieldValueList row : rows) {
            StagingRow stagingRow = fromRow(row);
            unique.putIfAbsent(stagingRow.fullName(), stagingRow);
        }
        long markerRows = unique.values().stream().filter(StagingRow::isMarkerCohort).count();
        logger.info("Extracted {} staging rows ({} general, {} marker cohort, {} duplicates dropped)",
                unique.size(), unique.size() - markerRows, markerRows, rows.size() - unique.size());
        return new ArrayList<>(unique.values());
    }

    String extractSql() {
        String staging = warehouse.qualified(warehouse.stagingDataset(), WarehouseTables.STG_REPOS_VALIDATED);
        String snapshots = warehouse.qualified(warehouse.analyticsDataset(), WarehouseTables.FACT_REPO_SNAPSHOTS);
        return "WITH general AS ("
                + "SELECT " + COLUMNS + " FROM ("
                + "SELECT " + COLUMNS + ", ROW_NUMBER() OVER ("
                + "PARTITION BY language ORDER BY stars DESC, repo_full_name) AS language_position "
                + "FROM " + staging + " "
                + "WHERE data_quality_score >= @threshold AND language != @marker_cohort) "
                + "WHERE language_position <= @per_language_limit), "
                + "marker AS (SELECT " + COLUMNS + " FROM " + staging + " WHERE language = @marker_cohort), "
                + "previous AS ("
                + "SELECT repo_key, stars AS previous_stars FROM " + snapshots + " "
                + "WHERE snapshot_date < CURRENT_DATE() "
                + "QUALIFY ROW_NUMBER() OVER (PARTITION BY repo_key ORDER BY snapshot_date DESC) = 1) "
                + "SELECT c.*, p.previous_stars FROM ("
                + "SELECT * FROM general UNION ALL SELECT * FROM marker) c "
                + "LEFT JOIN previous p ON p.repo_key = FARM_FINGERPRINT(c.repo_full_name) "
                + "ORDER BY c.stars DESC, c.repo_full_name";
    }

    static StagingRow fromRow(FieldValueList row) {
        return new StagingRow(
                row.get("repo_full_name").getStringValue(),
                stringOrNull(row.get("repo_url")),
                stringOrNull(row.get("language")),
                stringOrNull(row.get("description")),
                stringOrNull(row.get("readme_content")),
                longOrZero(row.get("stars")),
                longOrNull(row.get("forks")),
                longOrNull(row.get("open_issues")),
                BigQueryWarehouse.instantOf(row.get("created_at")),
                BigQueryWarehouse.instantOf(row.get("updated_at")),
                new ActivityMetrics(
                        (int) longOrZero(row.get("commits_last_7_days")),
                        (int) longOrZero(row.get("issues_closed_last_7_days")),
                        (int) longOrZero(row.get("active_contributors"))),
                row.get("data_quality_score").isNull() ? 0.0 : row.get("data_quality_score").getDoubleValue(),
                !row.get("uses_render").isNull() && row.get("uses_render").getBooleanValue(),
                stringOrNull(row.get("render_category")),
                stringList(row.get("render_services")),
                stringList(row.get("render_databases")),
                (int) longOrZero(row.get("service_count")),
                (int) longOrZero(row.get("render_complexity_score")),
                !row.get("has_blueprint_button").isNull() && row.get("has_blueprint_button").getBooleanValue(),
                longOrNull(row.get("previous_stars")));
    }

    private static String stringOrNull(FieldValue value) {
        return value.isNull() ? null : value.getStringValue();
    }

    private static Long longOrNull(FieldValue value) {
        return value.isNull() ? null : value.getLongValue();
    }

    private static long longOrZero(FieldValue value) {
        return value.isNull() ? 0L : value.getLongValue();
    }

    private static List<String> stringList(FieldValue value) {
        if (value.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (FieldValue element : value.getRepeatedValue()) {
            values.add(element.getStringValue());
        }
        return values;
    }
}
