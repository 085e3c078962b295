package com.trender.pipeline.loader;

import com.google.cloud.bigquery.*;
import com.trender.pipeline.model.ActivityMetrics;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link StagingExtractor}: the extraction query and row mapping.
 */
@ExtendWith(MockitoExtension.class)
class StagingExtractorTest {

    @Mock
    private BigQueryWarehouse warehouse;

    private StagingExtractor extractor;

    @BeforeEach
    void setUp() {
        lenient().when(warehouse.qualified(any(), anyString()))
                .thenAnswer(inv -> "`p." + inv.getArgument(0) + "." + inv.getArgument(1) + "`");
        extractor = new StagingExtractor(warehouse);
    }

    private static FieldValue value(Object v) {
        return FieldValue.of(FieldValue.Attribute.PRIMITIVE, v);
    }

    private static FieldValue repeated(String... values) {
        List<FieldValue> elements = new ArrayList<>();
        for (String v : values) {
            elements.add(value(v));
        }
        return FieldValue.of(FieldValue.Attribute.REPEATED, elements);
    }

    private static FieldValueList row(Map<String, FieldValue> columns) {
        List<Field> fields = new ArrayList<>();
        for (String name : columns.keySet()) {
            fields.add(Field.of(name, StandardSQLTypeName.STRING));
        }
        return FieldValueList.of(new ArrayList<>(columns.values()), FieldList.of(fields));
    }

    private static Map<String, FieldValue> columns(String fullName, String language, String stars, String previousStars) {
        Map<String, FieldValue> c = new LinkedHashMap<>();
        c.put("repo_full_name", value(fullName));
        c.put("repo_url", value("https://github.com/" + fullName));
        c.put("language", value(language));
        c.put("description", value(null));
        c.put("readme_content", value("# Readme"));
        c.put("stars", value(stars));
        c.put("forks", value("7"));
        c.put("open_issues", value(null));
        c.put("created_at", value("1735689600.0"));
        c.put("updated_at", value("1740787200.0"));
        c.put("commits_last_7_days", value("5"));
        c.put("issues_closed_last_7_days", value("2"));
        c.put("active_contributors", value("3"));
        c.put("data_quality_score", value("0.85"));
        c.put("uses_render", value("true"));
        c.put("render_category", value("community"));
        c.put("render_services", repeated("web", "worker"));
        c.put("render_databases", repeated("postgres"));
        c.put("service_count", value("3"));
        c.put("render_complexity_score", value("5"));
        c.put("has_blueprint_button", value("false"));
        c.put("previous_stars", value(previousStars));
        return c;
    }

    @Test
    @DisplayName("fromRow maps every staging column, with NULLs as absent values")
    void fromRow_mapsColumns() {
        StagingRow row = StagingExtractor.fromRow(row(columns("acme/api", "Python", "320", "300")));

        assertEquals("acme/api", row.fullName());
        assertEquals("Python", row.language());
        assertNull(row.description());
        assertEquals(320, row.stars());
        assertEquals(7L, row.forks());
        assertNull(row.openIssues());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), row.createdAt());
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"), row.updatedAt());
        assertEquals(new ActivityMetrics(5, 2, 3), row.activity());
        assertEquals(0.85, row.dataQualityScore());
        assertTrue(row.usesRender());
        assertEquals(List.of("web", "worker"), row.renderServices());
        assertEquals(List.of("web", "worker", "postgres"), row.serviceTypes());
        assertFalse(row.hasBlueprintButton());
        assertEquals(20, row.starsGained());
    }

    @Test
    @DisplayName("First snapshot has no previous stars and no gain")
    void fromRow_noPreviousSnapshot() {
        StagingRow row = StagingExtractor.fromRow(row(columns("acme/api", "render", "320", null)));

        assertNull(row.previousStars());
        assertEquals(0, row.starsGained());
        assertTrue(row.isMarkerCohort());
    }

    @Test
    @DisplayName("extract binds threshold, per-language limit and cohort tag and drops duplicate names")
    @SuppressWarnings("unchecked")
    void extract_bindsParametersAndDedupes() throws Exception {
        when(warehouse.stagingDataset()).thenReturn("trender_staging");
        when(warehouse.analyticsDataset()).thenReturn("trender_analytics");
        when(warehouse.queryRows(anyString(), anyMap())).thenReturn(List.of(
                row(columns("a/one", "Go", "900", null)),
                row(columns("b/two", "render", "500", null)),
                row(columns("a/one", "Go", "900", null))));

        List<StagingRow> rows = extractor.extract(0.7, 50);

        assertEquals(List.of("a/one", "b/two"), rows.stream().map(StagingRow::fullName).toList());

        ArgumentCaptor<Map<String, QueryParameterValue>> params = ArgumentCaptor.forClass(Map.class);
        verify(warehouse).queryRows(anyString(), params.capture());
        assertEquals(QueryParameterValue.float64(0.7), params.getValue().get("threshold"));
        assertEquals(QueryParameterValue.int64(50), params.getValue().get("per_language_limit"));
        assertEquals(QueryParameterValue.string("render"), params.getValue().get("marker_cohort"));
    }

    @Test
    @DisplayName("Extraction SQL caps general rows per language, keeps the marker cohort and joins the previous snapshot")
    void extractSql_shape() {
        when(warehouse.stagingDataset()).thenReturn("trender_staging");
        when(warehouse.analyticsDataset()).thenReturn("trender_analytics");

        String sql = extractor.extractSql();

        assertTrue(sql.contains("FROM `p.trender_staging.stg_repos_validated`"));
        assertTrue(sql.contains("PARTITION BY language ORDER BY stars DESC, repo_full_name"));
        assertTrue(sql.contains("data_quality_score >= @threshold AND language != @marker_cohort"));
        assertTrue(sql.contains("language_position <= @per_language_limit"));
        assertTrue(sql.contains("WHERE language = @marker_cohort"));
        assertTrue(sql.contains("`p.trender_analytics.fact_repo_snapshots`"));
        assertTrue(sql.endsWith("ORDER BY c.stars DESC, c.repo_full_name"));
    }
}
