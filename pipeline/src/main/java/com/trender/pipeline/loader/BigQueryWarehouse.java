package com.trender.pipeline.loader;

import com.google.cloud.bigquery.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Single access point to the BigQuery warehouse. Knows the three dataset names
 * ({@code <prefix>_raw}, {@code <prefix>_staging}, {@code <prefix>_analytics}) and
 * offers streaming inserts, parameterized DML and small read queries.
 *
 * <p>Every statement uses named query parameters; values are never spliced into SQL.
 * {@link BigQueryException} propagates so callers can decide the failure scope.</p>
 */
public class BigQueryWarehouse {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryWarehouse.class);

    private final BigQuery bigQuery;
    private final String projectId;
    private final String rawDataset;
    private final String stagingDataset;
    private final String analyticsDataset;

    public BigQueryWarehouse(BigQuery bigQuery, String projectId, String datasetPrefix) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
        this.rawDataset = datasetPrefix + "_raw";
        this.stagingDataset = datasetPrefix + "_staging";
        this.analyticsDataset = datasetPrefix + "_analytics";
    }

    public String rawDataset() {
        return rawDataset;
    }

    public String stagingDataset() {
        return stagingDataset;
    }

    public String analyticsDataset() {
        return analyticsDataset;
    }

    public List<String> datasets() {
        return List.of(rawDataset, stagingDataset, analyticsDataset);
    }

    /**
     * Fully qualified, backtick-quoted table reference for use in SQL.
     */
    public String qualified(String dataset, String table) {
        return String.format("`%s.%s.%s`", projectId, dataset, table);
    }

    public boolean datasetExists(String dataset) {
        return bigQuery.getDataset(DatasetId.of(projectId, dataset)) != null;
    }

    // =========================================================================
    // Streaming inserts
    // =========================================================================

    /**
     * Inserts rows into a BigQuery table using streaming inserts (InsertAllRequest).
     * Automatically adds ingestion_timestamp to every row. Handles insert errors
     * with logging and partial failure reporting.
     *
     * @param datasetName target dataset
     * @param tableName   target table
     * @param rows        list of row data as maps
     * @return InsertResult with success/failure details
     */
    public InsertResult insertRows(String datasetName, String tableName,
                                   List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            logger.debug("No rows to insert into {}.{}", datasetName, tableName);
            return InsertResult.EMPTY;
        }

        TableId tableId = TableId.of(projectId, datasetName, tableName);
        String now = Instant.now().toString();

        InsertAllRequest.Builder requestBuilder = InsertAllRequest.newBuilder(tableId);
        for (Map<String, Object> row : rows) {
            Map<String, Object> rowWithTimestamp = new HashMap<>(row);
            rowWithTimestamp.put("ingestion_timestamp", now);
            requestBuilder.addRow(rowWithTimestamp);
        }

        InsertAllResponse response = bigQuery.insertAll(requestBuilder.build());

        List<InsertResult.RowError> errors = new ArrayList<>();
        if (response.hasErrors()) {
            for (Map.Entry<Long, List<BigQueryError>> entry : response.getInsertErrors().entrySet()) {
                long rowIndex = entry.getKey();
                for (BigQueryError error : entry.getValue()) {
                    errors.add(new InsertResult.RowError(rowIndex, error.getMessage()));
                    logger.error("Insert error in {}.{} row {}: {} (reason: {})",
                            datasetName, tableName, rowIndex,
                            error.getMessage(), error.getReason());
                }
            }
        }

        int successfulRows = rows.size() - response.getInsertErrors().size();
        logger.info("Inserted {}/{} rows into {}.{} ({} errors)",
                successfulRows, rows.size(), datasetName, tableName, errors.size());

        return new InsertResult(rows.size(), successfulRows, errors);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Runs a DML statement (MERGE, UPDATE, DELETE) and waits for it to finish.
     */
    public void executeDml(String sql, Map<String, QueryParameterValue> parameters)
            throws InterruptedException {
        bigQuery.query(buildQuery(sql, parameters));
    }

    /**
     * First row's {@code column} as a long, or empty when there is no row or the value is NULL.
     */
    public Optional<Long> queryForLong(String sql, Map<String, QueryParameterValue> parameters,
                                       String column) throws InterruptedException {
        TableResult result = bigQuery.query(buildQuery(sql, parameters));
        for (FieldValueList row : result.iterateAll()) {
            FieldValue value = row.get(column);
            return value.isNull() ? Optional.empty() : Optional.of(value.getLongValue());
        }
        return Optional.empty();
    }

    public List<FieldValueList> queryRows(String sql, Map<String, QueryParameterValue> parameters)
            throws InterruptedException {
        TableResult result = bigQuery.query(buildQuery(sql, parameters));
        List<FieldValueList> rows = new ArrayList<>();
        for (FieldValueList row : result.iterateAll()) {
            rows.add(row);
        }
        return rows;
    }

    private static QueryJobConfiguration buildQuery(String sql, Map<String, QueryParameterValue> parameters) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false);
        parameters.forEach(builder::addNamedParameter);
        return builder.build();
    }

    // =========================================================================
    // Statement and parameter helpers
    // =========================================================================

    /**
     * Builds a MERGE upsert. Each source column is bound as {@code <expression> AS <column>};
     * rows match on the key columns, matched rows get every other column overwritten, and the
     * optional {@code touchedColumn} is set to {@code CURRENT_TIMESTAMP()} on both branches.
     *
     * @param target        qualified target table
     * @param source        column name to SQL expression, in insert order
     * @param keyColumns    columns identifying a row; must be present in {@code source}
     * @param touchedColumn audit timestamp column, or {@code null}
     */
    public static String mergeStatement(String target, Map<String, String> source,
                                        List<String> keyColumns, String touchedColumn) {
        if (!source.keySet().containsAll(keyColumns)) {
            throw new IllegalArgumentException("Key columns " + keyColumns + " missing from source " + source.keySet());
        }
        String select = source.entrySet().stream()
                .map(e -> e.getValue() + " AS " + e.getKey())
                .collect(Collectors.joining(", "));
        String on = keyColumns.stream()
                .map(k -> "T." + k + " = S." + k)
                .collect(Collectors.joining(" AND "));

        List<String> updates = source.keySet().stream()
                .filter(c -> !keyColumns.contains(c))
                .map(c -> c + " = S." + c)
                .collect(Collectors.toCollection(ArrayList::new));
        List<String> insertColumns = new ArrayList<>(source.keySet());
        List<String> insertValues = source.keySet().stream()
                .map(c -> "S." + c)
                .collect(Collectors.toCollection(ArrayList::new));
        if (touchedColumn != null) {
            updates.add(touchedColumn + " = CURRENT_TIMESTAMP()");
            insertColumns.add(touchedColumn);
            insertValues.add("CURRENT_TIMESTAMP()");
        }

        StringBuilder sql = new StringBuilder()
                .append("MERGE ").append(target).append(" T ")
                .append("USING (SELECT ").append(select).append(") S ")
                .append("ON ").append(on).append(' ');
        if (!updates.isEmpty()) {
            sql.append("WHEN MATCHED THEN UPDATE SET ").append(String.join(", ", updates)).append(' ');
        }
        sql.append("WHEN NOT MATCHED THEN INSERT (").append(String.join(", ", insertColumns)).append(") ")
                .append("VALUES (").append(String.join(", ", insertValues)).append(')');
        return sql.toString();
    }

    /**
     * Source map binding every parameter under its own name ({@code @name AS name}).
     */
    public static Map<String, String> boundColumns(Collection<String> parameterNames) {
        Map<String, String> source = new LinkedHashMap<>();
        for (String name : parameterNames) {
            source.put(name, "@" + name);
        }
        return source;
    }

    static QueryParameterValue timestamp(Instant instant) {
        if (instant == null) {
            return QueryParameterValue.timestamp((Long) null);
        }
        return QueryParameterValue.timestamp(instant.getEpochSecond() * 1_000_000 + instant.getNano() / 1_000);
    }

    static QueryParameterValue date(LocalDate date) {
        return QueryParameterValue.date(date.toString());
    }

    static QueryParameterValue stringArray(List<String> values) {
        return QueryParameterValue.array(values.toArray(new String[0]), StandardSQLTypeName.STRING);
    }

    static Instant instantOf(FieldValue value) {
        if (value.isNull()) {
            return null;
        }
        long micros = value.getTimestampValue();
        return Instant.ofEpochSecond(micros / 1_000_000, (micros % 1_000_000) * 1_000);
    }
}
