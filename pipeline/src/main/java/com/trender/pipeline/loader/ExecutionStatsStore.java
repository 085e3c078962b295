package com.trender.pipeline.loader;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams one {@code fact_workflow_executions} row per run.
 */
public class ExecutionStatsStore {

    private final BigQueryWarehouse warehouse;

    public ExecutionStatsStore(BigQueryWarehouse warehouse) {
        this.warehouse = warehouse;
    }

    public InsertResult record(ExecutionStats stats) {
        Map<String, Object> row = new HashMap<>();
        row.put("execution_date", stats.executionDate().toString());
        row.put("total_duration_seconds", Math.round(stats.durationSeconds() * 100) / 100.0);
        row.put("repos_processed", stats.reposProcessed());
        row.put("tasks_executed", stats.tasksExecuted());
        row.put("tasks_succeeded", stats.tasksSucceeded());
        row.put("tasks_skipped", stats.tasksSkipped());
        row.put("tasks_failed", stats.tasksFailed());
        row.put("languages_processed", stats.languagesProcessed());
        row.put("success_rate", Math.round(stats.successRate() * 100) / 100.0);
        return warehouse.insertRows(warehouse.analyticsDataset(), WarehouseTables.FACT_WORKFLOW_EXECUTIONS, List.of(row));
    }
}
