package com.trender.pipeline.loader;

import java.time.Instant;
import java.util.List;

/**
 * Performance record of one pipeline run.
 */
public record ExecutionStats(
        Instant executionDate,
        double durationSeconds,
        int reposProcessed,
        int tasksExecuted,
        int tasksSucceeded,
        int tasksSkipped,
        int tasksFailed,
        List<String> languagesProcessed
) {

    public double successRate() {
        return tasksExecuted == 0 ? 1.0 : (double) tasksSucceeded / tasksExecuted;
    }
}
