package com.trender.pipeline.orchestrator;

import com.trender.pipeline.model.RepositorySummary;

import java.util.List;
import java.util.Objects;

/**
 * Outcomes of one batch, in input order.
 */
public record BatchResult(List<AnalysisOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Summaries of the repositories that reached staging.
     */
    public List<RepositorySummary> summaries() {
        return outcomes.stream()
                .filter(AnalysisOutcome::isSuccess)
                .map(AnalysisOutcome::summary)
                .filter(Objects::nonNull)
                .toList();
    }

    public int succeededCount() {
        return count(AnalysisState.DONE);
    }

    public int skippedCount() {
        return count(AnalysisState.SKIPPED);
    }

    public int failedCount() {
        return count(AnalysisState.FAILED);
    }

    private int count(AnalysisState state) {
        return (int) outcomes.stream().filter(o -> o.state() == state).count();
    }
}
