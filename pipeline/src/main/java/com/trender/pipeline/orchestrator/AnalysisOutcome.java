package com.trender.pipeline.orchestrator;

import com.trender.pipeline.model.RepositorySummary;

/**
 * Terminal result of analyzing one repository: succeeded with a summary, skipped
 * because the input was unusable, or failed at a given step.
 *
 * @param fullName   repository full name as received
 * @param state      {@code DONE}, {@code SKIPPED} or {@code FAILED}
 * @param failedStep step that raised, for failures only
 * @param summary    the staged repository, for successes only
 * @param detail     skip reason or error message
 */
public record AnalysisOutcome(
        String fullName,
        AnalysisState state,
        AnalysisState failedStep,
        RepositorySummary summary,
        String detail
) {

    public static AnalysisOutcome succeeded(RepositorySummary summary) {
        return new AnalysisOutcome(summary.fullName(), AnalysisState.DONE, null, summary, null);
    }

    public static AnalysisOutcome skipped(String fullName, String reason) {
        return new AnalysisOutcome(fullName, AnalysisState.SKIPPED, null, null, reason);
    }

    public static AnalysisOutcome failed(String fullName, AnalysisState step, String error) {
        return new AnalysisOutcome(fullName, AnalysisState.FAILED, step, null, error);
    }

    public boolean isSuccess() {
        return state == AnalysisState.DONE;
    }
}
