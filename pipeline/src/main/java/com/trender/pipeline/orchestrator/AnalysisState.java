package com.trender.pipeline.orchestrator;

/**
 * Lifecycle of one repository analysis:
 * {@code PENDING -> FETCHING -> SCORING -> PERSISTING -> DONE}. {@code SKIPPED} is entered
 * from {@code PENDING} on invalid input, {@code FAILED} from any step on an exception.
 */
public enum AnalysisState {
    PENDING,
    FETCHING,
    SCORING,
    PERSISTING,
    DONE,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED || this == FAILED;
    }
}
