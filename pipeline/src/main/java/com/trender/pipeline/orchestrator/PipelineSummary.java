package com.trender.pipeline.orchestrator;

/**
 * Result of one pipeline run.
 *
 * @param reposProcessed distinct repositories staged during the run
 * @param elapsedSeconds wall-clock duration of the run
 * @param success        false when any phase failed
 */
public record PipelineSummary(
        int reposProcessed,
        double elapsedSeconds,
        boolean success
) {}
