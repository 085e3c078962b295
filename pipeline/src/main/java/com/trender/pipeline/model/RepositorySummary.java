package com.trender.pipeline.model;

/**
 * Minimal record of a successfully analyzed repository, enough for run-level counting.
 */
public record RepositorySummary(
        String fullName,
        String language,
        long stars
) {}
