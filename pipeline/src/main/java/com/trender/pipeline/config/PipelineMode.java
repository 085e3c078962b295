package com.trender.pipeline.config;

import java.util.List;
import java.util.Locale;

/**
 * Run scope. {@code DEV} processes only the first target language and at most
 * {@value #DEV_CANDIDATE_CAP} candidates per list, for quick end-to-end checks.
 */
public enum PipelineMode {
    FULL,
    DEV;

    static final int DEV_CANDIDATE_CAP = 10;

    public static PipelineMode parse(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "PIPELINE_MODE must be FULL or DEV, got '" + value + "'", e);
        }
    }

    public List<String> languages(List<String> targetLanguages) {
        if (this == DEV && targetLanguages.size() > 1) {
            return List.of(targetLanguages.get(0));
        }
        return targetLanguages;
    }

    public int candidateCap(int configuredLimit) {
        return this == DEV ? Math.min(configuredLimit, DEV_CANDIDATE_CAP) : configuredLimit;
    }
}
