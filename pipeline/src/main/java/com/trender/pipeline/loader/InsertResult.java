package com.trender.pipeline.loader;

import java.util.List;

/**
 * Result of a BigQuery streaming insert. Reports rows attempted, rows accepted and
 * any per-row errors so partial failures stay visible.
 */
public record InsertResult(
        int totalRows,
        int successfulRows,
        List<RowError> errors
) {

    public static final InsertResult EMPTY = new InsertResult(0, 0, List.of());

    public record RowError(long rowIndex, String message) {}

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
