package com.trender.pipeline.loader;

/**
 * Outcome of loading ranked rows into the analytics layer.
 *
 * @param loaded    rows whose dimension and snapshot were written
 * @param skipped   rows dropped because a dimension key lookup found nothing
 * @param failed    rows whose load raised a warehouse error
 * @param usageRows usage fact rows written across all loaded rows
 */
public record LoadResult(int loaded, int skipped, int failed, int usageRows) {

    public int total() {
        return loaded + skipped + failed;
    }
}
