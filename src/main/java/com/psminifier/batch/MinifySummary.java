package com.psminifier.batch;

import org.eclipse.collections.api.list.ImmutableList;

import java.nio.file.Path;

/**
 * Totals for a batch run.
 *
 * @param files        one entry per script considered, in processing order
 * @param originalSize summed size in bytes of the scripts that were minified
 * @param minifiedSize summed size in bytes of their minified outputs
 */
public record MinifySummary(ImmutableList<FileOutcome> files, long originalSize, long minifiedSize) {

    /**
     * Minified size as a fraction of the original, or 0 when nothing was minified.
     */
    public double minifiedPercent() {
        return originalSize == 0 ? 0 : (double) minifiedSize / originalSize;
    }

    public boolean hasFailures() {
        return files.anySatisfy(FileOutcome::failed);
    }

    public ImmutableList<FileOutcome> failures() {
        return files.select(FileOutcome::failed);
    }

    /**
     * @param error failure message, or null when the script was minified
     */
    public record FileOutcome(Path source, Path output, long originalSize, long minifiedSize, String error) {

        public static FileOutcome minified(Path source, Path output, long originalSize, long minifiedSize) {
            return new FileOutcome(source, output, originalSize, minifiedSize, null);
        }

        public static FileOutcome failed(Path source, String error) {
            return new FileOutcome(source, null, 0, 0, error);
        }

        public boolean failed() {
            return error != null;
        }
    }
}
