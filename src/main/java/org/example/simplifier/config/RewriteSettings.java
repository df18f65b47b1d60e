package org.example.simplifier.config;

/**
 * Immutable per-job snapshot of the pipeline configuration.
 */
public record RewriteSettings(
        boolean fastMode,
        int maxWorkers,
        int chunkSize,
        int overlap,
        int memoryTailChars,
        SummarySettings summary
) {
    public RewriteSettings {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize): " + overlap);
        }
    }

    public record SummarySettings(
            int globalChapters,
            int globalSampleChars,
            int globalMaxChars,
            int chapterMaxChars
    ) {
        public static SummarySettings defaults() {
            return new SummarySettings(8, 2000, 15000, 15000);
        }
    }
}
