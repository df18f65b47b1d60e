package org.example.simplifier.service.checkpoint;

/**
 * Persisted progress of one chapter. The rewritten windows themselves live in a parallel record.
 */
public record ChapterCheckpoint(
        int processedWindows,
        int totalWindows,
        boolean complete,
        String chapterSummary    // nullable until summarized
) {
    public static ChapterCheckpoint start(int totalWindows) {
        return new ChapterCheckpoint(0, totalWindows, false, null);
    }

    public ChapterCheckpoint withSummary(String summary) {
        return new ChapterCheckpoint(processedWindows, totalWindows, complete, summary);
    }

    public ChapterCheckpoint advancedTo(int processed) {
        return new ChapterCheckpoint(Math.min(processed, totalWindows), totalWindows, false, chapterSummary);
    }

    public ChapterCheckpoint completed() {
        return new ChapterCheckpoint(totalWindows, totalWindows, true, chapterSummary);
    }

    public boolean hasSummary() {
        return chapterSummary != null && !chapterSummary.isBlank();
    }
}
