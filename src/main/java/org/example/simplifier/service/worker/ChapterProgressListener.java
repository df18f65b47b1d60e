package org.example.simplifier.service.worker;

/**
 * Receives window-level progress from chapter workers. Called from worker threads.
 */
@FunctionalInterface
public interface ChapterProgressListener {

    ChapterProgressListener NONE = (chapterIndex, processedWindows, totalWindows) -> { };

    void windowProcessed(int chapterIndex, int processedWindows, int totalWindows);
}
