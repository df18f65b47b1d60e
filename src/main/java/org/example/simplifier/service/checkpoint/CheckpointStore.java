package org.example.simplifier.service.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Durable per-job storage of rewrite progress.
 * <p>
 * All operations are best-effort: loads return empty on missing or unreadable records and saves report
 * {@code false} instead of throwing, so a storage problem only costs resumability.
 */
public interface CheckpointStore {

    Optional<DocumentMetadata> loadMetadata(String jobId);

    boolean saveMetadata(String jobId, DocumentMetadata metadata);

    Optional<ChapterCheckpoint> loadChapter(String jobId, int chapterIndex);

    boolean saveChapter(String jobId, int chapterIndex, ChapterCheckpoint checkpoint);

    /**
     * @return rewritten window texts in window order, empty when nothing was stored
     */
    List<String> loadWindows(String jobId, int chapterIndex);

    boolean saveWindows(String jobId, int chapterIndex, List<String> rewrittenWindows);

    /**
     * Drops every record of the job so it restarts from scratch.
     */
    void invalidate(String jobId);
}
