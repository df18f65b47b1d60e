package org.example.simplifier.service.checkpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store for tests. Can be told to fail every save.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, DocumentMetadata> metadata = new ConcurrentHashMap<>();
    private final Map<String, ChapterCheckpoint> chapters = new ConcurrentHashMap<>();
    private final Map<String, List<String>> windows = new ConcurrentHashMap<>();
    private volatile boolean failSaves;
    private volatile int invalidations;

    public void failSaves(boolean fail) {
        this.failSaves = fail;
    }

    public int invalidations() {
        return invalidations;
    }

    @Override
    public Optional<DocumentMetadata> loadMetadata(String jobId) {
        return Optional.ofNullable(metadata.get(jobId));
    }

    @Override
    public boolean saveMetadata(String jobId, DocumentMetadata value) {
        if (failSaves) {
            return false;
        }
        metadata.put(jobId, value);
        return true;
    }

    @Override
    public Optional<ChapterCheckpoint> loadChapter(String jobId, int chapterIndex) {
        return Optional.ofNullable(chapters.get(key(jobId, chapterIndex)));
    }

    @Override
    public boolean saveChapter(String jobId, int chapterIndex, ChapterCheckpoint checkpoint) {
        if (failSaves) {
            return false;
        }
        chapters.put(key(jobId, chapterIndex), checkpoint);
        return true;
    }

    @Override
    public List<String> loadWindows(String jobId, int chapterIndex) {
        return windows.getOrDefault(key(jobId, chapterIndex), List.of());
    }

    @Override
    public boolean saveWindows(String jobId, int chapterIndex, List<String> rewrittenWindows) {
        if (failSaves) {
            return false;
        }
        windows.put(key(jobId, chapterIndex), List.copyOf(new ArrayList<>(rewrittenWindows)));
        return true;
    }

    @Override
    public void invalidate(String jobId) {
        invalidations++;
        metadata.remove(jobId);
        chapters.keySet().removeIf(key -> key.startsWith(jobId + "#"));
        windows.keySet().removeIf(key -> key.startsWith(jobId + "#"));
    }

    private static String key(String jobId, int chapterIndex) {
        return jobId + "#" + chapterIndex;
    }
}
