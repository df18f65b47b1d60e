package org.example.simplifier.service;

import org.example.simplifier.model.RewriteJobStatus;
import org.example.simplifier.service.worker.ChapterProgressListener;

/**
 * Turns window and chapter events of one job into status snapshots.
 * <p>
 * Progress is finished chapters plus the fraction of in-flight ones, scaled to 95%; the rest is
 * reserved for rebuilding the document. Reported progress never decreases.
 */
public class ProgressTracker implements ChapterProgressListener {

    static final int REWRITE_SHARE = 95;

    private final String jobId;
    private final int totalChapters;
    private final JobStatusStore statusStore;
    private final double[] fractions;
    private int finishedChapters;
    private int progress;

    public ProgressTracker(String jobId, int totalChapters, JobStatusStore statusStore) {
        this.jobId = jobId;
        this.totalChapters = totalChapters;
        this.statusStore = statusStore;
        this.fractions = new double[totalChapters];
    }

    public synchronized void started() {
        publish("Rewriting " + totalChapters + " chapters");
    }

    @Override
    public synchronized void windowProcessed(int chapterIndex, int processedWindows, int totalWindows) {
        if (totalWindows > 0) {
            fractions[chapterIndex] = Math.max(fractions[chapterIndex],
                    Math.min(1.0, (double) processedWindows / totalWindows));
        }
        publish(String.format("Chapter %d/%d: rewriting part %d/%d",
                chapterIndex + 1, totalChapters, processedWindows, totalWindows));
    }

    public synchronized void chapterFinished(int chapterIndex) {
        fractions[chapterIndex] = 1.0;
        finishedChapters++;
        publish(String.format("Chapters finished: %d/%d", finishedChapters, totalChapters));
    }

    public synchronized void reconstructing() {
        progress = Math.max(progress, REWRITE_SHARE);
        write("Building final EPUB...");
    }

    public synchronized int progress() {
        return progress;
    }

    private void publish(String message) {
        if (totalChapters > 0) {
            double done = 0;
            for (double fraction : fractions) {
                done += fraction;
            }
            progress = Math.max(progress, (int) Math.floor(done / totalChapters * REWRITE_SHARE));
        }
        write(message);
    }

    private void write(String message) {
        RewriteJobStatus current = statusStore.get(jobId).orElseGet(() -> RewriteJobStatus.queued(jobId));
        statusStore.set(current.processing(progress, totalChapters, finishedChapters, message));
    }
}
