package org.example.simplifier.model;

import java.time.LocalDateTime;

/**
 * Complete snapshot of a job's progress. Status updates always replace the whole snapshot.
 */
public record RewriteJobStatus(
        String jobId,
        JobState state,
        int progress,
        int totalChapters,
        int processedChapters,
        String message,
        String outputRef,   // nullable until completed
        String error,       // nullable unless failed
        LocalDateTime updatedAt
) {
    public static RewriteJobStatus queued(String jobId) {
        return new RewriteJobStatus(jobId, JobState.QUEUED, 0, 0, 0, "Job queued", null, null, LocalDateTime.now());
    }

    public RewriteJobStatus processing(int newProgress, int total, int processed, String newMessage) {
        return new RewriteJobStatus(jobId, JobState.PROCESSING, newProgress, total, processed, newMessage,
                null, null, LocalDateTime.now());
    }

    public RewriteJobStatus completed(String output) {
        return new RewriteJobStatus(jobId, JobState.COMPLETED, 100, totalChapters, totalChapters,
                "Processing complete", output, null, LocalDateTime.now());
    }

    public RewriteJobStatus failed(String errorMessage) {
        return new RewriteJobStatus(jobId, JobState.FAILED, progress, totalChapters, processedChapters,
                "Processing failed", null, errorMessage, LocalDateTime.now());
    }
}
