package org.example.simplifier.service.worker;

import org.example.simplifier.config.RewriteSettings;
import org.example.simplifier.service.checkpoint.CheckpointStore;
import org.example.simplifier.service.chunk.WordChunker;
import org.example.simplifier.service.context.ContextTracker;
import org.example.simplifier.service.gateway.FallbackPolicy;
import org.example.simplifier.service.gateway.RewriteGateway;
import org.example.simplifier.service.gateway.RewriteLevel;

/**
 * Everything the chapter workers of one job share. All members are read-only or thread-safe.
 */
public record ChapterJobContext(
        String jobId,
        RewriteLevel level,
        RewriteSettings settings,
        WordChunker chunker,
        RewriteGateway gateway,
        CheckpointStore checkpointStore,
        ContextTracker contextTracker,
        FallbackPolicy fallbackPolicy,
        String globalSummary,
        ChapterProgressListener progressListener
) {
    public ChapterJobContext {
        globalSummary = globalSummary == null ? "" : globalSummary;
        progressListener = progressListener == null ? ChapterProgressListener.NONE : progressListener;
    }
}
