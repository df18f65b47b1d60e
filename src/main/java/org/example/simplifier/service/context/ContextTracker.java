package org.example.simplifier.service.context;

import org.example.simplifier.config.RewriteSettings;
import org.example.simplifier.model.Chapter;
import org.example.simplifier.service.checkpoint.ChapterCheckpoint;
import org.example.simplifier.service.checkpoint.CheckpointStore;
import org.example.simplifier.service.checkpoint.DocumentMetadata;
import org.example.simplifier.service.gateway.FallbackPolicy;
import org.example.simplifier.service.gateway.GatewayOutcome;
import org.example.simplifier.service.gateway.RewriteGateway;
import org.example.simplifier.service.gateway.SummaryScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Supplies the context sent along with every window: a book summary, a chapter summary and the memory
 * tail of the previous window. Summaries are computed at most once per job and cached in the checkpoints.
 * In fast mode no summaries are requested and both are empty.
 */
public class ContextTracker {

    private static final Logger log = LoggerFactory.getLogger(ContextTracker.class);

    private final String jobId;
    private final RewriteGateway gateway;
    private final CheckpointStore checkpointStore;
    private final FallbackPolicy fallbackPolicy;
    private final RewriteSettings settings;

    public ContextTracker(String jobId,
                          RewriteGateway gateway,
                          CheckpointStore checkpointStore,
                          FallbackPolicy fallbackPolicy,
                          RewriteSettings settings) {
        this.jobId = jobId;
        this.gateway = gateway;
        this.checkpointStore = checkpointStore;
        this.fallbackPolicy = fallbackPolicy;
        this.settings = settings;
    }

    /**
     * Returns the cached book summary or computes it from the first chapters and caches it.
     *
     * @return the metadata as persisted, carrying the summary unless fast mode is on
     */
    public DocumentMetadata ensureGlobalSummary(DocumentMetadata metadata, List<Chapter> chapters) {
        if (settings.fastMode() || metadata.hasGlobalSummary()) {
            return metadata;
        }
        String source = globalSummarySource(chapters);
        if (source.isBlank()) {
            return metadata;
        }
        log.info("Job {}: summarizing book ({} chars of sample text)", jobId, source.length());
        GatewayOutcome outcome = gateway.summarize(source, SummaryScope.BOOK);
        DocumentMetadata updated = metadata.withGlobalSummary(fallbackPolicy.forSummary(outcome, source));
        if (!checkpointStore.saveMetadata(jobId, updated)) {
            log.warn("Job {}: book summary not persisted, it will be recomputed on resume", jobId);
        }
        return updated;
    }

    /**
     * Returns the cached chapter summary or computes it and stores it in the chapter checkpoint.
     *
     * @return the checkpoint carrying the summary, unchanged in fast mode
     */
    public ChapterCheckpoint ensureChapterSummary(int chapterIndex, String chapterText, ChapterCheckpoint checkpoint) {
        if (settings.fastMode() || checkpoint.hasSummary()) {
            return checkpoint;
        }
        String source = truncate(chapterText, settings.summary().chapterMaxChars());
        GatewayOutcome outcome = gateway.summarize(source, SummaryScope.CHAPTER);
        ChapterCheckpoint updated = checkpoint.withSummary(fallbackPolicy.forSummary(outcome, source));
        if (!checkpointStore.saveChapter(jobId, chapterIndex, updated)) {
            log.warn("Job {}: summary of chapter {} not persisted", jobId, chapterIndex);
        }
        return updated;
    }

    public String globalSummary(DocumentMetadata metadata) {
        return settings.fastMode() || metadata.globalSummary() == null ? "" : metadata.globalSummary();
    }

    public String chapterSummary(ChapterCheckpoint checkpoint) {
        return settings.fastMode() || checkpoint.chapterSummary() == null ? "" : checkpoint.chapterSummary();
    }

    public String memoryTail(String rewrittenWindow) {
        return memoryTail(rewrittenWindow, settings.memoryTailChars());
    }

    public static String memoryTail(String text, int maxChars) {
        if (text == null || maxChars <= 0) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }

    String globalSummarySource(List<Chapter> chapters) {
        RewriteSettings.SummarySettings budget = settings.summary();
        StringBuilder source = new StringBuilder();
        int used = 0;
        for (Chapter chapter : chapters) {
            if (used >= budget.globalChapters()) {
                break;
            }
            if (chapter.content() == null || chapter.content().isBlank()) {
                continue;
            }
            if (source.length() > 0) {
                source.append("\n\n");
            }
            source.append(truncate(chapter.content(), budget.globalSampleChars()));
            used++;
        }
        return truncate(source.toString(), budget.globalMaxChars());
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
