package org.example.simplifier.service.worker;

import org.example.simplifier.model.Chapter;
import org.example.simplifier.service.checkpoint.ChapterCheckpoint;
import org.example.simplifier.service.checkpoint.CheckpointStore;
import org.example.simplifier.service.chunk.Window;
import org.example.simplifier.service.chunk.WordChunker;
import org.example.simplifier.service.context.ContextTracker;
import org.example.simplifier.service.gateway.GatewayOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Rewrites one chapter window by window, checkpointing after every window so a restarted job picks up
 * at the first window that was not persisted.
 * <p>
 * A worker never fails its chapter: any unexpected error is logged and the original chapter is returned.
 * When no window could be rewritten the original content is returned verbatim, paragraph breaks included.
 */
public class ChapterWorker implements Callable<Chapter> {

    private static final Logger log = LoggerFactory.getLogger(ChapterWorker.class);

    private final int chapterIndex;
    private final Chapter chapter;
    private final ChapterJobContext context;

    private volatile ChapterStage stage = ChapterStage.PENDING;

    public ChapterWorker(int chapterIndex, Chapter chapter, ChapterJobContext context) {
        this.chapterIndex = chapterIndex;
        this.chapter = chapter;
        this.context = context;
    }

    @Override
    public Chapter call() {
        List<Window> windows = context.chunker().split(chapter.content());
        if (windows.isEmpty()) {
            log.debug("Job {}: chapter {} ({}) is not prose, keeping it as is",
                    context.jobId(), chapterIndex, chapter.id());
            stage = ChapterStage.DONE;
            return chapter;
        }
        try {
            Chapter result = rewrite(windows);
            stage = ChapterStage.DONE;
            return result;
        } catch (RuntimeException e) {
            log.warn("Job {}: chapter {} ({}) failed in stage {}, keeping original text",
                    context.jobId(), chapterIndex, chapter.id(), stage, e);
            stage = ChapterStage.FAILED;
            return chapter;
        }
    }

    public ChapterStage stage() {
        return stage;
    }

    private Chapter rewrite(List<Window> windows) {
        CheckpointStore store = context.checkpointStore();
        ContextTracker tracker = context.contextTracker();
        String jobId = context.jobId();
        int total = windows.size();

        ChapterCheckpoint checkpoint = store.loadChapter(jobId, chapterIndex).orElse(null);
        List<String> rewritten = new ArrayList<>();
        if (checkpoint != null && checkpoint.totalWindows() != total) {
            log.warn("Job {}: chapter {} checkpoint has {} windows but the chapter now has {}, restarting it",
                    jobId, chapterIndex, checkpoint.totalWindows(), total);
            checkpoint = ChapterCheckpoint.start(total).withSummary(checkpoint.chapterSummary());
        } else if (checkpoint == null) {
            checkpoint = ChapterCheckpoint.start(total);
        } else {
            rewritten.addAll(store.loadWindows(jobId, chapterIndex));
        }

        int resumeAt = Math.min(Math.min(checkpoint.processedWindows(), rewritten.size()), total);
        if (rewritten.size() > resumeAt) {
            rewritten.subList(resumeAt, rewritten.size()).clear();
        }

        if (checkpoint.complete() && resumeAt == total) {
            log.info("Job {}: chapter {} already rewritten, reusing {} windows", jobId, chapterIndex, total);
            context.progressListener().windowProcessed(chapterIndex, total, total);
            return finish(windows, rewritten);
        }
        if (resumeAt > 0) {
            log.info("Job {}: resuming chapter {} at window {}/{}", jobId, chapterIndex, resumeAt + 1, total);
        }

        stage = ChapterStage.FETCHING_SUMMARY;
        checkpoint = tracker.ensureChapterSummary(chapterIndex, chapter.content(), checkpoint);
        String chapterSummary = tracker.chapterSummary(checkpoint);

        stage = ChapterStage.REWRITING_WINDOWS;
        String memoryTail = resumeAt > 0 ? tracker.memoryTail(rewritten.get(resumeAt - 1)) : "";
        for (int i = resumeAt; i < total; i++) {
            Window window = windows.get(i);
            GatewayOutcome outcome = context.gateway().rewrite(
                    window.text(), context.globalSummary(), chapterSummary, memoryTail, context.level());
            String text = context.fallbackPolicy().forWindow(outcome, context.chunker().novelText(window));
            rewritten.add(text);
            memoryTail = tracker.memoryTail(text);

            if (store.saveWindows(jobId, chapterIndex, rewritten)) {
                checkpoint = checkpoint.advancedTo(i + 1);
                if (!store.saveChapter(jobId, chapterIndex, checkpoint)) {
                    log.warn("Job {}: progress of chapter {} not persisted after window {}", jobId, chapterIndex, i);
                }
            } else {
                log.warn("Job {}: window {} of chapter {} not persisted", jobId, i, chapterIndex);
            }
            log.debug("Job {}: chapter {} window {}/{} done ({} chars)",
                    jobId, chapterIndex, i + 1, total, text.length());
            context.progressListener().windowProcessed(chapterIndex, i + 1, total);
        }

        if (!store.saveChapter(jobId, chapterIndex, checkpoint.completed())) {
            log.warn("Job {}: completion of chapter {} not persisted", jobId, chapterIndex);
        }
        return finish(windows, rewritten);
    }

    private Chapter finish(List<Window> windows, List<String> rewritten) {
        if (allFellBack(windows, rewritten)) {
            log.info("Job {}: no window of chapter {} was rewritten, keeping original text",
                    context.jobId(), chapterIndex);
            return chapter;
        }
        String joined = String.join("\n\n", rewritten);
        if (context.settings().fastMode()) {
            return chapter.withContent(joined);
        }
        stage = ChapterStage.SMOOTHING_TRANSITIONS;
        GatewayOutcome outcome = context.gateway().smoothTransitions(joined);
        return chapter.withContent(context.fallbackPolicy().forTransitions(outcome, joined));
    }

    private boolean allFellBack(List<Window> windows, List<String> rewritten) {
        WordChunker chunker = context.chunker();
        for (int i = 0; i < windows.size(); i++) {
            if (!rewritten.get(i).equals(chunker.novelText(windows.get(i)))) {
                return false;
            }
        }
        return true;
    }
}
