package org.example.simplifier.service;

import org.example.simplifier.config.RewriteSettings;
import org.example.simplifier.model.Chapter;
import org.example.simplifier.service.checkpoint.CheckpointStore;
import org.example.simplifier.service.checkpoint.DocumentMetadata;
import org.example.simplifier.service.chunk.WordChunker;
import org.example.simplifier.service.context.ContextTracker;
import org.example.simplifier.service.gateway.FallbackPolicy;
import org.example.simplifier.service.gateway.RewriteGateway;
import org.example.simplifier.service.gateway.RewriteLevel;
import org.example.simplifier.service.worker.ChapterJobContext;
import org.example.simplifier.service.worker.ChapterWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the chapter workers of one job on a bounded pool and returns their chapters in input order.
 * Also prepares the job-level checkpoint scope and the book summary before any worker starts.
 */
@Service
public class ChapterScheduler {

    private static final Logger log = LoggerFactory.getLogger(ChapterScheduler.class);

    private final RewriteGateway gateway;
    private final CheckpointStore checkpointStore;
    private final FallbackPolicy fallbackPolicy;

    public ChapterScheduler(RewriteGateway gateway, CheckpointStore checkpointStore, FallbackPolicy fallbackPolicy) {
        this.gateway = gateway;
        this.checkpointStore = checkpointStore;
        this.fallbackPolicy = fallbackPolicy;
    }

    /**
     * @throws IllegalStateException when a worker dies with an error or the calling thread is interrupted
     */
    public List<Chapter> run(String jobId, List<Chapter> chapters, RewriteLevel level,
                             RewriteSettings settings, ProgressTracker progress) {
        if (chapters.isEmpty()) {
            return List.of();
        }

        checkBackend(jobId);
        ContextTracker contextTracker = new ContextTracker(jobId, gateway, checkpointStore, fallbackPolicy, settings);
        DocumentMetadata metadata = prepareMetadata(jobId, level, chapters.size());
        metadata = contextTracker.ensureGlobalSummary(metadata, chapters);

        ChapterJobContext context = new ChapterJobContext(
                jobId,
                level,
                settings,
                new WordChunker(settings.chunkSize(), settings.overlap()),
                gateway,
                checkpointStore,
                contextTracker,
                fallbackPolicy,
                contextTracker.globalSummary(metadata),
                progress
        );

        int poolSize = Math.max(1, Math.min(settings.maxWorkers(), chapters.size()));
        log.info("Job {}: rewriting {} chapters with {} workers (fastMode={}, chunk={}/{})",
                jobId, chapters.size(), poolSize, settings.fastMode(), settings.chunkSize(), settings.overlap());

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new ChapterWorkerThreadFactory(jobId));
        try {
            CompletionService<IndexedChapter> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < chapters.size(); i++) {
                int index = i;
                ChapterWorker worker = new ChapterWorker(index, chapters.get(index), context);
                completion.submit(() -> new IndexedChapter(index, worker.call()));
            }

            Chapter[] results = new Chapter[chapters.size()];
            for (int done = 0; done < chapters.size(); done++) {
                IndexedChapter finished = completion.take().get();
                results[finished.index()] = finished.chapter();
                progress.chapterFinished(finished.index());
                log.info("Job {}: chapter {}/{} finished ({})",
                        jobId, finished.index() + 1, chapters.size(), finished.chapter().id());
            }
            return Arrays.asList(results);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rewriting chapters of job " + jobId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Chapter worker crashed in job " + jobId + ": "
                    + e.getCause(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private void checkBackend(String jobId) {
        String backend = gateway.backendName();
        if (gateway.isAvailable()) {
            log.info("Job {}: using rewrite backend {}", jobId, backend);
        } else {
            log.warn("Job {}: rewrite backend {} is not available, windows will keep their original text "
                    + "until it answers", jobId, backend);
        }
    }

    DocumentMetadata prepareMetadata(String jobId, RewriteLevel level, int totalChapters) {
        DocumentMetadata stored = checkpointStore.loadMetadata(jobId).orElse(null);
        if (stored != null && stored.isCompatibleWith(level.value()) && stored.totalChapters() == totalChapters) {
            log.info("Job {}: resuming from existing checkpoints", jobId);
            return stored;
        }
        if (stored != null) {
            log.warn("Job {}: stored checkpoints are incompatible (schema {}, level {}, {} chapters), starting over",
                    jobId, stored.schemaVersion(), stored.simplificationLevel(), stored.totalChapters());
        }
        // chapter records without readable job metadata cannot be trusted either
        checkpointStore.invalidate(jobId);
        DocumentMetadata created = DocumentMetadata.create(level.value(), totalChapters);
        if (!checkpointStore.saveMetadata(jobId, created)) {
            log.warn("Job {}: job metadata not persisted, this run will not be resumable", jobId);
        }
        return created;
    }

    private record IndexedChapter(int index, Chapter chapter) {
    }

    private static final class ChapterWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);
        private final String jobId;

        private ChapterWorkerThreadFactory(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "chapter-worker-" + jobId + "-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
