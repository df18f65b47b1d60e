package org.example.simplifier.service;

import org.example.simplifier.config.RewriteProperties;
import org.example.simplifier.config.RewriteSettings;
import org.example.simplifier.epub.DocumentReconstructor;
import org.example.simplifier.epub.EpubDocument;
import org.example.simplifier.epub.EpubReader;
import org.example.simplifier.epub.EpubWriter;
import org.example.simplifier.model.Chapter;
import org.example.simplifier.model.JobState;
import org.example.simplifier.model.RewriteJobStatus;
import org.example.simplifier.service.gateway.RewriteLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts rewrite jobs and runs them in the background: read the EPUB, rewrite its chapters, rebuild and
 * write the output. Job ids derive from the source bytes and level, so resubmitting the same book resumes
 * from its checkpoints.
 */
@Service
public class RewriteJobService {

    private static final Logger log = LoggerFactory.getLogger(RewriteJobService.class);

    private final EpubReader epubReader;
    private final EpubWriter epubWriter;
    private final DocumentReconstructor reconstructor;
    private final ChapterScheduler scheduler;
    private final JobStatusStore statusStore;
    private final RewriteProperties properties;
    private final ExecutorService executorService;

    public RewriteJobService(EpubReader epubReader,
                             EpubWriter epubWriter,
                             DocumentReconstructor reconstructor,
                             ChapterScheduler scheduler,
                             JobStatusStore statusStore,
                             RewriteProperties properties) {
        this.epubReader = epubReader;
        this.epubWriter = epubWriter;
        this.reconstructor = reconstructor;
        this.scheduler = scheduler;
        this.statusStore = statusStore;
        this.properties = properties;
        this.executorService = Executors.newFixedThreadPool(
                Math.max(1, properties.getJobs().getMaxConcurrent()),
                new RewriteJobThreadFactory());
    }

    public String submit(Path epubPath, int level) throws IOException {
        RewriteLevel rewriteLevel = RewriteLevel.fromValue(level);
        return submit(Files.readAllBytes(epubPath), rewriteLevel);
    }

    public String submit(byte[] epubBytes, int level) {
        return submit(epubBytes, RewriteLevel.fromValue(level));
    }

    /**
     * @throws IllegalStateException when the same book is already queued or running at this level
     */
    public synchronized String submit(byte[] epubBytes, RewriteLevel level) {
        if (epubBytes == null) {
            throw new IllegalArgumentException("EPUB content is required");
        }
        if (level == null) {
            throw new IllegalArgumentException("Rewrite level is required");
        }
        String jobId = jobId(epubBytes, level);
        Optional<RewriteJobStatus> existing = statusStore.get(jobId);
        if (existing.isPresent() && !existing.get().state().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is already " + existing.get().state());
        }

        RewriteSettings settings = properties.toSettings();
        statusStore.set(RewriteJobStatus.queued(jobId));
        executorService.submit(() -> runJob(jobId, epubBytes, level, settings));
        log.info("Submitted job {} (level {}, {} bytes)", jobId, level.label(), epubBytes.length);
        return jobId;
    }

    public Optional<RewriteJobStatus> status(String jobId) {
        return statusStore.get(jobId);
    }

    /**
     * Reads the output of a completed job back from disk. Empty while the job runs, after it failed, or
     * when its output file is gone.
     */
    public Optional<EpubDocument> result(String jobId) {
        return statusStore.get(jobId)
                .filter(status -> status.state() == JobState.COMPLETED && status.outputRef() != null)
                .map(status -> Path.of(status.outputRef()))
                .filter(Files::isRegularFile)
                .map(this::readOutput);
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    static String jobId(byte[] epubBytes, RewriteLevel level) {
        return EpubReader.digest(epubBytes).substring(0, 16) + "-L" + level.value();
    }

    private void runJob(String jobId, byte[] epubBytes, RewriteLevel level, RewriteSettings settings) {
        try {
            statusStore.set(current(jobId).processing(0, 0, 0, "Reading document"));
            EpubDocument document = epubReader.read(epubBytes);
            List<Chapter> chapters = document.chapters();
            log.info("Job {}: '{}' has {} content documents", jobId, document.metadata().title(), chapters.size());

            ProgressTracker progress = new ProgressTracker(jobId, chapters.size(), statusStore);
            progress.started();
            List<Chapter> rewritten = scheduler.run(jobId, chapters, level, settings, progress);

            progress.reconstructing();
            DocumentReconstructor.Result reconstruction =
                    reconstructor.reconstruct(document, rewritten, level.titleSuffix());
            Path target = Path.of(properties.getOutput().getDir())
                    .resolve(jobId + "_simplified_level_" + level.value() + ".epub");
            Path written = epubWriter.write(reconstruction.document(), target);

            statusStore.set(current(jobId).completed(written.toString()));
            log.info("Job {} completed: {}", jobId, written);
        } catch (Exception ex) {
            log.error("Job {} failed: {}", jobId, safeErrorMessage(ex), ex);
            statusStore.set(current(jobId).failed(safeErrorMessage(ex)));
        }
    }

    private EpubDocument readOutput(Path output) {
        try {
            return epubReader.read(Files.readAllBytes(output));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read job output " + output, e);
        }
    }

    private RewriteJobStatus current(String jobId) {
        return statusStore.get(jobId).orElseGet(() -> RewriteJobStatus.queued(jobId));
    }

    private String safeErrorMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private static final class RewriteJobThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "rewrite-job-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
