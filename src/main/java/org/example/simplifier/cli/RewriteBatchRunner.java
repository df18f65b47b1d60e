package org.example.simplifier.cli;

import org.example.simplifier.model.JobState;
import org.example.simplifier.model.RewriteJobStatus;
import org.example.simplifier.service.RewriteJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Command-line runner that rewrites one EPUB and waits for the result.
 *
 * Run with: java -jar target/epub-simplifier.jar --spring.profiles.active=rewrite-cli
 *           --input=book.epub --level=2 [--output=book_simple.epub]
 */
@Component
@Profile("rewrite-cli")
public class RewriteBatchRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RewriteBatchRunner.class);

    private final RewriteJobService rewriteJobService;

    @Value("${input:}")
    private String input;

    @Value("${level:2}")
    private int level;

    @Value("${output:}")
    private String output;

    @Value("${rewrite.cli.poll-seconds:5}")
    private int pollSeconds;

    public RewriteBatchRunner(RewriteJobService rewriteJobService) {
        this.rewriteJobService = rewriteJobService;
    }

    @Override
    public void run(String... args) throws Exception {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Missing --input=<path to EPUB>");
        }
        Path source = Path.of(input);
        log.info("========================================");
        log.info("EPUB Rewrite Runner");
        log.info("========================================");
        log.info("Input: {}", source.toAbsolutePath());
        log.info("Level: {}", level);

        String jobId = rewriteJobService.submit(source, level);
        RewriteJobStatus status = awaitTerminal(jobId);

        log.info("========================================");
        if (status.state() == JobState.FAILED) {
            log.error("Job {} failed: {}", jobId, status.error());
            throw new IllegalStateException("Rewrite failed: " + status.error());
        }
        Path result = Path.of(status.outputRef());
        if (output != null && !output.isBlank()) {
            result = copyTo(result, Path.of(output));
        }
        log.info("Job {} complete: {} chapters", jobId, status.totalChapters());
        log.info("Output: {}", result.toAbsolutePath());
        log.info("========================================");
    }

    private RewriteJobStatus awaitTerminal(String jobId) throws InterruptedException {
        String lastMessage = null;
        while (true) {
            RewriteJobStatus status = rewriteJobService.status(jobId)
                    .orElseThrow(() -> new IllegalStateException("Unknown job " + jobId));
            if (!status.message().equals(lastMessage)) {
                log.info("[{}%] {}", status.progress(), status.message());
                lastMessage = status.message();
            }
            if (status.state().isTerminal()) {
                return status;
            }
            Thread.sleep(Math.max(1, pollSeconds) * 1000L);
        }
    }

    private Path copyTo(Path produced, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.copy(produced, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
