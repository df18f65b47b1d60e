package org.example.simplifier.service;

import org.example.simplifier.config.RewriteSettings;
import org.example.simplifier.model.Chapter;
import org.example.simplifier.model.RewriteJobStatus;
import org.example.simplifier.service.checkpoint.ChapterCheckpoint;
import org.example.simplifier.service.checkpoint.DocumentMetadata;
import org.example.simplifier.service.checkpoint.InMemoryCheckpointStore;
import org.example.simplifier.service.gateway.FallbackPolicy;
import org.example.simplifier.service.gateway.RewriteLevel;
import org.example.simplifier.service.gateway.StubRewriteGateway;
import org.example.simplifier.service.gateway.SummaryScope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChapterSchedulerTest {

    private static final String JOB = "job-1";

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    void run_randomDelays_keepsInputOrder() {
        List<Chapter> chapters = List.of(chapter("A", 30), chapter("B", 12), chapter("C", 45));

        for (int round = 0; round < 5; round++) {
            StubRewriteGateway gateway = new StubRewriteGateway().withRandomDelay(15);
            ChapterScheduler scheduler = new ChapterScheduler(gateway, new InMemoryCheckpointStore(),
                    FallbackPolicy.defaults());

            List<Chapter> result = scheduler.run(JOB, chapters, RewriteLevel.LIGHT, settings(2),
                    new ProgressTracker(JOB, chapters.size(), new InMemoryJobStatusStore()));

            assertEquals(List.of("A", "B", "C"), result.stream().map(Chapter::id).toList());
            for (int i = 0; i < chapters.size(); i++) {
                assertTrue(result.get(i).content().startsWith(StubRewriteGateway.PREFIX + chapters.get(i).id()));
            }
        }
    }

    @Test
    void run_progressIsMonotonicAndEndsAtRewriteShare() {
        RecordingStatusStore statuses = new RecordingStatusStore();
        List<Chapter> chapters = List.of(chapter("A", 40), chapter("B", 25), chapter("C", 60), chapter("D", 8));
        ChapterScheduler scheduler = new ChapterScheduler(new StubRewriteGateway().withRandomDelay(5), store,
                FallbackPolicy.defaults());

        scheduler.run(JOB, chapters, RewriteLevel.MODERATE, settings(3),
                new ProgressTracker(JOB, chapters.size(), statuses));

        List<Integer> progress = statuses.history.stream().map(RewriteJobStatus::progress).toList();
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) >= progress.get(i - 1), "progress went back: " + progress);
        }
        assertEquals(95, progress.get(progress.size() - 1));
        assertEquals(4, statuses.history.get(statuses.history.size() - 1).processedChapters());
    }

    @Test
    void run_failingChapterDoesNotAffectSiblings() {
        List<Chapter> chapters = List.of(chapter("A", 20), chapter("B", 20), chapter("C", 20));
        StubRewriteGateway gateway = new StubRewriteGateway().throwingWhen(text -> text.startsWith("B"));
        ChapterScheduler scheduler = new ChapterScheduler(gateway, store, FallbackPolicy.defaults());

        List<Chapter> result = scheduler.run(JOB, chapters, RewriteLevel.LIGHT, settings(2),
                new ProgressTracker(JOB, chapters.size(), new InMemoryJobStatusStore()));

        assertSame(chapters.get(1), result.get(1));
        assertTrue(result.get(0).content().startsWith(StubRewriteGateway.PREFIX));
        assertTrue(result.get(2).content().startsWith(StubRewriteGateway.PREFIX));
    }

    @Test
    void run_summarizesBookOnceAndReusesItOnResume() {
        List<Chapter> chapters = List.of(chapter("A", 20), chapter("B", 20));
        StubRewriteGateway first = new StubRewriteGateway();
        new ChapterScheduler(first, store, FallbackPolicy.defaults()).run(JOB, chapters, RewriteLevel.LIGHT,
                settings(2), new ProgressTracker(JOB, 2, new InMemoryJobStatusStore()));
        StubRewriteGateway second = new StubRewriteGateway();

        new ChapterScheduler(second, store, FallbackPolicy.defaults()).run(JOB, chapters, RewriteLevel.LIGHT,
                settings(2), new ProgressTracker(JOB, 2, new InMemoryJobStatusStore()));

        assertEquals(1, first.summaryCalls().stream().filter(scope -> scope == SummaryScope.BOOK).count());
        assertTrue(store.loadMetadata(JOB).orElseThrow().hasGlobalSummary());
        assertTrue(second.summaryCalls().isEmpty());
        assertTrue(second.rewriteCalls().isEmpty());
    }

    @Test
    void run_checkpointsForAnotherLevel_areDiscarded() {
        List<Chapter> chapters = List.of(chapter("A", 20));
        store.saveMetadata(JOB, DocumentMetadata.create(RewriteLevel.LIGHT.value(), 1).withGlobalSummary("old"));
        store.saveChapter(JOB, 0, new ChapterCheckpoint(1, 1, true, "old chapter"));
        store.saveWindows(JOB, 0, List.of("old window"));
        StubRewriteGateway gateway = new StubRewriteGateway();

        List<Chapter> result = new ChapterScheduler(gateway, store, FallbackPolicy.defaults()).run(JOB, chapters,
                RewriteLevel.AGGRESSIVE, settings(2), new ProgressTracker(JOB, 1, new InMemoryJobStatusStore()));

        assertEquals(1, gateway.rewriteCalls().size());
        assertFalse(result.get(0).content().contains("old window"));
        assertEquals(RewriteLevel.AGGRESSIVE.value(),
                store.loadMetadata(JOB).orElseThrow().simplificationLevel());
    }

    @Test
    void run_unavailableBackend_checksOnceAndStillReturnsEveryChapter() {
        List<Chapter> chapters = List.of(chapter("A", 20), chapter("B", 20));
        StubRewriteGateway gateway = new StubRewriteGateway().unavailable()
                .failingWhen(text -> true);

        List<Chapter> result = new ChapterScheduler(gateway, store, FallbackPolicy.defaults()).run(JOB, chapters,
                RewriteLevel.LIGHT, settings(2), new ProgressTracker(JOB, 2, new InMemoryJobStatusStore()));

        assertEquals(1, gateway.availabilityChecks());
        assertSame(chapters.get(0), result.get(0));
        assertSame(chapters.get(1), result.get(1));
    }

    @Test
    void run_noChapters_returnsEmptyList() {
        ChapterScheduler scheduler = new ChapterScheduler(new StubRewriteGateway(), store, FallbackPolicy.defaults());

        assertTrue(scheduler.run(JOB, List.of(), RewriteLevel.LIGHT, settings(2),
                new ProgressTracker(JOB, 0, new InMemoryJobStatusStore())).isEmpty());
    }

    private static RewriteSettings settings(int maxWorkers) {
        return new RewriteSettings(false, maxWorkers, 10, 2, 400, RewriteSettings.SummarySettings.defaults());
    }

    private static Chapter chapter(String id, int words) {
        String content = IntStream.range(0, words).mapToObj(i -> id + i).collect(Collectors.joining(" "));
        return new Chapter(id, "Chapter " + id, content);
    }

    private static final class RecordingStatusStore implements JobStatusStore {
        private final List<RewriteJobStatus> history = new CopyOnWriteArrayList<>();

        @Override
        public Optional<RewriteJobStatus> get(String jobId) {
            return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
        }

        @Override
        public void set(RewriteJobStatus status) {
            history.add(status);
        }
    }
}
