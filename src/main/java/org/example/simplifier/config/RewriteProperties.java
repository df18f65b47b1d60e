package org.example.simplifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Tuning knobs for the rewrite pipeline, bound from {@code rewrite.*}.
 * Converted into an immutable {@link RewriteSettings} snapshot when a job is submitted.
 */
@Component
@ConfigurationProperties(prefix = "rewrite")
public class RewriteProperties {

    private boolean fastMode = false;
    private int maxWorkers = 2;
    private int memoryTailChars = 400;
    private Chunk chunk = new Chunk();
    private Summary summary = new Summary();
    private Retry retry = new Retry();
    private Validation validation = new Validation();
    private Generation generation = new Generation();
    private Storage checkpoint = new Storage(defaultDir("checkpoints"));
    private Storage output = new Storage(defaultDir("processed"));
    private Jobs jobs = new Jobs();

    public RewriteSettings toSettings() {
        ChunkProfile profile = fastMode ? chunk.getFast() : chunk.getQuality();
        return new RewriteSettings(
                fastMode,
                Math.max(1, maxWorkers),
                profile.getSize(),
                profile.getOverlap(),
                Math.max(0, memoryTailChars),
                new RewriteSettings.SummarySettings(
                        summary.getGlobalChapters(),
                        summary.getGlobalSampleChars(),
                        summary.getGlobalMaxChars(),
                        summary.getChapterMaxChars()
                )
        );
    }

    private static String defaultDir(String name) {
        return Path.of(System.getProperty("java.io.tmpdir"), "epub-simplifier", name).toString();
    }

    public boolean isFastMode() {
        return fastMode;
    }

    public void setFastMode(boolean fastMode) {
        this.fastMode = fastMode;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getMemoryTailChars() {
        return memoryTailChars;
    }

    public void setMemoryTailChars(int memoryTailChars) {
        this.memoryTailChars = memoryTailChars;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public void setChunk(Chunk chunk) {
        this.chunk = chunk == null ? new Chunk() : chunk;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary == null ? new Summary() : summary;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry == null ? new Retry() : retry;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation == null ? new Validation() : validation;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation == null ? new Generation() : generation;
    }

    public Storage getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Storage checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Storage getOutput() {
        return output;
    }

    public void setOutput(Storage output) {
        this.output = output;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs == null ? new Jobs() : jobs;
    }

    public static class Chunk {
        private ChunkProfile quality = new ChunkProfile(350, 50);
        private ChunkProfile fast = new ChunkProfile(600, 20);

        public ChunkProfile getQuality() {
            return quality;
        }

        public void setQuality(ChunkProfile quality) {
            this.quality = quality;
        }

        public ChunkProfile getFast() {
            return fast;
        }

        public void setFast(ChunkProfile fast) {
            this.fast = fast;
        }
    }

    public static class ChunkProfile {
        private int size;
        private int overlap;

        public ChunkProfile() {
        }

        public ChunkProfile(int size, int overlap) {
            this.size = size;
            this.overlap = overlap;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Summary {
        private int globalChapters = 8;
        private int globalSampleChars = 2000;
        private int globalMaxChars = 15000;
        private int chapterMaxChars = 15000;
        private int minChars = 50;
        private int fallbackChars = 1000;

        public int getGlobalChapters() {
            return globalChapters;
        }

        public void setGlobalChapters(int globalChapters) {
            this.globalChapters = globalChapters;
        }

        public int getGlobalSampleChars() {
            return globalSampleChars;
        }

        public void setGlobalSampleChars(int globalSampleChars) {
            this.globalSampleChars = globalSampleChars;
        }

        public int getGlobalMaxChars() {
            return globalMaxChars;
        }

        public void setGlobalMaxChars(int globalMaxChars) {
            this.globalMaxChars = globalMaxChars;
        }

        public int getChapterMaxChars() {
            return chapterMaxChars;
        }

        public void setChapterMaxChars(int chapterMaxChars) {
            this.chapterMaxChars = chapterMaxChars;
        }

        public int getMinChars() {
            return minChars;
        }

        public void setMinChars(int minChars) {
            this.minChars = minChars;
        }

        public int getFallbackChars() {
            return fallbackChars;
        }

        public void setFallbackChars(int fallbackChars) {
            this.fallbackChars = fallbackChars;
        }
    }

    public static class Retry {
        private int attempts = 3;
        private long backoffMillis = 800L;

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public long getBackoffMillis() {
            return backoffMillis;
        }

        public void setBackoffMillis(long backoffMillis) {
            this.backoffMillis = backoffMillis;
        }
    }

    public static class Validation {
        private int minChars = 200;
        private double minUniqueRatio = 0.25;
        private int ngramSize = 6;
        private int maxNgramRepeats = 5;
        private double transitionMinRatio = 0.5;
        private int transitionMinChars = 100;

        public int getMinChars() {
            return minChars;
        }

        public void setMinChars(int minChars) {
            this.minChars = minChars;
        }

        public double getMinUniqueRatio() {
            return minUniqueRatio;
        }

        public void setMinUniqueRatio(double minUniqueRatio) {
            this.minUniqueRatio = minUniqueRatio;
        }

        public int getNgramSize() {
            return ngramSize;
        }

        public void setNgramSize(int ngramSize) {
            this.ngramSize = ngramSize;
        }

        public int getMaxNgramRepeats() {
            return maxNgramRepeats;
        }

        public void setMaxNgramRepeats(int maxNgramRepeats) {
            this.maxNgramRepeats = maxNgramRepeats;
        }

        public double getTransitionMinRatio() {
            return transitionMinRatio;
        }

        public void setTransitionMinRatio(double transitionMinRatio) {
            this.transitionMinRatio = transitionMinRatio;
        }

        public int getTransitionMinChars() {
            return transitionMinChars;
        }

        public void setTransitionMinChars(int transitionMinChars) {
            this.transitionMinChars = transitionMinChars;
        }
    }

    public static class Generation {
        private double temperature = 0.3;
        private double topP = 0.9;
        private int qualityMaxTokens = 1200;
        private int fastMaxTokens = 600;
        private int summaryMaxTokens = 600;

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public double getTopP() {
            return topP;
        }

        public void setTopP(double topP) {
            this.topP = topP;
        }

        public int getQualityMaxTokens() {
            return qualityMaxTokens;
        }

        public void setQualityMaxTokens(int qualityMaxTokens) {
            this.qualityMaxTokens = qualityMaxTokens;
        }

        public int getFastMaxTokens() {
            return fastMaxTokens;
        }

        public void setFastMaxTokens(int fastMaxTokens) {
            this.fastMaxTokens = fastMaxTokens;
        }

        public int getSummaryMaxTokens() {
            return summaryMaxTokens;
        }

        public void setSummaryMaxTokens(int summaryMaxTokens) {
            this.summaryMaxTokens = summaryMaxTokens;
        }
    }

    public static class Storage {
        private String dir;

        public Storage() {
        }

        public Storage(String dir) {
            this.dir = dir;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Jobs {
        private int maxConcurrent = 2;

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }
    }
}
