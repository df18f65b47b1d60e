package org.example.simplifier.service.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps gateway outcomes to the text the pipeline keeps. Every failure degrades to content that was
 * already there, so a chapter is never lost or truncated because the backend misbehaved.
 */
public class FallbackPolicy {

    private static final Logger log = LoggerFactory.getLogger(FallbackPolicy.class);

    private final int summaryFallbackChars;

    public FallbackPolicy(int summaryFallbackChars) {
        this.summaryFallbackChars = Math.max(0, summaryFallbackChars);
    }

    public static FallbackPolicy defaults() {
        return new FallbackPolicy(1000);
    }

    /**
     * @param original the source words of the window that were not already covered by the previous window
     */
    public String forWindow(GatewayOutcome outcome, String original) {
        if (outcome.isSuccess()) {
            return outcome.text();
        }
        logFallback("window", outcome);
        return original;
    }

    public String forTransitions(GatewayOutcome outcome, String joinedChapter) {
        if (outcome.isSuccess()) {
            return outcome.text();
        }
        logFallback("transition smoothing", outcome);
        return joinedChapter;
    }

    public String forSummary(GatewayOutcome outcome, String source) {
        if (outcome.isSuccess()) {
            return outcome.text();
        }
        logFallback("summary", outcome);
        return truncate(source);
    }

    String truncate(String source) {
        if (source == null) {
            return "";
        }
        if (source.length() <= summaryFallbackChars) {
            return source;
        }
        return source.substring(0, summaryFallbackChars) + "...";
    }

    private void logFallback(String operation, GatewayOutcome outcome) {
        switch (outcome.failureKind()) {
            case INVALID_OUTPUT -> log.warn("Backend kept producing unusable {} output after {} attempt(s), "
                    + "keeping original text: {}", operation, outcome.attempts(), outcome.detail());
            case TIMEOUT, RATE_LIMITED -> log.warn("Backend {} for {} after {} attempt(s), keeping original text",
                    outcome.failureKind(), operation, outcome.attempts());
            default -> log.warn("Backend error for {} after {} attempt(s), keeping original text: {}",
                    operation, outcome.attempts(), outcome.detail());
        }
    }
}
