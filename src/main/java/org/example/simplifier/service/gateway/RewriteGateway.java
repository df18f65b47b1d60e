package org.example.simplifier.service.gateway;

/**
 * Backend-agnostic text rewriting capability used by the chapter pipeline.
 * <p>
 * Implementations validate what the backend returns and retry within their budget; they never throw for
 * backend problems but report them as a failed {@link GatewayOutcome}.
 */
public interface RewriteGateway {

    /**
     * Rewrite one window of chapter text without shortening it.
     *
     * @param windowText     the words to rewrite
     * @param globalSummary  summary of the whole book, may be empty
     * @param chapterSummary summary of the current chapter, may be empty
     * @param memoryTail     end of the previously rewritten window, may be empty
     * @param level          rewrite intensity
     */
    GatewayOutcome rewrite(String windowText, String globalSummary, String chapterSummary,
                           String memoryTail, RewriteLevel level);

    GatewayOutcome summarize(String text, SummaryScope scope);

    /**
     * Smooth the transitions between already rewritten windows of a full chapter.
     */
    GatewayOutcome smoothTransitions(String chapterText);

    /**
     * Name of the backend behind this gateway, for logging.
     */
    String backendName();

    /**
     * Whether the backend looks reachable and configured. Calls still degrade to fallbacks when it is not.
     */
    boolean isAvailable();
}
