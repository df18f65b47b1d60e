package org.example.simplifier.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens   // nullable
) {
    /**
     * Create options with all parameters.
     */
    public static LlmOptions full(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens);
    }

    public LlmOptions withMaxTokens(int tokens) {
        return new LlmOptions(temperature, topP, tokens);
    }
}
