package org.example.simplifier.service.llm;

/**
 * Abstraction for text-generation backends (Ollama, OpenAI-compatible, Hugging Face inference).
 */
public interface LlmProvider {

    /**
     * Generate a completion for a single prompt.
     *
     * @param prompt the prompt to send
     * @param options generation options (temperature, etc.)
     * @return the generated text
     * @throws LlmProviderException on transport errors, timeouts, or malformed responses
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     *
     * @return true if the provider can accept requests
     */
    boolean isAvailable();

    /**
     * Get the name of this provider for logging/debugging.
     *
     * @return provider name (e.g., "ollama", "openai")
     */
    String getProviderName();
}
