package org.example.simplifier.config;

import org.example.simplifier.service.llm.HuggingFaceLlmProvider;
import org.example.simplifier.service.llm.LlmProvider;
import org.example.simplifier.service.llm.OllamaLlmProvider;
import org.example.simplifier.service.llm.OpenAiCompatibleLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the text-generation backend used by the rewrite gateway.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.rewrite.provider:ollama}")
    private String rewriteProvider;

    @Value("${ai.rewrite.timeout-seconds:90}")
    private int timeoutSeconds;

    @Value("${ai.rewrite.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.rewrite.ollama.model:gemma:2b}")
    private String ollamaModel;

    @Value("${ai.rewrite.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${ai.rewrite.openai.api-key:}")
    private String openAiApiKey;

    @Value("${ai.rewrite.openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${ai.rewrite.huggingface.model-url:https://api-inference.huggingface.co/models/meta-llama/Meta-Llama-3.1-8B-Instruct}")
    private String huggingFaceModelUrl;

    @Value("${ai.rewrite.huggingface.api-token:}")
    private String huggingFaceApiToken;

    @Bean
    public LlmProvider rewriteLlmProvider() {
        log.info("Configuring rewrite LLM provider: {}", rewriteProvider);
        return createProvider(rewriteProvider);
    }

    LlmProvider createProvider(String providerType) {
        String type = providerType == null ? "" : providerType.trim().toLowerCase();
        return switch (type) {
            case "ollama" -> ollama();
            case "openai" -> {
                if (openAiBaseUrl == null || openAiBaseUrl.isBlank()) {
                    log.warn("OpenAI-compatible base URL not configured, falling back to Ollama");
                    yield ollama();
                }
                log.info("Creating OpenAI-compatible provider: baseUrl={}, model={}", openAiBaseUrl, openAiModel);
                yield new OpenAiCompatibleLlmProvider(openAiBaseUrl, openAiApiKey, openAiModel, timeoutSeconds);
            }
            case "huggingface" -> {
                if (huggingFaceApiToken == null || huggingFaceApiToken.isBlank()) {
                    log.warn("Hugging Face API token not configured, falling back to Ollama");
                    yield ollama();
                }
                log.info("Creating Hugging Face provider: modelUrl={}", huggingFaceModelUrl);
                yield new HuggingFaceLlmProvider(huggingFaceModelUrl, huggingFaceApiToken, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}', falling back to Ollama", providerType);
                yield ollama();
            }
        };
    }

    private LlmProvider ollama() {
        log.info("Creating Ollama provider: baseUrl={}, model={}", ollamaBaseUrl, ollamaModel);
        return new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
    }
}
