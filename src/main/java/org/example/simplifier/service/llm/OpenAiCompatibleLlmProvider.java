package org.example.simplifier.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for any OpenAI-compatible /chat/completions endpoint
 * (OpenAI, xAI, vLLM, LM Studio and similar local servers).
 */
public class OpenAiCompatibleLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleLlmProvider.class);
    private static final String SYSTEM_PROMPT =
            "You are an editorial assistant that rewrites text without summarizing it.";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAiCompatibleLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this(buildClient(baseUrl, apiKey), apiKey, model, timeoutSeconds);
        log.info("OpenAI-compatible LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    OpenAiCompatibleLlmProvider(WebClient webClient, String apiKey, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
    }

    private static WebClient buildClient(String baseUrl, String apiKey) {
        WebClient.Builder builder = WebClient.builder().baseUrl(baseUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        requestBody.put("temperature", options.temperature());

        if (options.topP() != null) {
            requestBody.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            requestBody.put("max_tokens", options.maxTokens());
        }

        try {
            String response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            JsonNode responseNode = objectMapper.readTree(response);
            JsonNode choices = responseNode == null ? null : responseNode.get("choices");
            if (choices != null && choices.isArray() && choices.size() > 0) {
                JsonNode message = choices.get(0).get("message");
                if (message != null && message.has("content")) {
                    return message.get("content").asText().trim();
                }
            }

            throw new LlmProviderException("Invalid response format from chat completions API");

        } catch (WebClientResponseException e) {
            log.error("Chat completions API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Chat completions API error: " + e.getStatusCode(), e,
                    e.getStatusCode().value());
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from chat completions API", e);
            throw new LlmProviderException("Failed to generate response from chat completions API", e);
        }
    }

    @Override
    public boolean isAvailable() {
        // Hosted endpoints are assumed reachable once a key is configured; local servers may run keyless.
        return model != null && !model.isBlank();
    }

    @Override
    public String getProviderName() {
        return apiKey == null || apiKey.isBlank() ? "openai-local" : "openai";
    }
}
