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
import java.util.Map;

/**
 * LLM provider for the Hugging Face Inference API text-generation task.
 * The model URL is the full inference endpoint, e.g. {@code https://api-inference.huggingface.co/models/<model>}.
 */
public class HuggingFaceLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceLlmProvider.class);
    private static final double REPETITION_PENALTY = 1.15;

    private final WebClient webClient;
    private final String apiToken;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HuggingFaceLlmProvider(String modelUrl, String apiToken, int timeoutSeconds) {
        this(WebClient.builder()
                .baseUrl(modelUrl)
                .defaultHeader("Authorization", "Bearer " + apiToken)
                .build(), apiToken, timeoutSeconds);
        log.info("Hugging Face LLM provider initialized: modelUrl={}", modelUrl);
    }

    HuggingFaceLlmProvider(WebClient webClient, String apiToken, int timeoutSeconds) {
        this.webClient = webClient;
        this.apiToken = apiToken;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("temperature", options.temperature());
        parameters.put("repetition_penalty", REPETITION_PENALTY);
        parameters.put("return_full_text", false);
        if (options.topP() != null) {
            parameters.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            parameters.put("max_new_tokens", options.maxTokens());
        }

        Map<String, Object> requestBody = Map.of(
                "inputs", prompt,
                "parameters", parameters,
                "options", Map.of("wait_for_model", true)
        );

        try {
            String response = webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return extractGeneratedText(objectMapper.readTree(response));

        } catch (WebClientResponseException e) {
            log.error("Hugging Face API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Hugging Face API error: " + e.getStatusCode(), e,
                    e.getStatusCode().value());
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Hugging Face", e);
            throw new LlmProviderException("Failed to generate response from Hugging Face", e);
        }
    }

    private String extractGeneratedText(JsonNode node) {
        if (node == null) {
            throw new LlmProviderException("Empty response from Hugging Face");
        }
        if (node.isArray() && node.size() > 0 && node.get(0).has("generated_text")) {
            return node.get(0).get("generated_text").asText().trim();
        }
        if (node.isObject() && node.has("generated_text")) {
            return node.get("generated_text").asText().trim();
        }
        if (node.isObject() && node.has("error")) {
            throw new LlmProviderException("Hugging Face API error: " + node.get("error").asText());
        }
        throw new LlmProviderException("Invalid response format from Hugging Face");
    }

    @Override
    public boolean isAvailable() {
        if (apiToken == null || apiToken.isBlank()) {
            log.debug("Hugging Face not available: API token not configured");
            return false;
        }
        return true;
    }

    @Override
    public String getProviderName() {
        return "huggingface";
    }
}
