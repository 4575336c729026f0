package com.carelogs.pipeline.service;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation of TextGenerationStrategy, built by LLMProviderFactory.
 *
 * A prompt blocked by Gemini's safety filters comes back without candidates and is
 * reported as a failed generation, so the caller falls back to its default.
 */
@Slf4j
public class GoogleTextGenerationService implements TextGenerationStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String apiKey;
    private final String model;

    public GoogleTextGenerationService(String apiKey, String baseUrl, String model) {
        this(apiKey, baseUrl, model, WebClient.builder());
    }

    public GoogleTextGenerationService(String apiKey, String baseUrl, String model,
            WebClient.Builder webClientBuilder) {
        this.apiKey = apiKey;
        this.model = model;
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Google Gemini (" + model + ")";
    }

    @Override
    public GenerationResult generateText(String prompt, int maxOutputTokens, double temperature) {
        Map<String, Object> generateRequest = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "maxOutputTokens", maxOutputTokens,
                        "temperature", temperature));

        String body;
        try {
            body = webClient.post()
                    .uri("/models/" + model + ":generateContent?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(generateRequest)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("[{}] HTTP {} from generateContent", getProviderName(), e.getStatusCode().value());
            return GenerationResult.failed("Gemini returned HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            log.error("[{}] generateContent call failed: {}", getProviderName(), e.getMessage(), e);
            return GenerationResult.failed("Text generation failed: " + e.getMessage());
        }

        return readCandidate(body);
    }

    private GenerationResult readCandidate(String body) {
        if (body == null || body.isBlank()) {
            return GenerationResult.failed("Empty response body");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode candidates = root.path("candidates");
            if (!candidates.isArray() || candidates.isEmpty()) {
                String blockReason = root.path("promptFeedback").path("blockReason").asText("");
                if (!blockReason.isEmpty()) {
                    log.warn("[{}] Prompt blocked: {}", getProviderName(), blockReason);
                }
                return GenerationResult.failed("No candidates in response");
            }

            String text = candidates.path(0).path("content").path("parts").path(0).path("text").asText("");
            if (text.isBlank()) {
                return GenerationResult.failed("Empty generated text");
            }
            return GenerationResult.success(text.trim());

        } catch (Exception e) {
            log.error("[{}] Unreadable response: {}", getProviderName(), e.getMessage());
            return GenerationResult.failed("Parse error: " + e.getMessage());
        }
    }
}
