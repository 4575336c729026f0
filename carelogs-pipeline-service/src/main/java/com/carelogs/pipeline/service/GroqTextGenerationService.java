package com.carelogs.pipeline.service;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Groq implementation of TextGenerationStrategy
 *
 * - OpenAI-compatible chat completions: one user message per call, no streaming
 * - Reply text at choices[0].message.content; an "error" object means a rejected call
 * - A reply cut short by max_tokens is still returned: classification asks for one word
 */
@Slf4j
public class GroqTextGenerationService implements TextGenerationStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String model;

    public GroqTextGenerationService(String apiKey, String baseUrl, String model) {
        this(apiKey, baseUrl, model, WebClient.builder());
    }

    public GroqTextGenerationService(String apiKey, String baseUrl, String model,
            WebClient.Builder webClientBuilder) {
        this.model = model;
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Groq (" + model + ")";
    }

    @Override
    public GenerationResult generateText(String prompt, int maxOutputTokens, double temperature) {
        Map<String, Object> chatRequest = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "max_tokens", maxOutputTokens,
                "temperature", temperature,
                "stream", false);

        String body;
        try {
            body = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(chatRequest)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("[{}] HTTP {} from chat completions: {}", getProviderName(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            return GenerationResult.failed("Groq returned HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            log.error("[{}] Chat completion call failed: {}", getProviderName(), e.getMessage(), e);
            return GenerationResult.failed("Text generation failed: " + e.getMessage());
        }

        return readCompletion(body);
    }

    private GenerationResult readCompletion(String body) {
        if (body == null || body.isBlank()) {
            return GenerationResult.failed("Empty response body");
        }
        try {
            JsonNode root = objectMapper.readTree(body);

            JsonNode error = root.path("error");
            if (!error.isMissingNode()) {
                return GenerationResult.failed("Groq API error: " + error.path("message").asText("unknown"));
            }

            JsonNode choice = root.path("choices").path(0);
            String content = choice.path("message").path("content").asText("");
            if (content.isBlank()) {
                return GenerationResult.failed("No message content in Groq response");
            }

            if ("length".equals(choice.path("finish_reason").asText())) {
                log.debug("[{}] Reply truncated at max_tokens", getProviderName());
            }
            JsonNode usage = root.path("usage");
            if (!usage.isMissingNode()) {
                log.debug("[{}] Tokens: prompt={}, completion={}", getProviderName(),
                        usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt());
            }
            return GenerationResult.success(content.trim());

        } catch (Exception e) {
            log.error("[{}] Unreadable response: {}", getProviderName(), e.getMessage());
            return GenerationResult.failed("Parse error: " + e.getMessage());
        }
    }
}
