package com.carelogs.pipeline.config;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Builds the one TextGenerationStrategy shared by the classifier and the summarizer.
 *
 * 'llm.text-generation.provider' picks bedrock (default), google or groq. Only the selected
 * provider's keys are read, so the others may stay unset.
 */
@Slf4j
@Configuration
public class LLMProviderConfig {

    @Value("${llm.text-generation.provider:bedrock}")
    private String textGenProvider;

    @Bean
    public TextGenerationStrategy textGenerationStrategy(Environment env) {
        String provider = textGenProvider.trim().toLowerCase();

        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("TEXT GENERATION PROVIDER: {}", provider);

        LLMProviderFactory.ProviderSettings settings = settingsFor(provider, env);
        TextGenerationStrategy strategy = LLMProviderFactory.createTextGenerator(provider, settings);

        if (settings.apiKey() != null) {
            log.info("   API key: {}", settings.apiKey().isBlank() ? "MISSING" : "configured");
        }
        log.info("   Active: {}", strategy.getProviderName());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        return strategy;
    }

    private static LLMProviderFactory.ProviderSettings settingsFor(String provider, Environment env) {
        return switch (provider) {
            case "bedrock" -> new LLMProviderFactory.ProviderSettings(
                    null,
                    null,
                    env.getProperty("bedrock.model-id", "amazon.titan-text-express-v1"),
                    env.getProperty("bedrock.region", env.getProperty("aws.region", "eu-west-2")));
            case "google" -> new LLMProviderFactory.ProviderSettings(
                    env.getProperty("google.genai.api-key", ""),
                    env.getProperty("google.genai.base-url", "https://generativelanguage.googleapis.com/v1beta"),
                    env.getProperty("google.genai.model", "gemini-2.0-flash-lite"),
                    null);
            case "groq" -> new LLMProviderFactory.ProviderSettings(
                    env.getProperty("groq.api-key", ""),
                    env.getProperty("groq.base-url", "https://api.groq.com/openai/v1"),
                    env.getProperty("groq.model", "llama-3.3-70b-versatile"),
                    null);
            // Let the factory report the supported set
            default -> new LLMProviderFactory.ProviderSettings(null, null, null, null);
        };
    }
}
