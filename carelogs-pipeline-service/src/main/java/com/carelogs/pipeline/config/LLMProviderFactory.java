package com.carelogs.pipeline.config;

import com.carelogs.pipeline.service.BedrockTextGenerationService;
import com.carelogs.pipeline.service.GoogleTextGenerationService;
import com.carelogs.pipeline.service.GroqTextGenerationService;
import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

/**
 * Factory for creating LLM provider instances
 *
 * - Takes provider name + config → returns the right strategy implementation
 * - Static factory methods: the provider set is fixed and creation logic is simple
 */
@Slf4j
public class LLMProviderFactory {

    private LLMProviderFactory() {
    }

    /**
     * Create a TextGenerationStrategy based on provider name
     *
     * @param provider Provider name: "bedrock", "google" or "groq"
     * @param settings Provider-specific connection settings
     * @return Configured TextGenerationStrategy implementation
     * @throws IllegalArgumentException if provider is not supported
     */
    public static TextGenerationStrategy createTextGenerator(String provider, ProviderSettings settings) {

        return switch (provider.toLowerCase()) {
            case "bedrock" -> {
                log.info("Factory: Creating Amazon Bedrock text generation strategy");
                log.info("   Model: {} (region {})", settings.model(), settings.region());
                BedrockRuntimeClient client = BedrockRuntimeClient.builder()
                        .region(Region.of(settings.region()))
                        .build();
                yield new BedrockTextGenerationService(client, settings.model());
            }
            case "google" -> {
                log.info("Factory: Creating Google Gemini text generation strategy");
                log.info("   Model: {}", settings.model());
                yield new GoogleTextGenerationService(settings.apiKey(), settings.baseUrl(), settings.model());
            }
            case "groq" -> {
                log.info("Factory: Creating Groq text generation strategy");
                log.info("   Model: {}", settings.model());
                yield new GroqTextGenerationService(settings.apiKey(), settings.baseUrl(), settings.model());
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported text generation provider: '" + provider + "'. " +
                            "Supported providers: bedrock, google, groq. " +
                            "Set 'llm.text-generation.provider' in application.yml.");
        };
    }

    /**
     * Connection settings for one provider; fields a provider does not use may be null
     */
    public record ProviderSettings(String apiKey, String baseUrl, String model, String region) {
    }
}
