package com.carelogs.pipeline.service;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.Map;

/**
 * Amazon Bedrock (Titan Text) implementation of TextGenerationStrategy
 *
 * - Native Titan request: {"inputText", "textGenerationConfig": {maxTokenCount, temperature}}
 * - Native Titan response: {"results": [{"outputText"}]}
 * - Default provider: batches are uploaded to S3 and results go to DynamoDB in the same region
 */
@Slf4j
public class BedrockTextGenerationService implements TextGenerationStrategy {

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String modelId;

    public BedrockTextGenerationService(BedrockRuntimeClient bedrockClient, String modelId) {
        this.bedrockClient = bedrockClient;
        this.modelId = modelId;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "Amazon Bedrock (" + modelId + ")";
    }

    @Override
    public GenerationResult generateText(String prompt, int maxOutputTokens, double temperature) {
        try {
            Map<String, Object> nativeRequest = Map.of(
                    "inputText", prompt,
                    "textGenerationConfig", Map.of(
                            "maxTokenCount", maxOutputTokens,
                            "temperature", temperature));

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(nativeRequest)))
                    .build();

            InvokeModelResponse response = bedrockClient.invokeModel(request);
            return parseTitanResponse(response.body().asUtf8String());

        } catch (Exception e) {
            log.error("ERROR: Can't invoke Bedrock model '{}'. Reason: {}", modelId, e.getMessage(), e);
            return GenerationResult.failed("Bedrock invocation failed: " + e.getMessage());
        }
    }

    private GenerationResult parseTitanResponse(String body) {
        try {
            JsonNode results = objectMapper.readTree(body).path("results");

            if (!results.isArray() || results.isEmpty()) {
                return GenerationResult.failed("No results in Bedrock response");
            }

            JsonNode outputText = results.get(0).path("outputText");
            if (!outputText.isTextual()) {
                return GenerationResult.failed("No outputText in Bedrock result");
            }

            return GenerationResult.success(outputText.asText().trim());

        } catch (Exception e) {
            log.error("Failed to parse Bedrock response: {}", e.getMessage(), e);
            return GenerationResult.failed("Parse error: " + e.getMessage());
        }
    }
}
