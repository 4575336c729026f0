package com.carelogs.pipeline.service.strategy;

/**
 * Strategy interface for hosted LLM text generation
 *
 * - Defines one contract for all text generation providers (Bedrock, Gemini, Groq)
 * - Callers choose output length and sampling temperature per call: classification
 * wants a handful of tokens near-deterministically, summaries want a paragraph
 * - Implementations never throw; every failure comes back as a failed GenerationResult
 */
public interface TextGenerationStrategy {

    /**
     * Generate text from a prompt using the configured LLM provider
     */
    GenerationResult generateText(String prompt, int maxOutputTokens, double temperature);

    /**
     * Get the name of the active provider (for logging/debugging)
     */
    String getProviderName();

    /**
     * Result of text generation: encapsulates success/failure states
     */
    class GenerationResult {
        private final String text;
        private final String errorMessage;
        private final boolean successful;

        private GenerationResult(String text, String errorMessage, boolean successful) {
            this.text = text;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static GenerationResult success(String text) {
            return new GenerationResult(text, null, true);
        }

        public static GenerationResult failed(String errorMessage) {
            return new GenerationResult(null, errorMessage, false);
        }

        public String getText() {
            return text;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }
    }
}
