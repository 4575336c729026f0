package com.carelogs.pipeline.service;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Summarises a client's chronological visit notes into one short paragraph.
 *
 * Never throws: an empty note list or a failed model call yields a fixed sentinel text.
 */
@Slf4j
@Service
public class VisitNoteSummarizer {

    public static final String NO_SUMMARY = "No summary available.";
    public static final String SUMMARY_UNAVAILABLE = "Summary unavailable due to an error.";

    static final int MAX_OUTPUT_TOKENS = 200;
    static final double TEMPERATURE = 0.3;

    private static final String SUMMARY_PROMPT = """
            You are a healthcare professional summarising a client's home-care visit notes. \
            Provide a concise summary (max 150 words) that highlights changes, concerns, and any \
            trends over time. Use clear, professional language.

            Visit Notes (oldest to newest):
            %s

            Summary:""";

    private final TextGenerationStrategy textGenerationStrategy;

    public VisitNoteSummarizer(TextGenerationStrategy textGenerationStrategy) {
        this.textGenerationStrategy = textGenerationStrategy;
    }

    /**
     * @param notes non-empty note texts, oldest first
     */
    public String summarize(List<String> notes) {
        if (notes == null || notes.isEmpty()) {
            return NO_SUMMARY;
        }

        TextGenerationStrategy.GenerationResult result;
        try {
            result = textGenerationStrategy.generateText(buildPrompt(notes), MAX_OUTPUT_TOKENS, TEMPERATURE);
        } catch (RuntimeException e) {
            log.error("Summarisation via {} threw: {}", textGenerationStrategy.getProviderName(), e.getMessage(), e);
            return SUMMARY_UNAVAILABLE;
        }

        if (!result.isSuccessful()) {
            log.error("Summarisation via {} failed: {}",
                    textGenerationStrategy.getProviderName(), result.getErrorMessage());
            return SUMMARY_UNAVAILABLE;
        }
        return result.getText().strip();
    }

    static String buildPrompt(List<String> notes) {
        StringBuilder numbered = new StringBuilder();
        for (int i = 0; i < notes.size(); i++) {
            if (i > 0) {
                numbered.append('\n');
            }
            numbered.append(i + 1).append(". ").append(notes.get(i));
        }
        return SUMMARY_PROMPT.formatted(numbered);
    }
}
