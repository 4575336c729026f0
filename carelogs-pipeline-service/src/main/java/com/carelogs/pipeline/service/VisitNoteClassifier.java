package com.carelogs.pipeline.service;

import com.carelogs.common.model.Category;
import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Classifies a single visit note as RED, AMBER or GREEN.
 *
 * Never throws and never retries. Failures and unrecognised replies map to AMBER so an
 * error can only raise a note for follow-up, not hide it.
 */
@Slf4j
@Service
public class VisitNoteClassifier {

    static final int MAX_OUTPUT_TOKENS = 10;
    static final double TEMPERATURE = 0.1;

    private static final String CLASSIFICATION_PROMPT = """
            You are a healthcare professional reviewing care visit notes. Please classify the following visit note into one of three categories based on the level of concern:

            RED: Urgent/critical issues requiring immediate attention (safety concerns, medical emergencies, serious incidents, safeguarding issues)
            AMBER: Moderate concerns that need follow-up (minor health changes, care plan adjustments needed, family concerns)
            GREEN: Routine visit with no significant concerns (normal care delivery, positive outcomes, standard activities)

            Visit Note: "%s"

            Classification (respond with only RED, AMBER, or GREEN):""";

    private final TextGenerationStrategy textGenerationStrategy;

    public VisitNoteClassifier(TextGenerationStrategy textGenerationStrategy) {
        this.textGenerationStrategy = textGenerationStrategy;
    }

    public Category classify(String noteText) {
        if (noteText == null || noteText.isBlank()) {
            log.warn("Empty note provided for classification");
            return Category.GREEN;
        }

        String prompt = CLASSIFICATION_PROMPT.formatted(noteText.strip());
        TextGenerationStrategy.GenerationResult result;
        try {
            result = textGenerationStrategy.generateText(prompt, MAX_OUTPUT_TOKENS, TEMPERATURE);
        } catch (RuntimeException e) {
            log.error("Classification via {} threw, defaulting to amber: {}",
                    textGenerationStrategy.getProviderName(), e.getMessage(), e);
            return Category.AMBER;
        }

        if (!result.isSuccessful()) {
            log.error("Classification via {} failed, defaulting to amber: {}",
                    textGenerationStrategy.getProviderName(), result.getErrorMessage());
            return Category.AMBER;
        }

        Optional<Category> category = Category.fromModelReply(result.getText());
        if (category.isEmpty()) {
            log.warn("Unexpected classification response: '{}', defaulting to amber", result.getText());
            return Category.AMBER;
        }
        return category.get();
    }
}
