package com.carelogs.pipeline.service;

import com.carelogs.pipeline.service.strategy.TextGenerationStrategy;
import com.carelogs.pipeline.service.strategy.TextGenerationStrategy.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VisitNoteSummarizer: sentinels and prompt layout.
 */
@ExtendWith(MockitoExtension.class)
class VisitNoteSummarizerTest {

    @Mock
    private TextGenerationStrategy textGenerationStrategy;

    @InjectMocks
    private VisitNoteSummarizer summarizer;

    @Test
    @DisplayName("Should return the no-summary sentinel for no notes, without calling the model")
    void summarize_noNotes_shouldReturnSentinel() {
        assertEquals("No summary available.", summarizer.summarize(List.of()));
        verifyNoInteractions(textGenerationStrategy);
    }

    @Test
    @DisplayName("Should return the error sentinel when the model call fails")
    void summarize_failedCall_shouldReturnErrorSentinel() {
        when(textGenerationStrategy.generateText(anyString(), anyInt(), anyDouble()))
                .thenReturn(GenerationResult.failed("Connection reset"));
        when(textGenerationStrategy.getProviderName()).thenReturn("mock");

        assertEquals("Summary unavailable due to an error.", summarizer.summarize(List.of("Ate well")));
    }

    @Test
    @DisplayName("Should return the error sentinel when the provider throws")
    void summarize_throwingProvider_shouldReturnErrorSentinel() {
        when(textGenerationStrategy.generateText(anyString(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("connection pool shut down"));
        when(textGenerationStrategy.getProviderName()).thenReturn("mock");

        assertEquals("Summary unavailable due to an error.", summarizer.summarize(List.of("Ate well")));
    }

    @Test
    @DisplayName("Should return the trimmed reply and ask for 200 tokens at temperature 0.3")
    void summarize_shouldReturnTrimmedReply() {
        when(textGenerationStrategy.generateText(anyString(), eq(200), eq(0.3)))
                .thenReturn(GenerationResult.success("\n  Appetite improved over the week.  \n"));

        assertEquals("Appetite improved over the week.",
                summarizer.summarize(List.of("Ate little", "Ate well")));
    }

    @Test
    @DisplayName("Should number notes from 1 in the order given")
    void buildPrompt_shouldNumberNotes() {
        String prompt = VisitNoteSummarizer.buildPrompt(List.of("Ate little", "Ate well", "Walked to the shop"));

        assertTrue(prompt.contains("Visit Notes (oldest to newest):\n1. Ate little\n2. Ate well\n3. Walked to the shop\n"));
        assertTrue(prompt.contains("max 150 words"));
        assertTrue(prompt.endsWith("Summary:"));
    }
}
