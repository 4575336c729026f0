package com.carelogs.pipeline.service;

import java.util.Locale;

/**
 * The two pipelines an upload event can be routed to.
 */
public enum PipelineMode {

    CLASSIFY("classify"), // One urgency category per visit record
    SUMMARISE("summarise"); // One summary per client

    private final String pathName;

    PipelineMode(String pathName) {
        this.pathName = pathName;
    }

    public String pathName() {
        return pathName;
    }

    /**
     * "classify" → CLASSIFY, "summarise" / "summarize" → SUMMARISE
     */
    public static PipelineMode fromPathName(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "classify" -> CLASSIFY;
            case "summarise", "summarize" -> SUMMARISE;
            default -> throw new IllegalArgumentException(
                    "Unknown pipeline mode: '" + raw + "'. Supported modes: classify, summarise");
        };
    }
}
