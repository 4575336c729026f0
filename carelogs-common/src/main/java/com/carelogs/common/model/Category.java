package com.carelogs.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Urgency categories assigned to a visit note (3 total).
 *
 * Persisted by their lower-case wire name: red, amber, green.
 */
public enum Category {

    RED("red", "urgent"), // Safety concerns, medical emergencies, serious incidents, safeguarding
    AMBER("amber", "moderate"), // Minor health changes, care plan adjustments, family concerns
    GREEN("green", "routine"); // Normal care delivery, positive outcomes, standard activities

    private final String wireName;
    private final String meaning;

    Category(String wireName, String meaning) {
        this.wireName = wireName;
        this.meaning = meaning;
    }

    public String wireName() {
        return wireName;
    }

    public String meaning() {
        return meaning;
    }

    /**
     * Map a free-text model reply onto a category.
     *
     * Case-insensitive substring search, checked in priority order RED, AMBER, GREEN,
     * so "Red, not green" resolves to RED.
     * Example: "GREEN" → GREEN
     * "Classification: Amber." → AMBER
     * "unsure" → empty
     */
    public static Optional<Category> fromModelReply(String reply) {
        if (reply == null || reply.isBlank())
            return Optional.empty();

        String normalized = reply.toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (normalized.contains(category.wireName)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Exact lookup by stored name, for reading items back.
     */
    public static Category fromWireName(String wireName) {
        for (Category category : values()) {
            if (category.wireName.equals(wireName)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: '" + wireName + "'");
    }
}
