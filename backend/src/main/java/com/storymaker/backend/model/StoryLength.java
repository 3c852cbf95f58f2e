package com.storymaker.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum StoryLength {
    SHORT("short", 800),
    MEDIUM("medium", 1800),
    LONG("long", 3500),
    VERY_LONG("very-long", 5500);

    private final String value;
    private final int targetWords;

    StoryLength(String value, int targetWords) {
        this.value = value;
        this.targetWords = targetWords;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getTargetWords() {
        return targetWords;
    }

    /**
     * Accepts "very long", "very_long" and "very-long" alike. Blank input means {@link #MEDIUM}.
     */
    @JsonCreator
    public static StoryLength fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
        return Arrays.stream(values())
                .filter(length -> length.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown story length: " + raw));
    }
}
