package com.storymaker.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum Genre {
    FANTASY("fantasy", "magical-ambient"),
    ADVENTURE("adventure", "epic-orchestral"),
    MYSTERY("mystery", "suspenseful-ambient"),
    ROMANCE("romance", "gentle-piano"),
    SCI_FI("sci-fi", "futuristic-synth"),
    HORROR("horror", "dark-ambient"),
    COMEDY("comedy", "playful-upbeat"),
    DRAMA("drama", "emotional-strings"),
    THRILLER("thriller", "tense-orchestral");

    private final String value;
    private final String backgroundMusic;

    Genre(String value, String backgroundMusic) {
        this.value = value;
        this.backgroundMusic = backgroundMusic;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getBackgroundMusic() {
        return backgroundMusic;
    }

    /**
     * Resolves a genre from its wire value. Blank input means {@link #FANTASY}.
     */
    @JsonCreator
    public static Genre fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FANTASY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("scifi".equals(normalized) || "science-fiction".equals(normalized)) {
            return SCI_FI;
        }
        return Arrays.stream(values())
                .filter(genre -> genre.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown genre: " + raw));
    }
}
