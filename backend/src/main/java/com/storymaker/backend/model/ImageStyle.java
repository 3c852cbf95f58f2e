package com.storymaker.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum ImageStyle {
    CHILDREN_BOOK("children-book", "Children's Book",
            "Bright, colorful illustrations perfect for young readers", "3-8 years",
            List.of("Large text", "Simple illustrations", "Bold colors"), true,
            "colorful children's book illustration, bright colors, friendly characters, whimsical style"),
    STORYBOOK("storybook", "Classic Storybook",
            "Detailed illustrations with rich storytelling elements", "6-12 years",
            List.of("Detailed art", "Complex scenes", "Rich colors"), false,
            "detailed storybook illustration, rich colors, magical atmosphere"),
    WATERCOLOR("watercolor", "Watercolor",
            "Soft, artistic watercolor paintings", "4-10 years",
            List.of("Soft edges", "Gentle colors", "Artistic style"), false,
            "soft watercolor painting, gentle brushstrokes, artistic style"),
    CARTOON("cartoon", "Cartoon Style",
            "Fun, animated cartoon illustrations", "3-12 years",
            List.of("Expressive characters", "Bright colors", "Playful style"), false,
            "cartoon style, vibrant colors, expressive characters"),
    REALISTIC("realistic", "Realistic",
            "Photorealistic illustrations for older readers", "8+ years",
            List.of("Realistic details", "Professional quality", "Complex scenes"), false,
            "realistic illustration, detailed, professional quality");

    private final String value;
    private final String displayName;
    private final String description;
    private final String ageGroup;
    private final List<String> features;
    private final boolean recommended;
    private final String promptFragment;

    ImageStyle(String value, String displayName, String description, String ageGroup,
               List<String> features, boolean recommended, String promptFragment) {
        this.value = value;
        this.displayName = displayName;
        this.description = description;
        this.ageGroup = ageGroup;
        this.features = features;
        this.recommended = recommended;
        this.promptFragment = promptFragment;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getAgeGroup() {
        return ageGroup;
    }

    public List<String> getFeatures() {
        return features;
    }

    public boolean isRecommended() {
        return recommended;
    }

    public String getPromptFragment() {
        return promptFragment;
    }

    /** "children-book" becomes "children book". */
    public String getLabel() {
        return value.replace('-', ' ');
    }

    @JsonCreator
    public static ImageStyle fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return CHILDREN_BOOK;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
        return Arrays.stream(values())
                .filter(style -> style.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown image style: " + raw));
    }
}
