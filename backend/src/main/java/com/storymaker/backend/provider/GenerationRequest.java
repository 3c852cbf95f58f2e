package com.storymaker.backend.provider;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One capability call. Fields that do not apply to the capability stay null.
 *
 * @param sceneIndex zero based scene position, only meaningful for storybook images
 * @param seed       seeds the fallback generator so its output is reproducible
 * @param deadline   absolute point after which no provider may still be waited on
 */
public record GenerationRequest(
        Capability capability,
        String prompt,
        Genre genre,
        StoryLength length,
        ImageStyle style,
        String size,
        Voice voice,
        Double speed,
        Integer sceneIndex,
        Long seed,
        Instant deadline
) {

    public static final String DEFAULT_IMAGE_SIZE = "1024x1024";

    public GenerationRequest {
        Objects.requireNonNull(capability, "capability");
        genre = genre == null ? Genre.FANTASY : genre;
        length = length == null ? StoryLength.MEDIUM : length;
        style = style == null ? ImageStyle.CHILDREN_BOOK : style;
        voice = voice == null ? Voice.FEMALE : voice;
    }

    public static GenerationRequest text(String prompt, Genre genre, StoryLength length) {
        return new GenerationRequest(Capability.TEXT_GENERATION, prompt, genre, length,
                null, null, null, null, null, null, null);
    }

    public static GenerationRequest enhancement(String prompt, Genre genre, StoryLength length) {
        return new GenerationRequest(Capability.PROMPT_ENHANCEMENT, prompt, genre, length,
                null, null, null, null, null, null, null);
    }

    public static GenerationRequest image(String description, ImageStyle style, String size, Integer sceneIndex) {
        return new GenerationRequest(Capability.IMAGE_GENERATION, description, null, null,
                style, size == null || size.isBlank() ? DEFAULT_IMAGE_SIZE : size, null, null, sceneIndex, null, null);
    }

    public static GenerationRequest audio(String text, Voice voice, Double speed) {
        return new GenerationRequest(Capability.AUDIO_NARRATION, text, null, null,
                null, null, voice, speed, null, null, null);
    }

    public GenerationRequest withSeed(Long newSeed) {
        return new GenerationRequest(capability, prompt, genre, length, style, size, voice, speed,
                sceneIndex, newSeed, deadline);
    }

    public GenerationRequest withGenre(Genre newGenre) {
        return new GenerationRequest(capability, prompt, newGenre, length, style, size, voice, speed,
                sceneIndex, seed, deadline);
    }

    public GenerationRequest withDeadline(Instant newDeadline) {
        return new GenerationRequest(capability, prompt, genre, length, style, size, voice, speed,
                sceneIndex, seed, newDeadline);
    }

    /** Speed clamped to the range text-to-speech vendors accept. */
    public double clampedSpeed() {
        double value = speed == null ? 1.0 : speed;
        return Math.max(0.25, Math.min(4.0, value));
    }

    /** Time left until the deadline, or null when the request has none. */
    public Duration remaining(Instant now) {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
