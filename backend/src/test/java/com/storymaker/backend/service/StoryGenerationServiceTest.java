package com.storymaker.backend.service;

import com.storymaker.backend.dto.AudioGenerateResponse;
import com.storymaker.backend.dto.ImageGenerateResponse;
import com.storymaker.backend.dto.PromptEnhanceResponse;
import com.storymaker.backend.dto.StoryGenerateResponse;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.provider.CredentialValidator;
import com.storymaker.backend.provider.ProviderHealthTracker;
import com.storymaker.backend.provider.ProviderRegistry;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import com.storymaker.backend.service.scene.NarrationTextBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoryGenerationServiceTest {

    private StoryGenerationService service;

    @BeforeEach
    void setUp() {
        ProviderRegistry emptyRegistry = new ProviderRegistry(new CredentialValidator(key -> Optional.empty()));
        FallbackGenerator fallbackGenerator = new FallbackGenerator(null);
        GenerationRouter router = new GenerationRouter(emptyRegistry,
                new ProviderHealthTracker(5, Duration.ofMinutes(5), Clock.systemUTC()), fallbackGenerator,
                Clock.systemUTC());
        service = new StoryGenerationService(router, fallbackGenerator, new NarrationTextBuilder());
    }

    @Test
    @DisplayName("with no provider configured a short fantasy story still has at least 800 words")
    void fallbackStory() {
        StoryGenerateResponse response = service.generateText("dragon", Genre.FANTASY, StoryLength.SHORT);

        assertThat(response.provider()).isEqualTo("fallback");
        assertThat(response.fallbackUsed()).isTrue();
        assertThat(response.wordCount()).isGreaterThanOrEqualTo(800);
        assertThat(response.content()).contains("dragon");
        assertThat(response.title()).isNotBlank();
        assertThat(response.estimatedReadingTime()).isGreaterThanOrEqualTo(4);
    }

    @Test
    void seededStoriesRepeat() {
        StoryGenerateResponse first = service.generateText("owl", Genre.COMEDY, StoryLength.MEDIUM, 3L);
        StoryGenerateResponse second = service.generateText("owl", Genre.COMEDY, StoryLength.MEDIUM, 3L);

        assertThat(second.content()).isEqualTo(first.content());
        assertThat(second.title()).isEqualTo(first.title());
    }

    @Test
    void enhancementFallback() {
        PromptEnhanceResponse response = service.enhancePrompt("a city under the sea", Genre.SCI_FI, null);

        assertThat(response.provider()).isEqualTo("fallback");
        assertThat(response.originalPrompt()).isEqualTo("a city under the sea");
        assertThat(response.enhancedPrompt()).contains("Set in a future where advanced technology");
        assertThat(response.length()).isEqualTo(StoryLength.MEDIUM);
    }

    @Test
    void imageFallbackIsPlaceholder() {
        ImageGenerateResponse response = service.generateImage("a red balloon", ImageStyle.CARTOON, null);

        assertThat(response.fallbackUsed()).isTrue();
        assertThat(response.size()).isEqualTo("1024x1024");
        assertThat(response.image().placeholder()).isNotNull();
        assertThat(response.image().data()).isNull();
    }

    @Test
    @DisplayName("audio falls back to a speech-ready script")
    void audioFallbackReturnsScript() {
        AudioGenerateResponse response = service.generateAudio("Dr. Who waved. Goodbye!", Voice.ELDERLY, 9.0);

        assertThat(response.fallbackUsed()).isTrue();
        assertThat(response.speed()).isEqualTo(4.0);
        assertThat(response.narration().generated()).isFalse();
        assertThat(response.narration().script()).startsWith("Doctor Who waved. ... Goodbye!");
        assertThat(response.narration().estimatedDurationSeconds()).isPositive();
    }

    @Test
    void validatesInput() {
        assertThatThrownBy(() -> service.generateText(" ", Genre.FANTASY, StoryLength.SHORT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.generateAudio("x".repeat(4097), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4096");
    }
}
