package com.storymaker.backend.service;

import com.storymaker.backend.dto.StorybookDto;
import com.storymaker.backend.dto.StorybookPageDto;
import com.storymaker.backend.exception.StoryParseException;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.provider.Capability;
import com.storymaker.backend.provider.CredentialValidator;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.ProviderAdapter;
import com.storymaker.backend.provider.ProviderDescriptor;
import com.storymaker.backend.provider.ProviderHealthTracker;
import com.storymaker.backend.provider.ProviderRegistry;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import com.storymaker.backend.service.scene.NarrationTextBuilder;
import com.storymaker.backend.service.scene.SceneDecomposer;
import com.storymaker.backend.service.scene.SceneDescriptionBuilder;
import com.storymaker.backend.service.scene.SentenceSplitter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorybookServiceTest {

    private ProviderRegistry registry;
    private StorybookService storybookService;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(new CredentialValidator(key -> Optional.of("test-credential-value")));
        FallbackGenerator fallbackGenerator = new FallbackGenerator(1L);
        GenerationRouter router = new GenerationRouter(registry,
                new ProviderHealthTracker(5, Duration.ofMinutes(5), Clock.systemUTC()), fallbackGenerator,
                Clock.systemUTC());
        NarrationTextBuilder narrationTextBuilder = new NarrationTextBuilder();
        SceneDescriptionBuilder descriptionBuilder = new SceneDescriptionBuilder();
        storybookService = new StorybookService(
                new SceneDecomposer(new SentenceSplitter(), descriptionBuilder),
                descriptionBuilder,
                narrationTextBuilder,
                router,
                fallbackGenerator,
                new StoryGenerationService(router, fallbackGenerator, narrationTextBuilder),
                Clock.systemUTC(),
                Duration.ofSeconds(30),
                4);
    }

    @AfterEach
    void tearDown() {
        storybookService.shutdownExecutor();
    }

    @Test
    @DisplayName("with no image or audio provider the storybook is still returned with errors recorded")
    void noProvidersStillYieldsStorybook() {
        StorybookDto storybook = storybookService.generateStorybook("A. B. C.", "Letters", Genre.FANTASY,
                ImageStyle.CARTOON, 2, true, true);

        assertThat(storybook.totalPages()).isEqualTo(2);
        assertThat(storybook.pages()).extracting(StorybookPageDto::content).containsExactly("A. B.", "C.");
        assertThat(storybook.hasImages()).isFalse();
        assertThat(storybook.hasAudio()).isFalse();
        assertThat(storybook.metadata().errors()).isNotEmpty();
        assertThat(storybook.pages()).allSatisfy(page -> assertThat(page.image().placeholder()).isNotNull());
        assertThat(storybook.narration().script()).startsWith("Welcome to this interactive storybook.");
        assertThat(storybook.title()).isEqualTo("Letters - Interactive Storybook");
    }

    @Test
    @DisplayName("a rate limited image for scene 3 of 5 only affects scene 3")
    void partialImageFailure() {
        ProviderAdapter images = (request, credential) -> {
            if (Integer.valueOf(2).equals(request.sceneIndex())) {
                return Mono.error(WebClientResponseException.create(429, "Too Many Requests", HttpHeaders.EMPTY,
                        "rate limit exceeded".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
            }
            return Mono.just(GeneratedContent.ofBinary(new byte[2048], "image/png"));
        };
        registry.register(new ProviderDescriptor("stability", Capability.IMAGE_GENERATION, 1, "STABILITY_API_KEY",
                null, 1024, Duration.ofSeconds(5), images));

        StorybookDto storybook = storybookService.generateStorybook(story(5), "Five", Genre.ADVENTURE,
                ImageStyle.STORYBOOK, 5, true, false);

        assertThat(storybook.pages()).hasSize(5);
        assertThat(storybook.pages().get(2).image().generated()).isFalse();
        assertThat(storybook.pages().get(2).image().placeholder().title()).isEqualTo("Scene 3");
        IntStream.of(0, 1, 3, 4).forEach(i -> {
            assertThat(storybook.pages().get(i).image().generated()).isTrue();
            assertThat(storybook.pages().get(i).image().provider()).isEqualTo("stability");
        });
        assertThat(storybook.metadata().errors()).singleElement().satisfies(error -> {
            assertThat(error).startsWith("Scene 3:");
            assertThat(error).contains("RATE_LIMITED");
        });
        assertThat(storybook.metadata().imagesGenerated()).isEqualTo(4);
        assertThat(storybook.metadata().imagesFailed()).isEqualTo(1);
        assertThat(storybook.hasImages()).isTrue();
        assertThat(storybook.narration()).isNull();
    }

    @Test
    void narrationFromProviderSetsHasAudio() {
        registry.register(new ProviderDescriptor("openai", Capability.AUDIO_NARRATION, 1, "OPENAI_API_KEY",
                null, 256, Duration.ofSeconds(5),
                (request, credential) -> Mono.just(GeneratedContent.ofBinary(new byte[4096], "audio/mpeg"))));

        StorybookDto storybook = storybookService.generateStorybook(story(3), "Audio", Genre.DRAMA, null, 3,
                false, true);

        assertThat(storybook.hasAudio()).isTrue();
        assertThat(storybook.narration().audio()).hasSize(4096);
        assertThat(storybook.metadata().errors()).isEmpty();
        assertThat(storybook.pages()).allSatisfy(page -> assertThat(page.image().generated()).isFalse());
    }

    @Test
    void pagesCarryReadingTimeAndMusicCue() {
        StorybookDto storybook = storybookService.generateStorybook(story(3), null, Genre.MYSTERY,
                ImageStyle.WATERCOLOR, 3, false, false);

        StorybookPageDto first = storybook.pages().get(0);
        assertThat(first.id()).isEqualTo("page-1");
        assertThat(first.backgroundMusic()).isEqualTo("suspenseful-ambient");
        assertThat(storybook.pages().get(1).backgroundMusic()).isNull();
        assertThat(first.imagePrompt()).endsWith("soft watercolor painting, gentle brushstrokes, artistic style, "
                + "suitable for children");
        assertThat(storybook.totalDuration()).isEqualTo(
                storybook.pages().stream().mapToInt(StorybookPageDto::estimatedReadingTime).sum());
        assertThat(first.estimatedReadingTime()).isEqualTo(60);
        assertThat(storybook.subtitle()).isEqualTo("A watercolor style storybook in mystery genre");
        assertThat(storybook.metadata().estimatedAgeGroup()).isEqualTo("4-10 years");
        assertThat(storybook.metadata().errors()).isEmpty();
    }

    @Test
    void rejectsSceneCountOutOfRange() {
        assertThatThrownBy(() -> storybookService.generateStorybook("A. B.", "t", null, null, 16, false, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storybookService.generateStorybook("A. B.", "t", null, null, 0, false, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyStoryIsAParseError() {
        assertThatThrownBy(() -> storybookService.generateStorybook(" \n ", "t", null, null, 3, true, true))
                .isInstanceOf(StoryParseException.class);
    }

    @Test
    void createFromPromptUsesGeneratedStory() {
        StorybookDto storybook = storybookService.createFromPrompt("a brave snail", Genre.COMEDY, StoryLength.SHORT,
                ImageStyle.CARTOON, 4, null, 5L);

        assertThat(storybook.totalPages()).isEqualTo(4);
        assertThat(storybook.title()).endsWith(" - Interactive Storybook");
        assertThat(storybook.pages().get(0).content()).contains("a brave snail");
    }

    private static String story(int paragraphs) {
        return IntStream.rangeClosed(1, paragraphs)
                .mapToObj(i -> "In part " + i + " the travellers crossed another valley and rested by a fire.")
                .collect(Collectors.joining("\n\n"));
    }
}
