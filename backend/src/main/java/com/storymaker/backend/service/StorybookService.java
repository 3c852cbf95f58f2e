package com.storymaker.backend.service;

import com.storymaker.backend.dto.GeneratedImageDto;
import com.storymaker.backend.dto.NarrationAudioDto;
import com.storymaker.backend.dto.StoryGenerateResponse;
import com.storymaker.backend.dto.StorybookDto;
import com.storymaker.backend.dto.StorybookMetadataDto;
import com.storymaker.backend.dto.StorybookPageDto;
import com.storymaker.backend.exception.FailureKind;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import com.storymaker.backend.service.scene.NarrationTextBuilder;
import com.storymaker.backend.service.scene.Scene;
import com.storymaker.backend.service.scene.SceneDecomposer;
import com.storymaker.backend.service.scene.SceneDescriptionBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Assembles a storybook from story text: decomposes it into scenes, requests one illustration
 * per scene and a single narration track, then merges everything by scene index.
 *
 * <p>Image and audio failures never fail the storybook. A failed scene gets a placeholder and
 * an entry in {@code metadata.errors}.
 */
@Slf4j
@Service
public class StorybookService {

    public static final int MAX_NARRATION_LENGTH = 16000;
    private static final int READING_WORDS_PER_MINUTE = 200;
    private static final String DEFAULT_TITLE = "Untitled Story";

    private final SceneDecomposer sceneDecomposer;
    private final SceneDescriptionBuilder descriptionBuilder;
    private final NarrationTextBuilder narrationTextBuilder;
    private final GenerationRouter router;
    private final FallbackGenerator fallbackGenerator;
    private final StoryGenerationService storyGenerationService;
    private final Clock clock;
    private final Duration requestTimeout;
    private final ExecutorService assetExecutor;

    public StorybookService(SceneDecomposer sceneDecomposer,
                            SceneDescriptionBuilder descriptionBuilder,
                            NarrationTextBuilder narrationTextBuilder,
                            GenerationRouter router,
                            FallbackGenerator fallbackGenerator,
                            StoryGenerationService storyGenerationService,
                            Clock clock,
                            @Value("${storybook.timeout:5m}") Duration requestTimeout,
                            @Value("${storybook.max-concurrent-calls:4}") int maxConcurrentCalls) {
        this.sceneDecomposer = sceneDecomposer;
        this.descriptionBuilder = descriptionBuilder;
        this.narrationTextBuilder = narrationTextBuilder;
        this.router = router;
        this.fallbackGenerator = fallbackGenerator;
        this.storyGenerationService = storyGenerationService;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
        this.assetExecutor = Executors.newFixedThreadPool(Math.max(1, maxConcurrentCalls));
    }

    @PreDestroy
    void shutdownExecutor() {
        assetExecutor.shutdown();
    }

    public StorybookDto generateStorybook(String storyText, String title, Genre genre, ImageStyle style,
                                          int sceneCount, boolean includeImages, boolean includeAudio) {
        return generateStorybook(storyText, title, genre, style, sceneCount, includeImages, includeAudio, null);
    }

    public StorybookDto generateStorybook(String storyText, String title, Genre genre, ImageStyle style,
                                          int sceneCount, boolean includeImages, boolean includeAudio,
                                          Voice voice) {
        if (sceneCount < 1 || sceneCount > SceneDecomposer.MAX_SCENES) {
            throw new IllegalArgumentException("sceneCount must be between 1 and " + SceneDecomposer.MAX_SCENES);
        }
        Genre resolvedGenre = genre == null ? Genre.FANTASY : genre;
        ImageStyle resolvedStyle = style == null ? ImageStyle.CHILDREN_BOOK : style;
        Voice resolvedVoice = voice == null ? Voice.FEMALE : voice;
        String resolvedTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title.trim();

        List<Scene> scenes = sceneDecomposer.decompose(storyText, sceneCount);
        Instant deadline = clock.instant().plus(requestTimeout);
        log.info("Generating storybook '{}' with {} scene(s), images={}, audio={}",
                resolvedTitle, scenes.size(), includeImages, includeAudio);

        List<String> imagePrompts = scenes.stream()
                .map(scene -> descriptionBuilder.imagePrompt(scene.imageDescription(), resolvedStyle))
                .toList();

        List<CompletableFuture<GenerationResult>> imageTasks = new ArrayList<>();
        if (includeImages) {
            for (Scene scene : scenes) {
                GenerationRequest request = GenerationRequest.image(imagePrompts.get(scene.index()), resolvedStyle,
                        GenerationRequest.DEFAULT_IMAGE_SIZE, scene.index()).withDeadline(deadline);
                imageTasks.add(submit(request, "image for scene " + scene.pageNumber()));
            }
        }

        List<String> errors = new ArrayList<>();
        String script = null;
        CompletableFuture<GenerationResult> audioTask = null;
        if (includeAudio) {
            String narrationText = narrationTextBuilder.cleanForSpeech(narrationTextBuilder.build(scenes));
            script = narrationTextBuilder.truncateAtSentence(narrationText, MAX_NARRATION_LENGTH);
            if (script.length() < narrationText.length()) {
                errors.add("Narration: text exceeded " + MAX_NARRATION_LENGTH + " characters and was truncated");
            }
            audioTask = submit(GenerationRequest.audio(script, resolvedVoice, 1.0).withDeadline(deadline), "narration");
        }

        List<CompletableFuture<GenerationResult>> all = new ArrayList<>(imageTasks);
        if (audioTask != null) {
            all.add(audioTask);
        }
        CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();

        List<StorybookPageDto> pages = new ArrayList<>(scenes.size());
        int imagesGenerated = 0;
        int totalDuration = 0;
        for (Scene scene : scenes) {
            GeneratedImageDto image;
            if (includeImages) {
                GenerationResult result = imageTasks.get(scene.index()).join();
                image = GeneratedMedia.image(result);
                if (image.generated()) {
                    imagesGenerated++;
                } else {
                    errors.add("Scene " + scene.pageNumber() + ": image generation failed ("
                            + result.describeFailures() + "); placeholder used");
                }
            } else {
                image = new GeneratedImageDto(GenerationResult.FALLBACK_PROVIDER, null, null,
                        fallbackGenerator.placeholderImage(scene.imageDescription(), scene.index(), resolvedStyle), false);
            }

            int readingSeconds = readingTimeSeconds(scene);
            totalDuration += readingSeconds;
            pages.add(new StorybookPageDto(
                    "page-" + scene.pageNumber(),
                    scene.pageNumber(),
                    scene.content(),
                    scene.imageDescription(),
                    imagePrompts.get(scene.index()),
                    image,
                    scene.narrationCue(),
                    readingSeconds,
                    scene.index() == 0 ? resolvedGenre.getBackgroundMusic() : null));
        }

        NarrationAudioDto narration = null;
        if (audioTask != null) {
            GenerationResult audio = audioTask.join();
            narration = GeneratedMedia.narration(audio, resolvedVoice, script);
            if (!narration.generated()) {
                errors.add("Narration: audio generation failed (" + audio.describeFailures()
                        + "); script returned for client-side speech");
            }
        }
        boolean hasAudio = narration != null && narration.generated();
        int imagesFailed = includeImages ? scenes.size() - imagesGenerated : 0;

        if (!errors.isEmpty()) {
            log.warn("Storybook '{}' completed with {} issue(s)", resolvedTitle, errors.size());
        }
        return new StorybookDto(
                UUID.randomUUID().toString(),
                resolvedTitle + " - Interactive Storybook",
                "A " + resolvedStyle.getLabel() + " style storybook in " + resolvedGenre.getValue() + " genre",
                resolvedGenre,
                resolvedStyle,
                clock.instant(),
                pages,
                pages.size(),
                totalDuration,
                imagesGenerated > 0,
                hasAudio,
                narration,
                new StorybookMetadataDto(scenes.size(), imagesGenerated, imagesFailed, hasAudio,
                        resolvedStyle.getAgeGroup(), errors));
    }

    /**
     * Writes a story for the prompt, then illustrates and narrates it.
     */
    public StorybookDto createFromPrompt(String prompt, Genre genre, StoryLength length, ImageStyle style,
                                         int sceneCount, Voice voice, Long seed) {
        StoryGenerateResponse story = storyGenerationService.generateText(prompt, genre, length, seed);
        log.info("Story for storybook generated via {} ({} words)", story.provider(), story.wordCount());
        return generateStorybook(story.content(), story.title(), story.genre(), style, sceneCount, true, true, voice);
    }

    private CompletableFuture<GenerationResult> submit(GenerationRequest request, String label) {
        return CompletableFuture.supplyAsync(() -> router.route(request), assetExecutor)
                .exceptionally(ex -> {
                    log.error("Unexpected failure generating {}", label, ex);
                    return new GenerationResult(fallbackGenerator.generate(request), GenerationResult.FALLBACK_PROVIDER,
                            Duration.ZERO, List.of(ProviderAttempt.failed("router", FailureKind.UNAVAILABLE,
                            ex.getMessage(), Duration.ZERO)));
                });
    }

    private static int readingTimeSeconds(Scene scene) {
        return (int) Math.ceil(scene.wordCount() / (double) READING_WORDS_PER_MINUTE) * 60;
    }
}
