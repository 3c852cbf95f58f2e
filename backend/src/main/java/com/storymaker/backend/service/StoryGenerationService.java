package com.storymaker.backend.service;

import com.storymaker.backend.dto.AudioGenerateResponse;
import com.storymaker.backend.dto.ImageGenerateResponse;
import com.storymaker.backend.dto.PromptEnhanceResponse;
import com.storymaker.backend.dto.StoryGenerateResponse;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import com.storymaker.backend.service.scene.NarrationTextBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single capability calls: story text, prompt enhancement, one image, one narration. Each goes
 * through the router and therefore always yields content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoryGenerationService {

    public static final int MAX_AUDIO_TEXT_LENGTH = 4096;
    private static final int READING_WORDS_PER_MINUTE = 200;

    private final GenerationRouter router;
    private final FallbackGenerator fallbackGenerator;
    private final NarrationTextBuilder narrationTextBuilder;

    public StoryGenerateResponse generateText(String prompt, Genre genre, StoryLength length) {
        return generateText(prompt, genre, length, null);
    }

    public StoryGenerateResponse generateText(String prompt, Genre genre, StoryLength length, Long seed) {
        String cleanedPrompt = requireText(prompt, "Prompt is required");
        GenerationRequest request = GenerationRequest.text(cleanedPrompt, genre, length).withSeed(seed);

        GenerationResult result = router.route(request);
        String content = result.content().text();
        int wordCount = FallbackGenerator.countWords(content);
        String title = fallbackGenerator.generateTitle(request.genre(), fallbackGenerator.randomFor(seed));
        log.info("Generated {} story '{}' with {} words via {}", request.genre().getValue(), title, wordCount,
                result.provider());

        return new StoryGenerateResponse(
                title,
                content,
                cleanedPrompt,
                request.genre(),
                request.length(),
                wordCount,
                Math.max(1, (int) Math.ceil(wordCount / (double) READING_WORDS_PER_MINUTE)),
                result.provider(),
                result.isFallback());
    }

    public PromptEnhanceResponse enhancePrompt(String prompt, Genre genre, StoryLength length) {
        String cleanedPrompt = requireText(prompt, "Original prompt is required");
        GenerationRequest request = GenerationRequest.enhancement(cleanedPrompt, genre, length);

        GenerationResult result = router.route(request);
        return new PromptEnhanceResponse(
                result.content().text(),
                cleanedPrompt,
                request.genre(),
                request.length(),
                result.provider(),
                result.isFallback());
    }

    public ImageGenerateResponse generateImage(String description, ImageStyle style, String size) {
        String cleanedDescription = requireText(description, "Prompt is required for image generation");
        ImageStyle resolvedStyle = style == null ? ImageStyle.CHILDREN_BOOK : style;
        String prompt = cleanedDescription + ", " + resolvedStyle.getPromptFragment();
        GenerationRequest request = GenerationRequest.image(prompt, resolvedStyle, size, 0);

        GenerationResult result = router.route(request);
        return new ImageGenerateResponse(
                cleanedDescription,
                resolvedStyle,
                request.size(),
                GeneratedMedia.image(result),
                result.provider(),
                result.isFallback(),
                result.elapsed().toMillis());
    }

    public AudioGenerateResponse generateAudio(String text, Voice voice, Double speed) {
        String cleanedText = requireText(text, "Text is required for audio generation");
        if (cleanedText.length() > MAX_AUDIO_TEXT_LENGTH) {
            throw new IllegalArgumentException(
                    "Text too long for audio generation (max " + MAX_AUDIO_TEXT_LENGTH + " characters)");
        }
        Voice resolvedVoice = voice == null ? Voice.FEMALE : voice;
        String script = narrationTextBuilder.cleanForSpeech(cleanedText);
        GenerationRequest request = GenerationRequest.audio(script, resolvedVoice, speed);

        GenerationResult result = router.route(request);
        return new AudioGenerateResponse(
                GeneratedMedia.narration(result, resolvedVoice, script),
                cleanedText.length(),
                request.clampedSpeed(),
                result.provider(),
                result.isFallback());
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value.trim();
    }
}
