package com.storymaker.backend.service;

import com.storymaker.backend.dto.GeneratedImageDto;
import com.storymaker.backend.dto.NarrationAudioDto;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.service.scene.NarrationTextBuilder;

/**
 * Maps router results for images and audio onto their response shapes.
 */
final class GeneratedMedia {

    private GeneratedMedia() {
    }

    static GeneratedImageDto image(GenerationResult result) {
        GeneratedContent content = result.content();
        return new GeneratedImageDto(
                result.provider(),
                content.mimeType(),
                content.data(),
                content.placeholder(),
                !result.isFallback() && content.isBinary());
    }

    static NarrationAudioDto narration(GenerationResult result, Voice voice, String script) {
        GeneratedContent content = result.content();
        boolean generated = !result.isFallback() && content.isBinary();
        return new NarrationAudioDto(
                result.provider(),
                voice,
                content.mimeType(),
                generated ? content.data() : null,
                generated ? null : content.text(),
                NarrationTextBuilder.estimateDurationSeconds(script),
                generated);
    }
}
