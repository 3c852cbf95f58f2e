package com.storymaker.backend.dto;

/**
 * @param estimatedReadingTime seconds
 * @param backgroundMusic      only set on the first page
 */
public record StorybookPageDto(
        String id,
        int pageNumber,
        String content,
        String sceneDescription,
        String imagePrompt,
        GeneratedImageDto image,
        String audioCue,
        int estimatedReadingTime,
        String backgroundMusic
) {
}
