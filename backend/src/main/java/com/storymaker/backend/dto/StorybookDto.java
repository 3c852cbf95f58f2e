package com.storymaker.backend.dto;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of one storybook generation.
 *
 * @param totalDuration sum of page reading times, in seconds
 * @param narration     null when audio was not requested
 */
public record StorybookDto(
        String id,
        String title,
        String subtitle,
        Genre genre,
        ImageStyle style,
        Instant createdAt,
        List<StorybookPageDto> pages,
        int totalPages,
        int totalDuration,
        boolean hasImages,
        boolean hasAudio,
        NarrationAudioDto narration,
        StorybookMetadataDto metadata
) {

    public StorybookDto {
        pages = List.copyOf(pages);
    }
}
