package com.storymaker.backend.dto;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.StoryLength;

/**
 * @param estimatedReadingTime minutes at 200 words per minute, at least one
 */
public record StoryGenerateResponse(
        String title,
        String content,
        String prompt,
        Genre genre,
        StoryLength length,
        int wordCount,
        int estimatedReadingTime,
        String provider,
        boolean fallbackUsed
) {
}
