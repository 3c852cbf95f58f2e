package com.storymaker.backend.dto;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.StoryLength;

public record PromptEnhanceResponse(
        String enhancedPrompt,
        String originalPrompt,
        Genre genre,
        StoryLength length,
        String provider,
        boolean fallbackUsed
) {
}
