package com.storymaker.backend.dto;

import com.storymaker.backend.model.ImageStyle;

public record ImageGenerateResponse(
        String prompt,
        ImageStyle style,
        String size,
        GeneratedImageDto image,
        String provider,
        boolean fallbackUsed,
        long elapsedMs
) {
}
