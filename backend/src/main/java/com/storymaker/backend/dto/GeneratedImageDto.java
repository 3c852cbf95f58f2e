package com.storymaker.backend.dto;

import com.storymaker.backend.model.PlaceholderImage;

/**
 * Either encoded image bytes or a placeholder the client renders itself. {@code data} is
 * serialized as base64.
 */
public record GeneratedImageDto(
        String provider,
        String mimeType,
        byte[] data,
        PlaceholderImage placeholder,
        boolean generated
) {
}
