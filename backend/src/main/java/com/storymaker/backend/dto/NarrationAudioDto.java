package com.storymaker.backend.dto;

import com.storymaker.backend.model.Voice;

/**
 * Synthesized speech, or the cleaned script when no speech provider answered and the client
 * has to synthesize it. {@code audio} is serialized as base64.
 */
public record NarrationAudioDto(
        String provider,
        Voice voice,
        String mimeType,
        byte[] audio,
        String script,
        int estimatedDurationSeconds,
        boolean generated
) {
}
