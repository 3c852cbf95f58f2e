package com.storymaker.backend.dto;

public record AudioGenerateResponse(
        NarrationAudioDto narration,
        int textLength,
        double speed,
        String provider,
        boolean fallbackUsed
) {
}
