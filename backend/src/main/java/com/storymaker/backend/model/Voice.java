package com.storymaker.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Voice {
    MALE("male", "onyx", "21m00Tcm4TlvDq8ikWAM"),
    FEMALE("female", "alloy", "21m00Tcm4TlvDq8ikWAM"),
    CHILD("child", "nova", "pNInz6obpgDQGcFmaJgB"),
    ELDERLY("elderly", "echo", "AZnzlk1XvdvUeBnXmlld");

    private final String value;
    private final String openAiVoice;
    private final String elevenLabsVoiceId;

    Voice(String value, String openAiVoice, String elevenLabsVoiceId) {
        this.value = value;
        this.openAiVoice = openAiVoice;
        this.elevenLabsVoiceId = elevenLabsVoiceId;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getOpenAiVoice() {
        return openAiVoice;
    }

    public String getElevenLabsVoiceId() {
        return elevenLabsVoiceId;
    }

    /**
     * Accepts either a voice type ("child") or the OpenAI voice it maps to ("nova").
     * Anything else falls back to {@link #FEMALE}.
     */
    @JsonCreator
    public static Voice fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FEMALE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Voice voice : values()) {
            if (voice.value.equals(normalized) || voice.openAiVoice.equals(normalized)) {
                return voice;
            }
        }
        return FEMALE;
    }
}
