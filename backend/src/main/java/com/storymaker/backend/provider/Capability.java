package com.storymaker.backend.provider;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Capability {
    TEXT_GENERATION("text-generation"),
    PROMPT_ENHANCEMENT("prompt-enhancement"),
    IMAGE_GENERATION("image-generation"),
    AUDIO_NARRATION("audio-narration");

    private final String value;

    Capability(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Capability specific acceptance rule applied on top of the provider's minimum length.
     * Enhanced prompts must be meaningfully longer than what the caller sent.
     */
    public boolean accepts(GenerationRequest request, GeneratedContent content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        if (this == PROMPT_ENHANCEMENT) {
            int originalLength = request.prompt() == null ? 0 : request.prompt().length();
            return content.length() > originalLength * 1.5;
        }
        return true;
    }
}
