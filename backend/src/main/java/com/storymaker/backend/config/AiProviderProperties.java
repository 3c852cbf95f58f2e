package com.storymaker.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code ai.providers.*}: credentials, endpoints and models for each vendor.
 */
@Data
@ConfigurationProperties(prefix = "ai.providers")
public class AiProviderProperties {

    private Vendor openai = new Vendor("OPENAI_API_KEY", "https://api.openai.com",
            "gpt-3.5-turbo", "dall-e-3", "tts-1");
    private Vendor huggingface = new Vendor("HUGGINGFACE_API_KEY", "https://api-inference.huggingface.co",
            "microsoft/DialoGPT-large", "stabilityai/stable-diffusion-xl-base-1.0", null);
    private Vendor google = new Vendor("GOOGLE_AI_API_KEY", "https://generativelanguage.googleapis.com",
            "gemini-1.5-flash", null, null);
    private Vendor stability = new Vendor("STABILITY_API_KEY", "https://api.stability.ai",
            null, "stable-diffusion-xl-1024-v1-0", null);
    private Vendor elevenlabs = new Vendor("ELEVENLABS_API_KEY", "https://api.elevenlabs.io",
            null, null, "eleven_monolingual_v1");

    @Data
    public static class Vendor {
        /** Master toggle; a disabled vendor is never registered. */
        private boolean enabled = true;
        /** Name reported when the key is missing, matching the environment variable. */
        private String credentialKey;
        private String apiKey;
        private String baseUrl;
        private String textModel;
        private String imageModel;
        private String speechModel;

        public Vendor() {
        }

        Vendor(String credentialKey, String baseUrl, String textModel, String imageModel, String speechModel) {
            this.credentialKey = credentialKey;
            this.baseUrl = baseUrl;
            this.textModel = textModel;
            this.imageModel = imageModel;
            this.speechModel = speechModel;
        }
    }
}
