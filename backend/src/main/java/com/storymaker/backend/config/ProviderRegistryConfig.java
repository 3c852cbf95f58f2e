package com.storymaker.backend.config;

import com.storymaker.backend.provider.Capability;
import com.storymaker.backend.provider.CredentialRules;
import com.storymaker.backend.provider.CredentialStore;
import com.storymaker.backend.provider.CredentialValidator;
import com.storymaker.backend.provider.ProviderDescriptor;
import com.storymaker.backend.provider.ProviderHealthTracker;
import com.storymaker.backend.provider.ProviderRegistry;
import com.storymaker.backend.provider.adapter.ElevenLabsSpeechAdapter;
import com.storymaker.backend.provider.adapter.GoogleAiTextAdapter;
import com.storymaker.backend.provider.adapter.HuggingFaceImageAdapter;
import com.storymaker.backend.provider.adapter.HuggingFaceTextAdapter;
import com.storymaker.backend.provider.adapter.OpenAiChatAdapter;
import com.storymaker.backend.provider.adapter.OpenAiImageAdapter;
import com.storymaker.backend.provider.adapter.OpenAiSpeechAdapter;
import com.storymaker.backend.provider.adapter.StabilityImageAdapter;
import com.storymaker.backend.service.GenerationRouter;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the provider registry once at startup and wires the router around it.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AiProviderProperties.class)
public class ProviderRegistryConfig {

    static final int TEXT_MIN_LENGTH = 101;
    static final int IMAGE_MIN_BYTES = 1024;
    static final int AUDIO_MIN_BYTES = 256;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialValidator credentialValidator(AiProviderProperties properties) {
        Map<String, String> keys = new HashMap<>();
        for (AiProviderProperties.Vendor vendor : List.of(properties.getOpenai(), properties.getHuggingface(),
                properties.getGoogle(), properties.getStability(), properties.getElevenlabs())) {
            if (vendor.getCredentialKey() != null && vendor.getApiKey() != null) {
                keys.put(vendor.getCredentialKey(), vendor.getApiKey());
            }
        }
        CredentialStore store = key -> Optional.ofNullable(keys.get(key));
        return new CredentialValidator(store);
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker(
            @Value("${ai.breaker.failure-threshold:5}") int failureThreshold,
            @Value("${ai.breaker.cooldown:5m}") Duration cooldown,
            Clock clock) {
        return new ProviderHealthTracker(failureThreshold, cooldown, clock);
    }

    @Bean
    public FallbackGenerator fallbackGenerator(@Value("${ai.fallback.seed:#{null}}") Long seed) {
        return new FallbackGenerator(seed);
    }

    @Bean
    public ProviderRegistry providerRegistry(
            AiProviderProperties properties,
            CredentialValidator credentialValidator,
            WebClient.Builder vendorWebClientBuilder,
            @Value("${ai.timeouts.text:30s}") Duration textTimeout,
            @Value("${ai.timeouts.enhancement:15s}") Duration enhancementTimeout,
            @Value("${ai.timeouts.image:90s}") Duration imageTimeout,
            @Value("${ai.timeouts.audio:30s}") Duration audioTimeout) {
        ProviderRegistry registry = new ProviderRegistry(credentialValidator);

        AiProviderProperties.Vendor openai = properties.getOpenai();
        if (openai.isEnabled()) {
            WebClient client = vendorWebClientBuilder.clone().baseUrl(openai.getBaseUrl()).build();
            OpenAiChatAdapter chat = new OpenAiChatAdapter(client, openai.getTextModel());
            registry.register(new ProviderDescriptor("openai", Capability.TEXT_GENERATION, 1,
                    openai.getCredentialKey(), CredentialRules.OPENAI_RULE, TEXT_MIN_LENGTH, textTimeout, chat));
            registry.register(new ProviderDescriptor("openai", Capability.PROMPT_ENHANCEMENT, 1,
                    openai.getCredentialKey(), CredentialRules.OPENAI_RULE, 1, enhancementTimeout, chat));
            registry.register(new ProviderDescriptor("openai", Capability.IMAGE_GENERATION, 2,
                    openai.getCredentialKey(), CredentialRules.OPENAI_RULE, IMAGE_MIN_BYTES, imageTimeout,
                    new OpenAiImageAdapter(client, openai.getImageModel())));
            registry.register(new ProviderDescriptor("openai", Capability.AUDIO_NARRATION, 1,
                    openai.getCredentialKey(), CredentialRules.OPENAI_RULE, AUDIO_MIN_BYTES, audioTimeout,
                    new OpenAiSpeechAdapter(client, openai.getSpeechModel())));
        }

        AiProviderProperties.Vendor huggingface = properties.getHuggingface();
        if (huggingface.isEnabled()) {
            WebClient client = vendorWebClientBuilder.clone().baseUrl(huggingface.getBaseUrl()).build();
            HuggingFaceTextAdapter text = new HuggingFaceTextAdapter(client, huggingface.getTextModel());
            registry.register(new ProviderDescriptor("huggingface", Capability.TEXT_GENERATION, 2,
                    huggingface.getCredentialKey(), CredentialRules.HUGGINGFACE_RULE, TEXT_MIN_LENGTH, textTimeout, text));
            registry.register(new ProviderDescriptor("huggingface", Capability.PROMPT_ENHANCEMENT, 2,
                    huggingface.getCredentialKey(), CredentialRules.HUGGINGFACE_RULE, 1, enhancementTimeout, text));
            registry.register(new ProviderDescriptor("huggingface", Capability.IMAGE_GENERATION, 3,
                    huggingface.getCredentialKey(), CredentialRules.HUGGINGFACE_RULE, IMAGE_MIN_BYTES, imageTimeout,
                    new HuggingFaceImageAdapter(client, huggingface.getImageModel())));
        }

        AiProviderProperties.Vendor google = properties.getGoogle();
        if (google.isEnabled()) {
            WebClient client = vendorWebClientBuilder.clone().baseUrl(google.getBaseUrl()).build();
            GoogleAiTextAdapter text = new GoogleAiTextAdapter(client, google.getTextModel());
            registry.register(new ProviderDescriptor("google", Capability.TEXT_GENERATION, 3,
                    google.getCredentialKey(), CredentialRules.GOOGLE_RULE, TEXT_MIN_LENGTH, textTimeout, text));
            registry.register(new ProviderDescriptor("google", Capability.PROMPT_ENHANCEMENT, 3,
                    google.getCredentialKey(), CredentialRules.GOOGLE_RULE, 1, enhancementTimeout, text));
        }

        AiProviderProperties.Vendor stability = properties.getStability();
        if (stability.isEnabled()) {
            WebClient client = vendorWebClientBuilder.clone().baseUrl(stability.getBaseUrl()).build();
            registry.register(new ProviderDescriptor("stability", Capability.IMAGE_GENERATION, 1,
                    stability.getCredentialKey(), CredentialRules.STABILITY_RULE, IMAGE_MIN_BYTES, imageTimeout,
                    new StabilityImageAdapter(client, stability.getImageModel())));
        }

        AiProviderProperties.Vendor elevenlabs = properties.getElevenlabs();
        if (elevenlabs.isEnabled()) {
            WebClient client = vendorWebClientBuilder.clone().baseUrl(elevenlabs.getBaseUrl()).build();
            registry.register(new ProviderDescriptor("elevenlabs", Capability.AUDIO_NARRATION, 2,
                    elevenlabs.getCredentialKey(), CredentialRules.ELEVENLABS_RULE, AUDIO_MIN_BYTES, audioTimeout,
                    new ElevenLabsSpeechAdapter(client, elevenlabs.getSpeechModel())));
        }

        for (Capability capability : Capability.values()) {
            log.info("{}: {} of {} provider(s) configured", capability.getValue(),
                    registry.getOrdered(capability).size(), registry.getAll(capability).size());
        }
        return registry;
    }

    @Bean
    public GenerationRouter generationRouter(ProviderRegistry providerRegistry,
                                             ProviderHealthTracker providerHealthTracker,
                                             FallbackGenerator fallbackGenerator,
                                             Clock clock) {
        return new GenerationRouter(providerRegistry, providerHealthTracker, fallbackGenerator, clock);
    }
}
