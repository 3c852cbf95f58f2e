package com.storymaker.backend.provider.adapter;

import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.provider.ProviderAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ElevenLabs text-to-speech. ElevenLabs has no speed parameter, so speed is ignored.
 */
@RequiredArgsConstructor
public class ElevenLabsSpeechAdapter implements ProviderAdapter {

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", request.prompt());
        body.put("model_id", model);
        body.put("voice_settings", Map.of(
                "stability", 0.5,
                "similarity_boost", 0.75,
                "style", 0.0,
                "use_speaker_boost", true));

        return webClient.post()
                .uri("/v1/text-to-speech/{voiceId}", request.voice().getElevenLabsVoiceId())
                .header("xi-api-key", credential)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.parseMediaType(OpenAiSpeechAdapter.AUDIO_MPEG))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(byte[].class)
                .map(bytes -> GeneratedContent.ofBinary(bytes, OpenAiSpeechAdapter.AUDIO_MPEG));
    }
}
