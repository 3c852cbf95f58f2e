package com.storymaker.backend.provider.adapter;

import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.provider.ProviderAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI text-to-speech, MP3 output. The endpoint takes at most {@value #MAX_INPUT_LENGTH}
 * characters per call, so longer narration is spoken in sentence-aligned chunks and the MP3
 * parts are joined in order.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenAiSpeechAdapter implements ProviderAdapter {

    static final String AUDIO_MPEG = "audio/mpeg";
    static final int MAX_INPUT_LENGTH = 4096;

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        List<String> chunks = splitIntoChunks(request.prompt(), MAX_INPUT_LENGTH);
        if (chunks.size() > 1) {
            log.debug("Narration of {} chars split into {} speech calls", request.prompt().length(), chunks.size());
        }
        return Flux.fromIterable(chunks)
                .concatMap(chunk -> speak(chunk, request, credential))
                .collectList()
                .map(parts -> GeneratedContent.ofBinary(join(parts), AUDIO_MPEG));
    }

    private Mono<byte[]> speak(String input, GenerationRequest request, String credential) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("voice", request.voice().getOpenAiVoice());
        body.put("input", input);
        body.put("speed", request.clampedSpeed());
        body.put("response_format", "mp3");

        return webClient.post()
                .uri("/v1/audio/speech")
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(byte[].class);
    }

    /**
     * Packs whole sentences into chunks of at most {@code limit} characters. A single sentence
     * longer than the limit is cut at its last space, or hard at the limit when it has none.
     */
    static List<String> splitIntoChunks(String text, int limit) {
        String trimmed = text == null ? "" : text.trim();
        List<String> chunks = new ArrayList<>();
        if (trimmed.length() <= limit) {
            chunks.add(trimmed);
            return chunks;
        }
        StringBuilder current = new StringBuilder();
        for (String sentence : trimmed.split("(?<=[.!?])\\s+")) {
            String rest = sentence;
            while (rest.length() > limit) {
                int cut = rest.lastIndexOf(' ', limit);
                if (cut <= 0) {
                    cut = limit;
                }
                flush(chunks, current);
                chunks.add(rest.substring(0, cut).trim());
                rest = rest.substring(cut).trim();
            }
            if (rest.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 1 + rest.length() > limit) {
                flush(chunks, current);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(rest);
        }
        flush(chunks, current);
        return chunks;
    }

    private static void flush(List<String> chunks, StringBuilder current) {
        if (current.length() > 0) {
            chunks.add(current.toString());
            current.setLength(0);
        }
    }

    private static byte[] join(List<byte[]> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        parts.forEach(out::writeBytes);
        return out.toByteArray();
    }
}
