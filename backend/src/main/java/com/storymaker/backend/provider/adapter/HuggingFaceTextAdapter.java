package com.storymaker.backend.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.storymaker.backend.provider.Capability;
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
 * HuggingFace inference API text generation. The answer comes back either as an array of
 * {@code generated_text} objects or as a single object.
 */
@RequiredArgsConstructor
public class HuggingFaceTextAdapter implements ProviderAdapter {

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        boolean enhancement = request.capability() == Capability.PROMPT_ENHANCEMENT;
        Map<String, Object> body = new LinkedHashMap<>();
        if (enhancement) {
            body.put("inputs", VendorPrompts.enhancementBrief(request));
        } else {
            body.put("inputs", VendorPrompts.compactStoryPrompt(request));
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("max_length", Math.min(request.length().getTargetWords() * 2, 2000));
            parameters.put("temperature", 0.8);
            parameters.put("do_sample", true);
            parameters.put("top_p", 0.9);
            parameters.put("repetition_penalty", 1.1);
            parameters.put("return_full_text", false);
            body.put("parameters", parameters);
        }

        return webClient.post()
                .uri("/models/" + model)
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> normalize(response, enhancement));
    }

    static GeneratedContent normalize(JsonNode response, boolean enhancement) {
        JsonNode node = response.isArray() ? response.path(0) : response;
        String text = node.path("generated_text").asText("").trim();
        if (enhancement) {
            // the model tends to echo a "label:" prefix before the enhanced prompt
            text = text.replaceFirst("^[^:\\n]*:", "").trim();
        }
        return GeneratedContent.ofText(text);
    }
}
