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
import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions, used for stories and prompt enhancement.
 */
@RequiredArgsConstructor
public class OpenAiChatAdapter implements ProviderAdapter {

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        if (request.capability() == Capability.PROMPT_ENHANCEMENT) {
            body.put("messages", List.of(
                    Map.of("role", "system", "content", VendorPrompts.ENHANCER_SYSTEM_PROMPT),
                    Map.of("role", "user", "content", VendorPrompts.enhancementBrief(request))));
            body.put("max_tokens", 1000);
            body.put("temperature", 0.7);
        } else {
            body.put("messages", List.of(
                    Map.of("role", "system", "content", VendorPrompts.detailedStoryPrompt(request)),
                    Map.of("role", "user", "content", "Please write this story now.")));
            body.put("max_tokens", VendorPrompts.storyTokenBudget(request, 4000));
            body.put("temperature", 0.8);
            body.put("top_p", 0.9);
            body.put("frequency_penalty", 0.1);
            body.put("presence_penalty", 0.1);
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(OpenAiChatAdapter::normalize);
    }

    static GeneratedContent normalize(JsonNode response) {
        String text = response.path("choices").path(0).path("message").path("content").asText("");
        return GeneratedContent.ofText(text.trim());
    }
}
