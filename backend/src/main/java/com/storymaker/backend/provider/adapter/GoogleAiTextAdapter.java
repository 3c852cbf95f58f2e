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
 * Google Gemini {@code generateContent}. The key travels in a header so it never shows up in
 * request logs.
 */
@RequiredArgsConstructor
public class GoogleAiTextAdapter implements ProviderAdapter {

    private static final List<String> HARM_CATEGORIES = List.of(
            "HARM_CATEGORY_HARASSMENT",
            "HARM_CATEGORY_HATE_SPEECH",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT",
            "HARM_CATEGORY_DANGEROUS_CONTENT");

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        boolean enhancement = request.capability() == Capability.PROMPT_ENHANCEMENT;
        String prompt = enhancement ? VendorPrompts.enhancementBrief(request) : VendorPrompts.compactStoryPrompt(request);

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (enhancement) {
            generationConfig.put("temperature", 0.7);
            generationConfig.put("maxOutputTokens", 1000);
        } else {
            generationConfig.put("temperature", 0.8);
            generationConfig.put("topK", 40);
            generationConfig.put("topP", 0.95);
            generationConfig.put("maxOutputTokens", VendorPrompts.storyTokenBudget(request, 2000));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        body.put("generationConfig", generationConfig);
        body.put("safetySettings", HARM_CATEGORIES.stream()
                .map(category -> Map.of("category", category, "threshold", "BLOCK_MEDIUM_AND_ABOVE"))
                .toList());

        return webClient.post()
                .uri("/v1beta/models/{model}:generateContent", model)
                .header("x-goog-api-key", credential)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(GoogleAiTextAdapter::normalize);
    }

    static GeneratedContent normalize(JsonNode response) {
        String text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("");
        return GeneratedContent.ofText(text.trim());
    }
}
