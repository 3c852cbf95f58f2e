package com.storymaker.backend.provider.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.storymaker.backend.exception.FailureKind;
import com.storymaker.backend.exception.ProviderException;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.provider.ProviderAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * OpenAI image generation, requesting base64 output so no second download is needed.
 */
@RequiredArgsConstructor
public class OpenAiImageAdapter implements ProviderAdapter {

    private static final Set<String> SUPPORTED_SIZES = Set.of("1024x1024", "1792x1024", "1024x1792");

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        String size = ImageSize.parse(request.size()).toString();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", request.prompt());
        body.put("n", 1);
        body.put("size", SUPPORTED_SIZES.contains(size) ? size : ImageSize.DEFAULT.toString());
        body.put("response_format", "b64_json");

        return webClient.post()
                .uri("/v1/images/generations")
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(OpenAiImageAdapter::normalize);
    }

    static GeneratedContent normalize(JsonNode response) {
        String base64 = response.path("data").path(0).path("b64_json").asText("");
        if (base64.isEmpty()) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED, "no image data in response");
        }
        return GeneratedContent.ofBinary(Base64.getDecoder().decode(base64), MediaType.IMAGE_PNG_VALUE);
    }
}
