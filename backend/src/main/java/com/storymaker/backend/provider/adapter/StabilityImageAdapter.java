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
import java.util.List;
import java.util.Map;

/**
 * Stability AI text-to-image. Returns the first artifact as PNG bytes.
 */
@RequiredArgsConstructor
public class StabilityImageAdapter implements ProviderAdapter {

    private final WebClient webClient;
    private final String engine;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        ImageSize size = ImageSize.parse(request.size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text_prompts", List.of(Map.of("text", request.prompt(), "weight", 1)));
        body.put("cfg_scale", 7);
        body.put("width", size.width());
        body.put("height", size.height());
        body.put("samples", 1);
        body.put("steps", 30);

        return webClient.post()
                .uri("/v1/generation/{engine}/text-to-image", engine)
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(StabilityImageAdapter::normalize);
    }

    static GeneratedContent normalize(JsonNode response) {
        JsonNode artifact = response.path("artifacts").path(0);
        String base64 = artifact.path("base64").asText("");
        if (base64.isEmpty()) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED, "no image artifact in response");
        }
        if ("CONTENT_FILTERED".equals(artifact.path("finishReason").asText())) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED, "image was filtered by the provider");
        }
        return GeneratedContent.ofBinary(Base64.getDecoder().decode(base64), MediaType.IMAGE_PNG_VALUE);
    }
}
