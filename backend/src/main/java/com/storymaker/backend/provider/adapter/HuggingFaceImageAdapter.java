package com.storymaker.backend.provider.adapter;

import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.provider.ProviderAdapter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HuggingFace text-to-image inference. The body is the raw image.
 */
@RequiredArgsConstructor
public class HuggingFaceImageAdapter implements ProviderAdapter {

    private final WebClient webClient;
    private final String model;

    @Override
    public Mono<GeneratedContent> invoke(GenerationRequest request, String credential) {
        return webClient.post()
                .uri("/models/" + model)
                .headers(headers -> headers.setBearerAuth(credential))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.IMAGE_PNG, MediaType.IMAGE_JPEG)
                .bodyValue(Map.of("inputs", request.prompt()))
                .retrieve()
                .toEntity(byte[].class)
                .map(HuggingFaceImageAdapter::normalize);
    }

    static GeneratedContent normalize(ResponseEntity<byte[]> response) {
        MediaType contentType = response.getHeaders().getContentType();
        String mimeType = contentType != null && "image".equals(contentType.getType())
                ? contentType.toString()
                : MediaType.IMAGE_PNG_VALUE;
        byte[] body = response.getBody();
        return GeneratedContent.ofBinary(body == null ? new byte[0] : body, mimeType);
    }
}
