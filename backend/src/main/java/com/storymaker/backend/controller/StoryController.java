package com.storymaker.backend.controller;

import com.storymaker.backend.dto.PromptEnhanceRequest;
import com.storymaker.backend.dto.PromptEnhanceResponse;
import com.storymaker.backend.dto.ProvidersResponse;
import com.storymaker.backend.dto.StoryGenerateRequest;
import com.storymaker.backend.dto.StoryGenerateResponse;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.service.ProviderStatusService;
import com.storymaker.backend.service.StoryGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
public class StoryController {

    private final StoryGenerationService storyGenerationService;
    private final ProviderStatusService providerStatusService;

    @PostMapping("/generate")
    public ResponseEntity<StoryGenerateResponse> generateStory(@Valid @RequestBody StoryGenerateRequest request) {
        log.info("Story generation requested: genre={}, length={}", request.getGenre(), request.getLength());
        StoryGenerateResponse response = storyGenerationService.generateText(
                request.getPrompt(),
                Genre.fromValue(request.getGenre()),
                StoryLength.fromValue(request.getLength()),
                request.getSeed());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/enhance-prompt")
    public ResponseEntity<PromptEnhanceResponse> enhancePrompt(@Valid @RequestBody PromptEnhanceRequest request) {
        return ResponseEntity.ok(storyGenerationService.enhancePrompt(
                request.getPrompt(),
                Genre.fromValue(request.getGenre()),
                StoryLength.fromValue(request.getLength())));
    }

    @GetMapping("/providers")
    public ResponseEntity<ProvidersResponse> getProviders() {
        return ResponseEntity.ok(providerStatusService.describeProviders());
    }
}
