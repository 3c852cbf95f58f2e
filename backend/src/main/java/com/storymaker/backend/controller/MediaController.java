package com.storymaker.backend.controller;

import com.storymaker.backend.dto.AudioGenerateRequest;
import com.storymaker.backend.dto.AudioGenerateResponse;
import com.storymaker.backend.dto.ImageGenerateRequest;
import com.storymaker.backend.dto.ImageGenerateResponse;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.service.StoryGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Standalone image and narration generation.
 */
@RestController
@RequiredArgsConstructor
public class MediaController {

    private final StoryGenerationService storyGenerationService;

    @PostMapping("/api/images/generate")
    public ResponseEntity<ImageGenerateResponse> generateImage(@Valid @RequestBody ImageGenerateRequest request) {
        return ResponseEntity.ok(storyGenerationService.generateImage(
                request.getPrompt(),
                ImageStyle.fromValue(request.getStyle()),
                request.getSize()));
    }

    @PostMapping("/api/audio/generate")
    public ResponseEntity<AudioGenerateResponse> generateAudio(@Valid @RequestBody AudioGenerateRequest request) {
        return ResponseEntity.ok(storyGenerationService.generateAudio(
                request.getText(),
                Voice.fromValue(request.getVoice()),
                request.getSpeed()));
    }
}
