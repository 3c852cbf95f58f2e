package com.storymaker.backend.controller;

import com.storymaker.backend.dto.StorybookDto;
import com.storymaker.backend.dto.StorybookFromPromptRequest;
import com.storymaker.backend.dto.StorybookGenerateRequest;
import com.storymaker.backend.dto.StorybookStyleDto;
import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.service.StorybookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/storybooks")
@RequiredArgsConstructor
public class StorybookController {

    private static final int DEFAULT_SCENE_COUNT = 8;

    private final StorybookService storybookService;

    @PostMapping("/generate")
    public ResponseEntity<StorybookDto> generateStorybook(@Valid @RequestBody StorybookGenerateRequest request) {
        StorybookDto storybook = storybookService.generateStorybook(
                request.getStoryText(),
                request.getTitle(),
                Genre.fromValue(request.getGenre()),
                ImageStyle.fromValue(request.getStyle()),
                request.getSceneCount() == null ? DEFAULT_SCENE_COUNT : request.getSceneCount(),
                !Boolean.FALSE.equals(request.getIncludeImages()),
                !Boolean.FALSE.equals(request.getIncludeAudio()),
                Voice.fromValue(request.getVoice()));
        log.info("Storybook {} ready: {} pages, {} error(s)", storybook.id(), storybook.totalPages(),
                storybook.metadata().errors().size());
        return ResponseEntity.ok(storybook);
    }

    @PostMapping("/create-from-prompt")
    public ResponseEntity<StorybookDto> createFromPrompt(@Valid @RequestBody StorybookFromPromptRequest request) {
        return ResponseEntity.ok(storybookService.createFromPrompt(
                request.getPrompt(),
                Genre.fromValue(request.getGenre()),
                StoryLength.fromValue(request.getLength()),
                ImageStyle.fromValue(request.getStyle()),
                request.getSceneCount() == null ? DEFAULT_SCENE_COUNT : request.getSceneCount(),
                Voice.fromValue(request.getVoice()),
                request.getSeed()));
    }

    @GetMapping("/info/styles")
    public ResponseEntity<List<StorybookStyleDto>> getStyles() {
        return ResponseEntity.ok(Arrays.stream(ImageStyle.values()).map(StorybookStyleDto::from).toList());
    }
}
