package com.storymaker.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorybookGenerateRequest {

    @NotBlank
    @Size(max = 60000)
    @JsonAlias({"storyText", "story_text", "content"})
    private String storyText;

    @Size(max = 200)
    @JsonAlias({"storyTitle", "story_title", "title"})
    private String title;

    private String genre;

    private String style;

    @Min(1)
    @Max(15)
    @JsonAlias({"sceneCount", "scene_count"})
    private Integer sceneCount = 8;

    @JsonAlias({"includeImages", "include_images"})
    private Boolean includeImages = true;

    @JsonAlias({"includeAudio", "include_audio"})
    private Boolean includeAudio = true;

    private String voice;
}
