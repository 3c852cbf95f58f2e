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
public class StorybookFromPromptRequest {

    @NotBlank
    @Size(max = 2000)
    private String prompt;

    private String genre;

    private String length;

    private String style;

    @Min(1)
    @Max(15)
    @JsonAlias({"sceneCount", "scene_count"})
    private Integer sceneCount = 8;

    private String voice;

    private Long seed;
}
