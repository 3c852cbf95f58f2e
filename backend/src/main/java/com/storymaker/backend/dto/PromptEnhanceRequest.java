package com.storymaker.backend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptEnhanceRequest {

    @NotBlank
    @Size(max = 2000)
    @JsonAlias({"originalPrompt", "original_prompt"})
    private String prompt;

    private String genre;

    private String length;
}
