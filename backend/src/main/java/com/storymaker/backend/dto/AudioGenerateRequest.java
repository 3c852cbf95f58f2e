package com.storymaker.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AudioGenerateRequest {

    @NotBlank
    @Size(max = 4096, message = "Text too long for audio generation (max 4096 characters)")
    private String text;

    private String voice;

    @DecimalMin("0.25")
    @DecimalMax("4.0")
    private Double speed;
}
