package com.storymaker.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageGenerateRequest {

    @NotBlank
    @Size(max = 1000)
    private String prompt;

    private String style;

    @Pattern(regexp = "\\d{2,4}x\\d{2,4}", message = "size must look like 1024x1024")
    private String size;
}
