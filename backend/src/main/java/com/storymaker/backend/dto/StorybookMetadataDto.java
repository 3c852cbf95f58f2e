package com.storymaker.backend.dto;

import java.util.List;

public record StorybookMetadataDto(
        int scenesGenerated,
        int imagesGenerated,
        int imagesFailed,
        boolean audioGenerated,
        String estimatedAgeGroup,
        List<String> errors
) {

    public StorybookMetadataDto {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isPartial() {
        return !errors.isEmpty();
    }
}
