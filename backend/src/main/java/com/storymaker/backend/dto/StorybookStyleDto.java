package com.storymaker.backend.dto;

import com.storymaker.backend.model.ImageStyle;

import java.util.List;

public record StorybookStyleDto(
        String id,
        String name,
        String description,
        String ageGroup,
        List<String> features,
        boolean recommended
) {

    public static StorybookStyleDto from(ImageStyle style) {
        return new StorybookStyleDto(style.getValue(), style.getDisplayName(), style.getDescription(),
                style.getAgeGroup(), style.getFeatures(), style.isRecommended());
    }
}
