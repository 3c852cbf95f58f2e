package com.storymaker.backend.model;

/**
 * Vector description of a stand-in illustration. Clients render it themselves, no pixels are produced.
 */
public record PlaceholderImage(
        int width,
        int height,
        String primaryColor,
        String secondaryColor,
        String title,
        String caption,
        String styleLabel
) {}
