package com.storymaker.backend.service.scene;

/**
 * One illustrated unit of a story.
 *
 * @param index            zero based, follows source order
 * @param narrationCue     marker tying the page to its place in the narration track
 */
public record Scene(int index, String content, String imageDescription, String narrationCue) {

    public int pageNumber() {
        return index + 1;
    }

    public int wordCount() {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
