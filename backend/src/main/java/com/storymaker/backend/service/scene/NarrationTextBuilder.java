package com.storymaker.backend.service.scene;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns scenes into a narration script and prepares text for speech synthesis.
 */
@Component
public class NarrationTextBuilder {

    public static final int WORDS_PER_MINUTE = 150;

    public String build(List<Scene> scenes) {
        StringBuilder narration = new StringBuilder("Welcome to this interactive storybook. ");
        for (int i = 0; i < scenes.size(); i++) {
            narration.append("Page ").append(i + 1).append(". ").append(scenes.get(i).content()).append(' ');
            if (i < scenes.size() - 1) {
                narration.append("Let's turn the page and continue our adventure. ");
            }
        }
        narration.append("The End. Thank you for joining us on this magical journey!");
        return narration.toString();
    }

    /** Strips markdown, collapses whitespace, adds pauses and spells out common titles. */
    public String cleanForSpeech(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replaceAll("\\*\\*(.*?)\\*\\*", "$1")
                .replaceAll("\\*(.*?)\\*", "$1")
                .replaceAll("`(.*?)`", "$1")
                .replaceAll("#{1,6}\\s", "")
                .replaceAll("\\[(.*?)]\\(.*?\\)", "$1")
                .replaceAll("\\n\\s*\\n", "\n\n")
                .replaceAll("[ \\t]+", " ")
                .replaceAll("\\.{3,}", "...")
                .replaceAll("\\bMr\\.", "Mister")
                .replaceAll("\\bMrs\\.", "Missus")
                .replaceAll("\\bDr\\.", "Doctor")
                .replaceAll("\\bProf\\.", "Professor")
                .replaceAll("(?<!\\.)\\.\\s", ". ... ")
                .replaceAll("!\\s", "! ... ")
                .replaceAll("\\?\\s", "? ... ")
                .replaceAll(":\\s", ": ... ")
                .trim();
    }

    /**
     * Cuts text to at most {@code limit} characters, preferring the last sentence end before the
     * limit. Returns the text unchanged when it already fits.
     */
    public String truncateAtSentence(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        String head = text.substring(0, limit);
        int cut = Math.max(head.lastIndexOf(". "), Math.max(head.lastIndexOf("! "), head.lastIndexOf("? ")));
        return cut > 0 ? head.substring(0, cut + 1) : head.trim();
    }

    public static int estimateDurationSeconds(String text) {
        String trimmed = text == null ? "" : text.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        return (int) Math.ceil(words / (double) WORDS_PER_MINUTE * 60);
    }
}
