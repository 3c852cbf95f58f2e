package com.storymaker.backend.service.scene;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Splits text after sentence punctuation, keeping the punctuation with its sentence so that
 * joining the pieces with a space restores the text.
 */
@Component
public class SentenceSplitter {

    private static final String SENTENCE_SPLIT_REGEX = "(?<=[.!?][\"']?)\\s+";

    public List<String> split(String text) {
        if (text == null || text.trim().isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.trim().split(SENTENCE_SPLIT_REGEX))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
