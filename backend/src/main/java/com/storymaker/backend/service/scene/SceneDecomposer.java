package com.storymaker.backend.service.scene;

import com.storymaker.backend.exception.StoryParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a narrative into at most N ordered scenes.
 *
 * <p>Paragraphs (blank line separated) are the preferred unit. Paragraphs of 20 characters or
 * less are folded into a neighbour; when no paragraph is longer than that the text is split
 * into sentences instead. More units than N are grouped into N consecutive, evenly sized
 * buckets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SceneDecomposer {

    public static final int MAX_SCENES = 15;
    static final int MIN_PARAGRAPH_LENGTH = 20;

    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
    private static final Pattern HAS_WORD_CHAR = Pattern.compile("[\\p{L}\\p{N}]");

    private final SentenceSplitter sentenceSplitter;
    private final SceneDescriptionBuilder descriptionBuilder;

    public List<Scene> decompose(String text, int requestedScenes) {
        if (text == null || text.isBlank()) {
            throw new StoryParseException("Story text is empty");
        }
        int target = Math.max(1, Math.min(MAX_SCENES, requestedScenes));

        List<String> paragraphs = paragraphs(text);
        boolean sentenceMode = paragraphs.isEmpty();
        List<String> units = sentenceMode ? sentences(text) : paragraphs;
        if (units.isEmpty()) {
            throw new StoryParseException("Story text contains no readable sentences");
        }
        String separator = sentenceMode ? " " : "\n\n";

        List<String> contents = units.size() <= target ? units : group(units, target, separator);
        List<Scene> scenes = new ArrayList<>(contents.size());
        for (String content : contents) {
            String trimmed = content.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int index = scenes.size();
            scenes.add(new Scene(index, trimmed, descriptionBuilder.describe(trimmed), "scene-" + (index + 1)));
        }
        log.debug("Decomposed {} {} into {} scene(s) (requested {})",
                units.size(), sentenceMode ? "sentences" : "paragraphs", scenes.size(), requestedScenes);
        return scenes;
    }

    /**
     * Paragraph units, or an empty list when no paragraph is long enough to stand on its own.
     */
    List<String> paragraphs(String text) {
        List<String> raw = Arrays.stream(BLANK_LINE.split(text.trim()))
                .map(String::trim)
                .filter(this::isReadable)
                .toList();
        if (raw.stream().noneMatch(p -> p.length() > MIN_PARAGRAPH_LENGTH)) {
            return List.of();
        }

        List<String> merged = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (String paragraph : raw) {
            if (paragraph.length() <= MIN_PARAGRAPH_LENGTH) {
                if (merged.isEmpty()) {
                    appendTo(pending, paragraph);
                } else {
                    int last = merged.size() - 1;
                    merged.set(last, merged.get(last) + "\n\n" + paragraph);
                }
                continue;
            }
            if (pending.length() > 0) {
                merged.add(pending + "\n\n" + paragraph);
                pending.setLength(0);
            } else {
                merged.add(paragraph);
            }
        }
        return merged;
    }

    private List<String> sentences(String text) {
        return sentenceSplitter.split(text).stream()
                .filter(this::isReadable)
                .toList();
    }

    /**
     * Partitions units into exactly {@code target} consecutive buckets whose sizes differ by at
     * most one, so no bucket is larger than ceil(units / target).
     */
    static List<String> group(List<String> units, int target, String separator) {
        List<String> buckets = new ArrayList<>(target);
        int base = units.size() / target;
        int remainder = units.size() % target;
        int start = 0;
        for (int bucket = 0; bucket < target && start < units.size(); bucket++) {
            int size = base + (bucket < remainder ? 1 : 0);
            buckets.add(String.join(separator, units.subList(start, start + size)));
            start += size;
        }
        return buckets;
    }

    private boolean isReadable(String unit) {
        return !unit.isEmpty() && HAS_WORD_CHAR.matcher(unit).find();
    }

    private static void appendTo(StringBuilder pending, String paragraph) {
        if (pending.length() > 0) {
            pending.append("\n\n");
        }
        pending.append(paragraph);
    }
}
