package com.storymaker.backend.service.fallback;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.PlaceholderImage;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;

import java.util.List;
import java.util.Random;

/**
 * Template based generator that answers every capability without any network call. It is the
 * terminal step of failover and has no error conditions.
 *
 * <p>All randomness flows through a {@link Random} built from the request seed (or the
 * configured default seed), so identical seeds give identical output.
 */
public class FallbackGenerator {

    static final String OPENING =
            "Once upon a time, in a world not far from our own, %s unfolded %s. "
                    + "This tale begins with great promise and adventure waiting to unfold.";

    static final String ADDITIONAL_ELEMENTS = "Additional story elements: Include rich character development "
            + "with dialogue that reveals personality, vivid environmental descriptions that set the mood, "
            + "unexpected plot twists that keep readers engaged, meaningful themes that resonate across age groups, "
            + "and a satisfying resolution that ties together all story threads while leaving readers feeling inspired.";

    private static final List<String> FILLERS = List.of(
            "The journey continued with new wonders and challenges. Each step forward revealed more about the "
                    + "incredible nature of their world and the magic that dwelt within every heart. The story grew "
                    + "richer with every chapter, weaving together themes of courage, love, and the endless "
                    + "possibilities that await those brave enough to dream.",
            "Days turned into weeks, and every sunrise brought a fresh question to answer. Old friends offered "
                    + "advice, strangers became allies, and even the smallest choices seemed to ripple outward in "
                    + "ways nobody could have predicted when the adventure first began.",
            "Along the way there were quiet evenings too, moments to rest and remember why the journey mattered. "
                    + "Stories were shared around crackling fires, promises were renewed, and hope grew a little "
                    + "stronger with every kind word spoken in the dark.",
            "Not every path led forward. Some ended at locked gates or rushing rivers, and more than once the "
                    + "travelers had to turn back and try again. Yet each detour taught them something new, and "
                    + "patience slowly became one of their greatest strengths."
    );

    private static final List<String> TITLE_SUBJECTS = List.of(
            "Journey", "Quest", "Story", "Tale", "Adventure", "Experience", "Legend", "Mystery");

    private static final List<String> PALETTE = List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4", "#FFEAA7",
            "#DDA0DD", "#98D8C8", "#F7DC6F", "#BB8FCE", "#85C1E9");

    private static final int CAPTION_LIMIT = 30;

    private final Long defaultSeed;

    public FallbackGenerator(Long defaultSeed) {
        this.defaultSeed = defaultSeed;
    }

    public GeneratedContent generate(GenerationRequest request) {
        Random random = randomFor(request.seed());
        return switch (request.capability()) {
            case TEXT_GENERATION -> GeneratedContent.ofText(
                    generateStory(request.prompt(), request.genre(), request.length(), random));
            case PROMPT_ENHANCEMENT -> GeneratedContent.ofText(enhancePrompt(request.prompt(), request.genre()));
            case IMAGE_GENERATION -> GeneratedContent.ofPlaceholder(placeholderImage(
                    request.prompt(), request.sceneIndex() == null ? 0 : request.sceneIndex(), request.style()));
            case AUDIO_NARRATION -> GeneratedContent.ofText(narrationScript(request.prompt()));
        };
    }

    public Random randomFor(Long seed) {
        if (seed != null) {
            return new Random(seed);
        }
        return defaultSeed != null ? new Random(defaultSeed) : new Random();
    }

    /**
     * Builds a story of at least {@code length.getTargetWords()} words. Paragraphs are separated
     * by blank lines so the result decomposes into scenes like provider output does.
     */
    public String generateStory(String prompt, Genre genre, StoryLength length, Random random) {
        GenreTemplate template = GenreTemplate.of(genre == null ? Genre.FANTASY : genre);
        int target = (length == null ? StoryLength.MEDIUM : length).getTargetWords();
        String subject = prompt == null || prompt.isBlank() ? "a remarkable story" : prompt.trim();

        StringBuilder story = new StringBuilder(String.format(OPENING, subject, template.setting()));
        int words = countWords(story);

        while (words < target * 0.7) {
            words += appendParagraph(story, capitalize(template.conflict())
                    + ", and this became the central challenge that would define the journey. Characters developed "
                    + "and changed as they discovered new strengths within themselves. The world around them seemed "
                    + "to respond to their growth, revealing hidden depths and unexpected possibilities.");
            if (words < target * 0.7) {
                words += appendParagraph(story, "In the end, " + template.resolution()
                        + ", as the story reached its crescendo. Lessons were learned that would echo through time, "
                        + "and bonds were forged that would last beyond the final page. The adventure had changed "
                        + "everyone involved, teaching them that the greatest discoveries come from within.");
            }
        }
        while (words < target) {
            words += appendParagraph(story, FILLERS.get(random.nextInt(FILLERS.size())));
        }
        return story.toString();
    }

    public String enhancePrompt(String prompt, Genre genre) {
        GenreTemplate template = GenreTemplate.of(genre == null ? Genre.FANTASY : genre);
        String original = prompt == null ? "" : prompt.trim();
        return original + "\n\nEnhanced narrative direction: " + template.enhancement() + "\n\n" + ADDITIONAL_ELEMENTS;
    }

    public String generateTitle(Genre genre, Random random) {
        List<String> adjectives = GenreTemplate.of(genre == null ? Genre.FANTASY : genre).titleAdjectives();
        return adjectives.get(random.nextInt(adjectives.size())) + " "
                + TITLE_SUBJECTS.get(random.nextInt(TITLE_SUBJECTS.size()));
    }

    public PlaceholderImage placeholderImage(String description, int sceneIndex, ImageStyle style) {
        int index = Math.max(0, sceneIndex);
        String text = description == null ? "" : description.trim();
        String caption = text.length() > CAPTION_LIMIT ? text.substring(0, CAPTION_LIMIT) + "..." : text;
        ImageStyle resolvedStyle = style == null ? ImageStyle.CHILDREN_BOOK : style;
        return new PlaceholderImage(
                800,
                600,
                PALETTE.get(index % PALETTE.size()),
                PALETTE.get((index + 3) % PALETTE.size()),
                "Scene " + (index + 1),
                caption,
                "Style: " + resolvedStyle.getLabel());
    }

    /**
     * Audio cannot be synthesized offline; the script is returned for client side speech synthesis.
     */
    public String narrationScript(String text) {
        if (text == null || text.isBlank()) {
            return "The End.";
        }
        return text.trim();
    }

    public static int countWords(CharSequence text) {
        String value = text.toString().trim();
        return value.isEmpty() ? 0 : value.split("\\s+").length;
    }

    private static int appendParagraph(StringBuilder story, String paragraph) {
        story.append("\n\n").append(paragraph);
        return countWords(paragraph);
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
