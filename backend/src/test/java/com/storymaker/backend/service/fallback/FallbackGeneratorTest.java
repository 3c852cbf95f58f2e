package com.storymaker.backend.service.fallback;

import com.storymaker.backend.model.Genre;
import com.storymaker.backend.model.ImageStyle;
import com.storymaker.backend.model.PlaceholderImage;
import com.storymaker.backend.model.StoryLength;
import com.storymaker.backend.model.Voice;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackGeneratorTest {

    private final FallbackGenerator generator = new FallbackGenerator(null);

    @ParameterizedTest
    @EnumSource(Genre.class)
    @DisplayName("every genre reaches the word target of every length tier")
    void meetsWordTarget(Genre genre) {
        for (StoryLength length : StoryLength.values()) {
            String story = generator.generateStory("a lighthouse keeper", genre, length, new Random(7));

            assertThat(FallbackGenerator.countWords(story))
                    .as("%s / %s", genre, length)
                    .isGreaterThanOrEqualTo(length.getTargetWords());
            assertThat(story).contains("a lighthouse keeper");
        }
    }

    @Test
    void sameSeedSameOutput() {
        GenerationRequest request = GenerationRequest.text("two robots", Genre.SCI_FI, StoryLength.MEDIUM).withSeed(99L);

        String first = generator.generate(request).text();
        String second = generator.generate(request).text();

        assertThat(first).isEqualTo(second);
        assertThat(generator.generateTitle(Genre.SCI_FI, new Random(3)))
                .isEqualTo(generator.generateTitle(Genre.SCI_FI, new Random(3)));
    }

    @Test
    void configuredSeedAppliesWhenRequestHasNone() {
        FallbackGenerator seeded = new FallbackGenerator(11L);
        GenerationRequest request = GenerationRequest.text("a river", Genre.ADVENTURE, StoryLength.LONG);

        assertThat(seeded.generate(request).text()).isEqualTo(seeded.generate(request).text());
    }

    @Test
    void storyIsSplitIntoParagraphs() {
        String story = generator.generateStory("a fox", Genre.COMEDY, StoryLength.SHORT, new Random(1));

        assertThat(story.split("\\n\\n")).hasSizeGreaterThan(3);
    }

    @Test
    void titleUsesGenreAdjective() {
        String title = generator.generateTitle(Genre.HORROR, new Random(5));

        assertThat(title.split(" ")).hasSize(2);
        assertThat(title.split(" ")[0]).isIn("Dark", "Shadow", "Nightmare", "Haunted", "Twisted", "Creepy", "Eerie");
    }

    @Test
    void enhancementKeepsOriginalAndAddsGenreBlock() {
        String enhanced = generator.enhancePrompt("a haunted lighthouse", Genre.MYSTERY);

        assertThat(enhanced).startsWith("a haunted lighthouse");
        assertThat(enhanced).contains("A puzzling tale where every clue leads to deeper secrets.");
        assertThat(enhanced.length()).isGreaterThan((int) ("a haunted lighthouse".length() * 1.5));
    }

    @Test
    void placeholderPaletteFollowsSceneIndex() {
        PlaceholderImage first = generator.placeholderImage("A very long description of a castle at night", 0,
                ImageStyle.WATERCOLOR);
        PlaceholderImage eleventh = generator.placeholderImage("Short", 10, null);

        assertThat(first.primaryColor()).isEqualTo("#FF6B6B");
        assertThat(first.title()).isEqualTo("Scene 1");
        assertThat(first.caption()).isEqualTo("A very long description of a c...");
        assertThat(first.styleLabel()).isEqualTo("Style: watercolor");
        assertThat(eleventh.primaryColor()).isEqualTo(first.primaryColor());
        assertThat(eleventh.caption()).isEqualTo("Short");
    }

    @Test
    @DisplayName("audio falls back to a text script for client side speech")
    void audioFallbackIsScript() {
        GeneratedContent content = generator.generate(GenerationRequest.audio("Hello there.", Voice.CHILD, 1.0));

        assertThat(content.mimeType()).isEqualTo(GeneratedContent.TEXT_PLAIN);
        assertThat(content.text()).isEqualTo("Hello there.");
    }

    @Test
    void imageFallbackIsNeverEmpty() {
        GeneratedContent content = generator.generate(GenerationRequest.image("", null, null, null));

        assertThat(content.isPlaceholder()).isTrue();
        assertThat(content.isEmpty()).isFalse();
    }
}
