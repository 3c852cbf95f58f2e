package com.storymaker.backend.service.scene;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NarrationTextBuilderTest {

    private final NarrationTextBuilder builder = new NarrationTextBuilder();

    @Test
    void buildsPagedNarration() {
        List<Scene> scenes = List.of(
                new Scene(0, "First page.", "d", "scene-1"),
                new Scene(1, "Second page.", "d", "scene-2"));

        assertThat(builder.build(scenes)).isEqualTo("Welcome to this interactive storybook. "
                + "Page 1. First page. Let's turn the page and continue our adventure. "
                + "Page 2. Second page. The End. Thank you for joining us on this magical journey!");
    }

    @Test
    void cleansMarkdownAndTitlesForSpeech() {
        String cleaned = builder.cleanForSpeech("## Intro\n**Dr. Smith** met Mr. Jones!  Then   they left.");

        assertThat(cleaned).doesNotContain("**").doesNotContain("##");
        assertThat(cleaned).contains("Doctor Smith met Mister Jones! ... Then they left.");
    }

    @Test
    void truncatesAtSentenceBoundary() {
        String text = "One sentence here. Another sentence there. A third one.";

        assertThat(builder.truncateAtSentence(text, 30)).isEqualTo("One sentence here.");
        assertThat(builder.truncateAtSentence(text, 500)).isEqualTo(text);
    }

    @Test
    void estimatesDurationAtOneHundredFiftyWordsPerMinute() {
        assertThat(NarrationTextBuilder.estimateDurationSeconds("word ".repeat(150))).isEqualTo(60);
        assertThat(NarrationTextBuilder.estimateDurationSeconds("one two")).isEqualTo(1);
        assertThat(NarrationTextBuilder.estimateDurationSeconds("")).isZero();
    }
}
