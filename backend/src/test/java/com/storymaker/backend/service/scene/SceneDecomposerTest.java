package com.storymaker.backend.service.scene;

import com.storymaker.backend.exception.StoryParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneDecomposerTest {

    private SceneDecomposer decomposer;

    @BeforeEach
    void setUp() {
        decomposer = new SceneDecomposer(new SentenceSplitter(), new SceneDescriptionBuilder());
    }

    @Test
    @DisplayName("short sentences are grouped into the requested number of scenes")
    void groupsSentences() {
        List<Scene> scenes = decomposer.decompose("A. B. C.", 2);

        assertThat(scenes).extracting(Scene::content).containsExactly("A. B.", "C.");
        assertThat(scenes).extracting(Scene::narrationCue).containsExactly("scene-1", "scene-2");
    }

    @Test
    void oneScenePerParagraphWhenFewerThanRequested() {
        String text = paragraphs(3);

        List<Scene> scenes = decomposer.decompose(text, 8);

        assertThat(scenes).hasSize(3);
        assertThat(scenes).extracting(Scene::index).containsExactly(0, 1, 2);
        assertThat(scenes.get(1).content()).isEqualTo(paragraph(2));
    }

    @Test
    @DisplayName("more units than requested yields exactly N scenes that rebuild the text")
    void exactlyNScenes() {
        String text = paragraphs(9);

        List<Scene> scenes = decomposer.decompose(text, 4);

        assertThat(scenes).hasSize(4);
        assertThat(scenes.stream().map(Scene::content).collect(Collectors.joining("\n\n"))).isEqualTo(text);
    }

    @Test
    void capsAtFifteenScenes() {
        assertThat(decomposer.decompose(paragraphs(20), 40)).hasSize(15);
        assertThat(decomposer.decompose(paragraphs(20), 0)).hasSize(1);
    }

    @Test
    @DisplayName("short paragraphs are folded into a neighbour instead of lost")
    void foldsShortParagraphs() {
        String text = "Chapter One\n\n" + paragraph(1) + "\n\nThe End.\n\n" + paragraph(2);

        List<Scene> scenes = decomposer.decompose(text, 5);

        assertThat(scenes).hasSize(2);
        assertThat(scenes.get(0).content()).startsWith("Chapter One").contains(paragraph(1)).endsWith("The End.");
        assertThat(scenes.get(1).content()).isEqualTo(paragraph(2));
    }

    @Test
    void emptyOrUnreadableTextIsFatal() {
        assertThatThrownBy(() -> decomposer.decompose("   ", 3)).isInstanceOf(StoryParseException.class);
        assertThatThrownBy(() -> decomposer.decompose(null, 3)).isInstanceOf(StoryParseException.class);
        assertThatThrownBy(() -> decomposer.decompose("... !!! ???", 3)).isInstanceOf(StoryParseException.class);
    }

    @Test
    void groupNeverExceedsCeilingBucketSize() {
        List<String> units = IntStream.range(0, 10).mapToObj(i -> "u" + i).toList();

        List<String> buckets = SceneDecomposer.group(units, 4, " ");

        assertThat(buckets).containsExactly("u0 u1 u2", "u3 u4 u5", "u6 u7", "u8 u9");
    }

    @Test
    void scenesCarryImageDescriptions() {
        List<Scene> scenes = decomposer.decompose(
                "The young girl walked into the forest. She found an enchanted stone.\n\n" + paragraph(2), 2);

        assertThat(scenes.get(0).imageDescription()).isEqualTo(
                "The young girl walked into the forest in a mystical forest, featuring a young protagonist, "
                        + "with magical elements");
    }

    private static String paragraphs(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(SceneDecomposerTest::paragraph)
                .collect(Collectors.joining("\n\n"));
    }

    private static String paragraph(int number) {
        return "Paragraph " + number + " tells a longer part of the story. It has two sentences.";
    }
}
