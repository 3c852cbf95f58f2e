package com.storymaker.backend.service.fallback;

import com.storymaker.backend.model.Genre;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed narrative fragments per genre used by the offline generator.
 */
record GenreTemplate(
        String setting,
        String conflict,
        String resolution,
        String enhancement,
        List<String> titleAdjectives
) {

    private static final Map<Genre, GenreTemplate> TEMPLATES = new EnumMap<>(Genre.class);

    static {
        TEMPLATES.put(Genre.FANTASY, new GenreTemplate(
                "in a mystical realm where magic flows through ancient forests and forgotten kingdoms",
                "an ancient prophecy unfolds, revealing a chosen one who must restore balance to the magical world",
                "through courage and wisdom, the hero learns that true magic comes from within",
                "Set in a magical world where ancient magic meets modern wonder, featuring mystical creatures, enchanted locations, and a young hero discovering their magical heritage while facing an epic quest to save both the magical and mundane realms.",
                List.of("Enchanted", "Mystical", "Magical", "Legendary", "Ancient", "Secret", "Hidden")));
        TEMPLATES.put(Genre.ADVENTURE, new GenreTemplate(
                "in a vast wilderness where every step brings new discoveries",
                "unexpected challenges test the limits of courage and determination",
                "perseverance and teamwork lead to an extraordinary discovery",
                "An epic journey through uncharted territories where courage, friendship, and determination are tested. The protagonist faces physical and emotional challenges while discovering hidden strengths and forming unbreakable bonds with companions on a quest that will change their world forever.",
                List.of("Epic", "Incredible", "Thrilling", "Daring", "Brave", "Bold", "Fearless")));
        TEMPLATES.put(Genre.MYSTERY, new GenreTemplate(
                "in a town where secrets lurk beneath the surface",
                "clues point to a truth more complex than anyone imagined",
                "careful investigation reveals that understanding comes from seeing beyond appearances",
                "A puzzling tale where every clue leads to deeper secrets. The investigator must use wit, observation, and intuition to unravel a complex mystery that challenges their assumptions and reveals unexpected truths about both the case and themselves.",
                List.of("Secret", "Hidden", "Mysterious", "Puzzling", "Intriguing", "Strange", "Unknown")));
        TEMPLATES.put(Genre.ROMANCE, new GenreTemplate(
                "in circumstances where hearts collide in unexpected ways",
                "misunderstandings and distance test the strength of feelings",
                "love conquers obstacles when two souls choose to understand each other",
                "A heartwarming love story where two souls find each other despite seemingly impossible circumstances. Their journey involves overcoming misunderstandings, personal growth, and learning that true love means accepting each other's flaws and supporting each other's dreams.",
                List.of("Love", "Heart", "Passionate", "Sweet", "Tender", "Beautiful", "Romantic")));
        TEMPLATES.put(Genre.SCI_FI, new GenreTemplate(
                "in a future where technology and humanity intersect in profound ways",
                "advances in science raise questions about what it means to be human",
                "innovation serves humanity when guided by compassion and wisdom",
                "Set in a future where advanced technology and human nature collide. The story explores themes of artificial intelligence, space exploration, genetic engineering, or time travel while questioning what it means to be human in an increasingly digital world.",
                List.of("Future", "Cosmic", "Digital", "Cyber", "Stellar", "Galactic", "Advanced")));
        TEMPLATES.put(Genre.HORROR, new GenreTemplate(
                "in shadows where ancient fears take physical form",
                "the bravest must confront what they fear most",
                "courage and unity triumph over darkness",
                "A spine-chilling tale that builds tension through atmosphere and psychological elements. The protagonist faces their deepest fears while uncovering ancient secrets that threaten not just their sanity, but the very fabric of reality itself.",
                List.of("Dark", "Shadow", "Nightmare", "Haunted", "Twisted", "Creepy", "Eerie")));
        TEMPLATES.put(Genre.COMEDY, new GenreTemplate(
                "in everyday situations where life takes delightfully unexpected turns",
                "mishaps and misunderstandings create comic chaos",
                "laughter and friendship transform obstacles into joyful memories",
                "A light-hearted adventure filled with humorous situations, misunderstandings, and comedic mishaps. The story finds humor in everyday life while celebrating the joy of friendship, the importance of staying positive, and the laughter that comes from life's unexpected moments.",
                List.of("Funny", "Hilarious", "Silly", "Amusing", "Playful", "Cheerful", "Joyful")));
        TEMPLATES.put(Genre.DRAMA, new GenreTemplate(
                "where deep challenges reveal the most profound truths",
                "characters face trials that test their values and relationships",
                "growth and understanding emerge from struggle",
                "An emotionally powerful story that explores deep themes of family, friendship, loss, and personal growth. Characters face real challenges that test their values and relationships while discovering the strength that comes from vulnerability and human connection.",
                List.of("Deep", "Emotional", "Powerful", "Touching", "Moving", "Profound", "Intense")));
        TEMPLATES.put(Genre.THRILLER, new GenreTemplate(
                "where every moment counts and danger lurks around every corner",
                "time runs short as stakes grow higher",
                "quick thinking and decisive action save the day",
                "A pulse-pounding adventure where every second counts and danger lurks around every corner. The protagonist must use quick thinking and resourcefulness to stay ahead of threats while uncovering a conspiracy that threatens everything they hold dear.",
                List.of("Dangerous", "Edge", "Suspenseful", "Tense", "Thrilling", "Urgent", "Critical")));
    }

    static GenreTemplate of(Genre genre) {
        return TEMPLATES.getOrDefault(genre, TEMPLATES.get(Genre.FANTASY));
    }
}
