package com.storymaker.backend.service.scene;

import com.storymaker.backend.model.ImageStyle;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives an illustration brief from scene text: the leading sentence plus hints for the
 * location, the presence of a young hero and magical elements.
 */
@Component
public class SceneDescriptionBuilder {

    private static final int MAX_LEADING_LENGTH = 100;

    private static final Map<String, String> LOCATION_HINTS = new LinkedHashMap<>();

    static {
        LOCATION_HINTS.put("forest", "in a mystical forest");
        LOCATION_HINTS.put("castle", "at a grand castle");
        LOCATION_HINTS.put("village", "in a charming village");
        LOCATION_HINTS.put("mountain", "in mountainous terrain");
        LOCATION_HINTS.put("ocean", "by the vast ocean");
        LOCATION_HINTS.put("garden", "in a magical garden");
        LOCATION_HINTS.put("library", "in an ancient library");
    }

    private static final List<String> CHARACTER_WORDS = List.of("young", "child", "boy", "girl");
    private static final List<String> MAGIC_WORDS = List.of("magic", "spell", "enchanted");

    public String describe(String content) {
        String text = content == null ? "" : content.trim();
        String leading = text.split("[.!?]+")[0].trim();
        if (leading.isEmpty()) {
            leading = text.length() > MAX_LEADING_LENGTH ? text.substring(0, MAX_LEADING_LENGTH) : text;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder description = new StringBuilder(leading);
        LOCATION_HINTS.entrySet().stream()
                .filter(entry -> lower.contains(entry.getKey()))
                .findFirst()
                .ifPresent(entry -> description.append(' ').append(entry.getValue()));
        if (CHARACTER_WORDS.stream().anyMatch(lower::contains)) {
            description.append(", featuring a young protagonist");
        }
        if (MAGIC_WORDS.stream().anyMatch(lower::contains)) {
            description.append(", with magical elements");
        }
        return description.toString();
    }

    public String imagePrompt(String description, ImageStyle style) {
        ImageStyle resolved = style == null ? ImageStyle.CHILDREN_BOOK : style;
        return description + ", " + resolved.getPromptFragment() + ", suitable for children";
    }
}
