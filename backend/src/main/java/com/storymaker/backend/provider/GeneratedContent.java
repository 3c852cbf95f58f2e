package com.storymaker.backend.provider;

import com.storymaker.backend.model.PlaceholderImage;

/**
 * Normalized payload produced by a provider adapter or by the fallback generator.
 * Exactly one of text, data or placeholder is set.
 */
public record GeneratedContent(
        String text,
        byte[] data,
        String mimeType,
        PlaceholderImage placeholder
) {

    public static final String TEXT_PLAIN = "text/plain";

    public static GeneratedContent ofText(String text) {
        return new GeneratedContent(text, null, TEXT_PLAIN, null);
    }

    public static GeneratedContent ofBinary(byte[] data, String mimeType) {
        return new GeneratedContent(null, data, mimeType, null);
    }

    public static GeneratedContent ofPlaceholder(PlaceholderImage placeholder) {
        return new GeneratedContent(null, null, "application/vnd.storymaker.placeholder+json", placeholder);
    }

    public boolean isBinary() {
        return data != null;
    }

    public boolean isPlaceholder() {
        return placeholder != null;
    }

    /** Characters for text, bytes for binary content, zero for placeholders. */
    public int length() {
        if (text != null) {
            return text.length();
        }
        if (data != null) {
            return data.length;
        }
        return 0;
    }

    public boolean isEmpty() {
        if (placeholder != null) {
            return false;
        }
        if (text != null) {
            return text.isBlank();
        }
        return data == null || data.length == 0;
    }
}
