package com.storymaker.backend.provider.adapter;

import java.util.Locale;

/**
 * "WIDTHxHEIGHT" as accepted on image requests.
 */
record ImageSize(int width, int height) {

    static final ImageSize DEFAULT = new ImageSize(1024, 1024);

    static ImageSize parse(String raw) {
        if (raw == null) {
            return DEFAULT;
        }
        String[] parts = raw.trim().toLowerCase(Locale.ROOT).split("x");
        if (parts.length != 2) {
            return DEFAULT;
        }
        try {
            return new ImageSize(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException ex) {
            return DEFAULT;
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
