package com.storymaker.backend.provider;

public final class ApiKeyMasker {

    private ApiKeyMasker() {
    }

    /** Keeps the first and last four characters, e.g. {@code sk-p********wxyz}. */
    public static String mask(String apiKey) {
        if (apiKey == null || apiKey.length() < 8) {
            return "***";
        }
        String start = apiKey.substring(0, 4);
        String end = apiKey.substring(apiKey.length() - 4);
        return start + "*".repeat(Math.min(apiKey.length() - 8, 20)) + end;
    }
}
