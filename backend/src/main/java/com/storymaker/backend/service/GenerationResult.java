package com.storymaker.backend.service;

import com.storymaker.backend.provider.GeneratedContent;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What the router hands back for every request: the content, who produced it and the trail of
 * attempts that led there.
 */
public record GenerationResult(
        GeneratedContent content,
        String provider,
        Duration elapsed,
        List<ProviderAttempt> attempts
) {

    public static final String FALLBACK_PROVIDER = "fallback";

    public GenerationResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public boolean isFallback() {
        return FALLBACK_PROVIDER.equals(provider);
    }

    public List<ProviderAttempt> failures() {
        return attempts.stream().filter(attempt -> !attempt.isSuccess()).toList();
    }

    /** Human readable summary of failed attempts, or "no provider configured" when none was tried. */
    public String describeFailures() {
        List<ProviderAttempt> failed = failures();
        if (failed.isEmpty()) {
            return "no provider configured";
        }
        return failed.stream().map(ProviderAttempt::describe).collect(Collectors.joining("; "));
    }
}
