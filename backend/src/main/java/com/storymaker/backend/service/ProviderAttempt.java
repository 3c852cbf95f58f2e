package com.storymaker.backend.service;

import com.storymaker.backend.exception.FailureKind;

import java.time.Duration;

/**
 * Outcome of trying one provider. {@code failure} is null for the attempt that succeeded.
 */
public record ProviderAttempt(String provider, FailureKind failure, String message, Duration elapsed) {

    public static ProviderAttempt succeeded(String provider, Duration elapsed) {
        return new ProviderAttempt(provider, null, null, elapsed);
    }

    public static ProviderAttempt failed(String provider, FailureKind failure, String message, Duration elapsed) {
        return new ProviderAttempt(provider, failure, message, elapsed);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String describe() {
        if (isSuccess()) {
            return provider + ": ok";
        }
        return message == null || message.isBlank()
                ? provider + ": " + failure
                : provider + ": " + failure + " (" + message + ")";
    }
}
