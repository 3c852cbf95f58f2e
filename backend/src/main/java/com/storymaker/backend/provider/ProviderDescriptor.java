package com.storymaker.backend.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable registration entry for one provider serving one capability.
 *
 * @param priority            ascending, 1 is tried first
 * @param credentialKey       name of the credential in the {@link CredentialStore}
 * @param validator           vendor specific credential format check
 * @param minAcceptableLength quality gate floor: characters for text, bytes for binary content
 */
public record ProviderDescriptor(
        String name,
        Capability capability,
        int priority,
        String credentialKey,
        CredentialRule validator,
        int minAcceptableLength,
        Duration timeout,
        ProviderAdapter adapter
) {

    public ProviderDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(credentialKey, "credentialKey");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(adapter, "adapter");
        validator = validator == null ? CredentialRules.ANY : validator;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for provider " + name);
        }
    }
}
