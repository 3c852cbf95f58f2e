package com.storymaker.backend.provider;

import java.util.Optional;

/**
 * Looks up raw credential values by key (for example {@code OPENAI_API_KEY}).
 */
@FunctionalInterface
public interface CredentialStore {

    Optional<String> find(String credentialKey);
}
