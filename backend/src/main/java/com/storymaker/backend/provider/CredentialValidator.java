package com.storymaker.backend.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Sanitizes and syntactically validates per-provider credentials. Nothing here touches the
 * network: a credential that passes may still be rejected by the vendor at call time.
 */
@Slf4j
public class CredentialValidator {

    private static final Pattern TRAILING_JUNK = Pattern.compile("[\\s\\p{Cntrl}]+$");
    private static final Pattern LEADING_JUNK = Pattern.compile("^[\\s\\p{Cntrl}]+");
    private static final int MIN_LENGTH = 10;

    private static final List<String> PLACEHOLDERS = List.of(
            "your_openai_api_key",
            "your_huggingface_api_key",
            "your_google_ai_api_key",
            "your_google_api_key",
            "your_elevenlabs_api_key",
            "your_stability_api_key",
            "your_ai_api_key",
            "your_api_key",
            "api_key",
            "change-me",
            "replace-me",
            "placeholder",
            "demo"
    );

    private final CredentialStore credentialStore;
    private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    public CredentialValidator(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * Strips the CR/LF and whitespace that env files and copy-paste tend to leave around a key.
     * Never returns null.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String stripped = TRAILING_JUNK.matcher(raw).replaceAll("");
        return LEADING_JUNK.matcher(stripped).replaceAll("");
    }

    /**
     * Declares which credential key and rule a provider uses. A vendor holds one credential for all
     * of its capabilities, so re-binding must name the same key; the rule of the latest call wins.
     *
     * @throws IllegalArgumentException if the provider is already bound to a different key
     */
    public void bind(String providerName, String credentialKey, CredentialRule rule) {
        Binding binding = new Binding(credentialKey, rule == null ? CredentialRules.ANY : rule);
        bindings.merge(normalize(providerName), binding, (existing, requested) -> {
            if (!existing.credentialKey().equals(requested.credentialKey())) {
                throw new IllegalArgumentException("Provider " + providerName + " is bound to "
                        + existing.credentialKey() + ", cannot rebind it to " + requested.credentialKey());
            }
            return requested;
        });
    }

    public boolean validate(Capability capability, String providerName, String cleaned) {
        Optional<String> problem = findProblem(providerName, cleaned);
        problem.ifPresent(reason -> log.debug("Credential for {} ({}) rejected: {}", providerName, capability, reason));
        return problem.isEmpty();
    }

    public CredentialStatus isConfigured(String providerName) {
        Binding binding = bindings.get(normalize(providerName));
        if (binding == null) {
            return CredentialStatus.missing("Unknown provider: " + providerName);
        }
        String cleaned = clean(credentialStore.find(binding.credentialKey()).orElse(null));
        if (cleaned.isEmpty()) {
            return CredentialStatus.missing(binding.credentialKey() + " environment variable not set");
        }
        return findProblem(providerName, cleaned)
                .map(CredentialStatus::missing)
                .orElseGet(CredentialStatus::ok);
    }

    /** The cleaned credential, present only when {@link #isConfigured(String)} holds. */
    public Optional<String> resolve(String providerName) {
        Binding binding = bindings.get(normalize(providerName));
        if (binding == null) {
            return Optional.empty();
        }
        String cleaned = clean(credentialStore.find(binding.credentialKey()).orElse(null));
        if (cleaned.isEmpty() || findProblem(providerName, cleaned).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    /** The cleaned credential whether or not it is valid, for masked status output. */
    public Optional<String> findCleaned(String providerName) {
        Binding binding = bindings.get(normalize(providerName));
        if (binding == null) {
            return Optional.empty();
        }
        String cleaned = clean(credentialStore.find(binding.credentialKey()).orElse(null));
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }

    private Optional<String> findProblem(String providerName, String cleaned) {
        if (cleaned == null || cleaned.isEmpty()) {
            return Optional.of("API key is required");
        }
        String lowerKey = cleaned.toLowerCase(Locale.ROOT);
        if (PLACEHOLDERS.stream().anyMatch(lowerKey::contains)) {
            return Optional.of("API key appears to be a placeholder value");
        }
        if (cleaned.length() < MIN_LENGTH) {
            return Optional.of("API key is too short to be valid");
        }
        Binding binding = bindings.get(normalize(providerName));
        if (binding != null && !binding.rule().matches(cleaned)) {
            return Optional.of("API key format doesn't match expected pattern for " + providerName);
        }
        return Optional.empty();
    }

    private static String normalize(String providerName) {
        return providerName == null ? "" : providerName.trim().toLowerCase(Locale.ROOT);
    }

    private record Binding(String credentialKey, CredentialRule rule) {}
}
