package com.storymaker.backend.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialValidatorTest {

    private static final String OPENAI_KEY = "sk-proj-abcdefghijklmnopqrstuvwx1234";

    private final Map<String, String> env = new HashMap<>();
    private CredentialValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CredentialValidator(key -> Optional.ofNullable(env.get(key)));
        validator.bind("openai", "OPENAI_API_KEY", CredentialRules.OPENAI_RULE);
    }

    @Test
    @DisplayName("clean strips trailing CR/LF and is idempotent")
    void cleanStripsLineEndings() {
        assertThat(CredentialValidator.clean("sk-abc123\r\n")).isEqualTo("sk-abc123");
        assertThat(CredentialValidator.clean("  hf_token \t\n")).isEqualTo("hf_token");
        assertThat(CredentialValidator.clean(null)).isEmpty();

        String once = CredentialValidator.clean(" sk-abc123\r\n\r\n");
        assertThat(CredentialValidator.clean(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("a key with a trailing newline from an env file is still configured")
    void configuredAfterCleaning() {
        env.put("OPENAI_API_KEY", OPENAI_KEY + "\r\n");

        assertThat(validator.isConfigured("openai").configured()).isTrue();
        assertThat(validator.resolve("openai")).contains(OPENAI_KEY);
    }

    @Test
    void missingKeyNamesTheEnvironmentVariable() {
        CredentialStatus status = validator.isConfigured("openai");

        assertThat(status.configured()).isFalse();
        assertThat(status.reason()).isEqualTo("OPENAI_API_KEY environment variable not set");
    }

    @Test
    void unknownProvider() {
        assertThat(validator.isConfigured("acme").reason()).isEqualTo("Unknown provider: acme");
        assertThat(validator.resolve("acme")).isEmpty();
    }

    @Test
    @DisplayName("placeholder, short and malformed keys are rejected with a reason")
    void rejectsBadKeys() {
        env.put("OPENAI_API_KEY", "your_openai_api_key_here");
        assertThat(validator.isConfigured("openai").reason()).contains("placeholder");

        env.put("OPENAI_API_KEY", "sk-123");
        assertThat(validator.isConfigured("openai").reason()).contains("too short");

        env.put("OPENAI_API_KEY", "pk-abcdefghijklmnopqrstuvwxyz");
        assertThat(validator.isConfigured("openai").reason())
                .isEqualTo("API key format doesn't match expected pattern for openai");
        assertThat(validator.resolve("openai")).isEmpty();
    }

    @Test
    void validateIsPureAndPerProvider() {
        validator.bind("huggingface", "HUGGINGFACE_API_KEY", CredentialRules.HUGGINGFACE_RULE);

        assertThat(validator.validate(Capability.TEXT_GENERATION, "openai", OPENAI_KEY)).isTrue();
        assertThat(validator.validate(Capability.TEXT_GENERATION, "huggingface", OPENAI_KEY)).isFalse();
        assertThat(validator.validate(Capability.TEXT_GENERATION, "huggingface",
                "hf_" + "a1".repeat(17))).isTrue();
    }

    @Test
    @DisplayName("a vendor keeps one credential across capabilities")
    void rebindingToAnotherKeyIsRejected() {
        env.put("OPENAI_API_KEY", OPENAI_KEY);
        validator.bind("openai", "OPENAI_API_KEY", CredentialRules.OPENAI_RULE);

        assertThatThrownBy(() -> validator.bind("openai", "OTHER_KEY", CredentialRules.ANY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("OPENAI_API_KEY");
        assertThat(validator.resolve("openai")).contains(OPENAI_KEY);
    }

    @Test
    void maskKeepsOnlyTheEnds() {
        assertThat(ApiKeyMasker.mask("short")).isEqualTo("***");
        assertThat(ApiKeyMasker.mask("sk-abcdefgh1234")).startsWith("sk-a").endsWith("1234").contains("*");
        assertThat(ApiKeyMasker.mask(OPENAI_KEY)).doesNotContain("efghijkl");
    }
}
