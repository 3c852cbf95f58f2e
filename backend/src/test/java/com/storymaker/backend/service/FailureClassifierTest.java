package com.storymaker.backend.service;

import com.storymaker.backend.exception.FailureKind;
import com.storymaker.backend.exception.ProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void mapsHttpStatuses() {
        assertThat(kindOf(401, "")).isEqualTo(FailureKind.AUTH_EXPIRED);
        assertThat(kindOf(403, "")).isEqualTo(FailureKind.CREDENTIAL_INVALID);
        assertThat(kindOf(402, "")).isEqualTo(FailureKind.QUOTA_EXCEEDED);
        assertThat(kindOf(429, "{\"error\":\"You exceeded your current quota\"}")).isEqualTo(FailureKind.QUOTA_EXCEEDED);
        assertThat(kindOf(429, "")).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(kindOf(503, "")).isEqualTo(FailureKind.UNAVAILABLE);
    }

    @Test
    void mapsTimeoutsAndPassesProviderExceptionsThrough() {
        assertThat(FailureClassifier.classify(new TimeoutException()).getKind()).isEqualTo(FailureKind.TIMEOUT);

        ProviderException original = new ProviderException(FailureKind.QUALITY_GATE_FAILED, "empty");
        assertThat(FailureClassifier.classify(original)).isSameAs(original);
    }

    private static FailureKind kindOf(int status, String body) {
        return FailureClassifier.classify(WebClientResponseException.create(status, "status", HttpHeaders.EMPTY,
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8)).getKind();
    }
}
