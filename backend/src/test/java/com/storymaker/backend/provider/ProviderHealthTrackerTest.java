package com.storymaker.backend.provider;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthTrackerTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
    private final Clock clock = new Clock() {
        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    };

    private final ProviderHealthTracker tracker = new ProviderHealthTracker(5, Duration.ofMinutes(5), clock);

    @Test
    void opensAfterThresholdAndClosesAfterCooldown() {
        for (int i = 0; i < 4; i++) {
            tracker.recordFailure(Capability.TEXT_GENERATION, "openai");
        }
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isTrue();

        tracker.recordFailure(Capability.TEXT_GENERATION, "openai");
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isFalse();

        now.set(now.get().plus(Duration.ofMinutes(5)));
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isTrue();
    }

    @Test
    void successResetsTheCounter() {
        for (int i = 0; i < 4; i++) {
            tracker.recordFailure(Capability.TEXT_GENERATION, "openai");
        }
        tracker.recordSuccess(Capability.TEXT_GENERATION, "openai");
        tracker.recordFailure(Capability.TEXT_GENERATION, "openai");

        assertThat(tracker.consecutiveFailures(Capability.TEXT_GENERATION, "openai")).isEqualTo(1);
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isTrue();
    }

    @Test
    void providersAreTrackedIndependently() {
        for (int i = 0; i < 5; i++) {
            tracker.recordFailure(Capability.IMAGE_GENERATION, "stability");
        }
        assertThat(tracker.isAvailable(Capability.IMAGE_GENERATION, "stability")).isFalse();
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isTrue();
    }

    @Test
    void capabilitiesOfOneProviderAreTrackedIndependently() {
        for (int i = 0; i < 5; i++) {
            tracker.recordFailure(Capability.IMAGE_GENERATION, "openai");
        }
        assertThat(tracker.isAvailable(Capability.IMAGE_GENERATION, "openai")).isFalse();
        assertThat(tracker.isAvailable(Capability.TEXT_GENERATION, "openai")).isTrue();
        assertThat(tracker.isAvailable(Capability.AUDIO_NARRATION, "openai")).isTrue();
        assertThat(tracker.consecutiveFailures(Capability.TEXT_GENERATION, "openai")).isZero();
    }
}
