package com.storymaker.backend.provider;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consecutive failure counter per provider and capability. A provider that fails {@code threshold}
 * times in a row for one capability is skipped for that capability until the cooldown elapses;
 * any success resets it. Its other capabilities are unaffected.
 */
@Slf4j
public class ProviderHealthTracker {

    private final int threshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<Key, Health> health = new ConcurrentHashMap<>();

    public ProviderHealthTracker(int threshold, Duration cooldown, Clock clock) {
        this.threshold = Math.max(1, threshold);
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public boolean isAvailable(Capability capability, String providerName) {
        Health entry = health.get(new Key(capability, providerName));
        if (entry == null) {
            return true;
        }
        Instant until = entry.openUntil.get();
        return until == null || !clock.instant().isBefore(until);
    }

    public void recordSuccess(Capability capability, String providerName) {
        Health entry = health.get(new Key(capability, providerName));
        if (entry != null) {
            entry.consecutiveFailures.set(0);
            entry.openUntil.set(null);
        }
    }

    public void recordFailure(Capability capability, String providerName) {
        Health entry = health.computeIfAbsent(new Key(capability, providerName), key -> new Health());
        int failures = entry.consecutiveFailures.incrementAndGet();
        if (failures >= threshold) {
            Instant until = clock.instant().plus(cooldown);
            entry.openUntil.set(until);
            log.warn("Provider {} failed {} times in a row for {}; skipping it until {}",
                    providerName, failures, capability.getValue(), until);
        }
    }

    public int consecutiveFailures(Capability capability, String providerName) {
        Health entry = health.get(new Key(capability, providerName));
        return entry == null ? 0 : entry.consecutiveFailures.get();
    }

    private record Key(Capability capability, String providerName) {
    }

    private static final class Health {
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicReference<Instant> openUntil = new AtomicReference<>();
    }
}
