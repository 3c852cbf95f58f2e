package com.storymaker.backend.service;

import com.storymaker.backend.exception.FailureKind;
import com.storymaker.backend.exception.ProviderException;
import com.storymaker.backend.provider.GeneratedContent;
import com.storymaker.backend.provider.GenerationRequest;
import com.storymaker.backend.provider.ProviderDescriptor;
import com.storymaker.backend.provider.ProviderHealthTracker;
import com.storymaker.backend.provider.ProviderRegistry;
import com.storymaker.backend.service.fallback.FallbackGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tries the configured providers of a capability in priority order and returns the first
 * acceptable answer. When every provider fails, or none is configured, the fallback generator
 * answers instead, so {@link #route(GenerationRequest)} always returns content.
 */
@Slf4j
public class GenerationRouter {

    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;
    private final FallbackGenerator fallbackGenerator;
    private final Clock clock;

    public GenerationRouter(ProviderRegistry registry,
                            ProviderHealthTracker healthTracker,
                            FallbackGenerator fallbackGenerator,
                            Clock clock) {
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.fallbackGenerator = fallbackGenerator;
        this.clock = clock;
    }

    public GenerationResult route(GenerationRequest request) {
        Instant started = clock.instant();
        List<ProviderAttempt> attempts = new ArrayList<>();
        List<ProviderDescriptor> providers = registry.getOrdered(request.capability());
        if (providers.isEmpty()) {
            log.info("No configured provider for {}; using fallback", request.capability().getValue());
        }

        for (ProviderDescriptor descriptor : providers) {
            String name = descriptor.name();
            if (!healthTracker.isAvailable(request.capability(), name)) {
                log.debug("Skipping {} for {}: cooling down", name, request.capability().getValue());
                attempts.add(ProviderAttempt.failed(name, FailureKind.UNAVAILABLE, "cooling down after repeated failures",
                        Duration.ZERO));
                continue;
            }
            Duration budget = budgetFor(descriptor, request);
            if (budget.isZero()) {
                attempts.add(ProviderAttempt.failed(name, FailureKind.TIMEOUT, "request deadline reached", Duration.ZERO));
                log.warn("Deadline reached before {} could be tried for {}", name, request.capability().getValue());
                break;
            }
            Optional<String> credential = registry.getCredentialValidator().resolve(name);
            if (credential.isEmpty()) {
                attempts.add(ProviderAttempt.failed(name, FailureKind.CREDENTIAL_INVALID, "credential not usable",
                        Duration.ZERO));
                continue;
            }

            Instant callStarted = clock.instant();
            try {
                log.info("Trying {} for {} (timeout={})", name, request.capability().getValue(), budget);
                GeneratedContent content = descriptor.adapter()
                        .invoke(request, credential.get())
                        .timeout(budget)
                        .block();
                checkQuality(descriptor, request, content);
                Duration elapsed = Duration.between(callStarted, clock.instant());
                healthTracker.recordSuccess(request.capability(), name);
                attempts.add(ProviderAttempt.succeeded(name, elapsed));
                log.info("{} succeeded for {} in {} ms", name, request.capability().getValue(), elapsed.toMillis());
                return new GenerationResult(content, name, Duration.between(started, clock.instant()), attempts);
            } catch (RuntimeException ex) {
                Duration elapsed = Duration.between(callStarted, clock.instant());
                if (Thread.currentThread().isInterrupted() || FailureClassifier.isInterruption(ex)) {
                    Thread.currentThread().interrupt();
                    attempts.add(ProviderAttempt.failed(name, FailureKind.TIMEOUT, "interrupted", elapsed));
                    log.warn("{} call for {} interrupted; using fallback", name, request.capability().getValue());
                    break;
                }
                ProviderException failure = FailureClassifier.classify(ex);
                healthTracker.recordFailure(request.capability(), name);
                attempts.add(ProviderAttempt.failed(name, failure.getKind(), failure.getMessage(), elapsed));
                log.warn("{} failed for {}: {} {}", name, request.capability().getValue(),
                        failure.getKind(), failure.getMessage());
            }
        }

        GeneratedContent content = fallbackGenerator.generate(request);
        Duration elapsed = Duration.between(started, clock.instant());
        if (!attempts.isEmpty()) {
            log.warn("All providers failed for {} after {} attempt(s); using fallback",
                    request.capability().getValue(), attempts.size());
        }
        return new GenerationResult(content, GenerationResult.FALLBACK_PROVIDER, elapsed, attempts);
    }

    private Duration budgetFor(ProviderDescriptor descriptor, GenerationRequest request) {
        Duration remaining = request.remaining(clock.instant());
        if (remaining == null || remaining.compareTo(descriptor.timeout()) > 0) {
            return descriptor.timeout();
        }
        return remaining;
    }

    private static void checkQuality(ProviderDescriptor descriptor, GenerationRequest request, GeneratedContent content) {
        if (content == null || content.isEmpty()) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED, "empty response");
        }
        if (content.length() < descriptor.minAcceptableLength()) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED, "response too short ("
                    + content.length() + " < " + descriptor.minAcceptableLength() + ")");
        }
        if (!request.capability().accepts(request, content)) {
            throw new ProviderException(FailureKind.QUALITY_GATE_FAILED,
                    "response rejected for " + request.capability().getValue());
        }
    }
}
