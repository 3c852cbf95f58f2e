package com.storymaker.backend.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per capability set of providers. Written at startup, read concurrently afterwards.
 */
@Slf4j
public class ProviderRegistry {

    private static final Comparator<ProviderDescriptor> BY_PRIORITY =
            Comparator.comparingInt(ProviderDescriptor::priority).thenComparing(ProviderDescriptor::name);

    private final CredentialValidator credentialValidator;
    private final Map<Capability, Map<String, ProviderDescriptor>> providers = new EnumMap<>(Capability.class);

    public ProviderRegistry(CredentialValidator credentialValidator) {
        this.credentialValidator = credentialValidator;
        for (Capability capability : Capability.values()) {
            providers.put(capability, new ConcurrentHashMap<>());
        }
    }

    /** Upsert keyed by (capability, name). */
    public void register(Capability capability, ProviderDescriptor descriptor) {
        if (descriptor.capability() != capability) {
            throw new IllegalArgumentException("Provider " + descriptor.name() + " is declared for "
                    + descriptor.capability() + ", not " + capability);
        }
        credentialValidator.bind(descriptor.name(), descriptor.credentialKey(), descriptor.validator());
        ProviderDescriptor previous = providers.get(capability).put(descriptor.name(), descriptor);
        if (previous == null) {
            log.info("Registered provider {} for {} (priority={}, timeout={})",
                    descriptor.name(), capability.getValue(), descriptor.priority(), descriptor.timeout());
        }
    }

    public void register(ProviderDescriptor descriptor) {
        register(descriptor.capability(), descriptor);
    }

    /**
     * Usable providers in failover order. An empty list is a normal answer and sends the
     * caller straight to the fallback generator.
     */
    public List<ProviderDescriptor> getOrdered(Capability capability) {
        return providers.get(capability).values().stream()
                .filter(descriptor -> credentialValidator.isConfigured(descriptor.name()).configured())
                .sorted(BY_PRIORITY)
                .toList();
    }

    /** Every registered provider regardless of credentials, for status reporting. */
    public List<ProviderDescriptor> getAll(Capability capability) {
        return providers.get(capability).values().stream()
                .sorted(BY_PRIORITY)
                .toList();
    }

    public CredentialValidator getCredentialValidator() {
        return credentialValidator;
    }
}
