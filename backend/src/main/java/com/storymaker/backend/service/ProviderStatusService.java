package com.storymaker.backend.service;

import com.storymaker.backend.dto.ProviderStatusDto;
import com.storymaker.backend.dto.ProvidersResponse;
import com.storymaker.backend.provider.ApiKeyMasker;
import com.storymaker.backend.provider.Capability;
import com.storymaker.backend.provider.CredentialStatus;
import com.storymaker.backend.provider.CredentialValidator;
import com.storymaker.backend.provider.ProviderDescriptor;
import com.storymaker.backend.provider.ProviderHealthTracker;
import com.storymaker.backend.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ProviderStatusService {

    private final ProviderRegistry providerRegistry;
    private final ProviderHealthTracker healthTracker;

    public ProvidersResponse describeProviders() {
        CredentialValidator validator = providerRegistry.getCredentialValidator();
        List<ProviderStatusDto> statuses = new ArrayList<>();
        for (Capability capability : Capability.values()) {
            for (ProviderDescriptor descriptor : providerRegistry.getAll(capability)) {
                CredentialStatus credential = validator.isConfigured(descriptor.name());
                String status;
                String message;
                if (!credential.configured()) {
                    status = "unhealthy";
                    message = credential.reason();
                } else if (!healthTracker.isAvailable(capability, descriptor.name())) {
                    status = "cooling-down";
                    message = healthTracker.consecutiveFailures(capability, descriptor.name()) + " consecutive failures";
                } else {
                    status = "healthy";
                    message = "API key is configured and valid";
                }
                statuses.add(new ProviderStatusDto(
                        descriptor.name(),
                        capability,
                        descriptor.priority(),
                        credential.configured(),
                        status,
                        message,
                        validator.findCleaned(descriptor.name()).map(ApiKeyMasker::mask).orElse(null)));
            }
        }
        int configured = (int) statuses.stream().filter(ProviderStatusDto::configured).count();
        int healthy = (int) statuses.stream().filter(s -> "healthy".equals(s.status())).count();
        return new ProvidersResponse(statuses, new ProvidersResponse.Summary(statuses.size(), configured, healthy));
    }
}
