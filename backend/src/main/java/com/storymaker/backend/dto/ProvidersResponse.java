package com.storymaker.backend.dto;

import java.util.List;

public record ProvidersResponse(List<ProviderStatusDto> providers, Summary summary) {

    public record Summary(int totalProviders, int configuredProviders, int healthyProviders) {
    }
}
