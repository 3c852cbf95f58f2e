package com.storymaker.backend.dto;

import com.storymaker.backend.provider.Capability;

/**
 * @param status    healthy, unhealthy or cooling-down
 * @param maskedKey null when no key is set
 */
public record ProviderStatusDto(
        String name,
        Capability capability,
        int priority,
        boolean configured,
        String status,
        String message,
        String maskedKey
) {
}
