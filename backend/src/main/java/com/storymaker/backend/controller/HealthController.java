package com.storymaker.backend.controller;

import com.storymaker.backend.dto.ProvidersResponse;
import com.storymaker.backend.service.ProviderStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ProviderStatusService providerStatusService;

    @GetMapping("/api/health")
    public Map<String, String> backendHealth() {
        return Collections.singletonMap("status", "ok");
    }

    /** The service stays usable without any provider, so this only reports, never fails. */
    @GetMapping("/api/health/ai")
    public Map<String, Object> aiHealthCheck() {
        ProvidersResponse providers = providerStatusService.describeProviders();
        Map<String, Object> status = new HashMap<>();
        status.put("backendStatus", "ok");
        status.put("healthy", true);
        status.put("configuredProviders", providers.summary().configuredProviders());
        status.put("fallbackOnly", providers.summary().configuredProviders() == 0);
        return status;
    }
}
