package com.storymaker.backend.provider;

import reactor.core.publisher.Mono;

/**
 * Uniform contract every vendor integration satisfies. Implementations only translate the
 * request into the vendor call and normalize the vendor response; failover, timeouts and
 * quality gates belong to the router.
 *
 * <p>The returned {@link Mono} must be lazy and cancellable: disposing the subscription has to
 * abort the outbound HTTP exchange.
 */
@FunctionalInterface
public interface ProviderAdapter {

    /**
     * @param request    the capability call
     * @param credential cleaned and validated credential for this vendor
     * @return the normalized content, or an error signal (ideally a classified
     *         {@link com.storymaker.backend.exception.ProviderException})
     */
    Mono<GeneratedContent> invoke(GenerationRequest request, String credential);
}
