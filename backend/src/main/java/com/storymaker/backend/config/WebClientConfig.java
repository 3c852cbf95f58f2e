package com.storymaker.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shared WebClient setup for vendor calls. Vendor JSON uses its own field names, so the codecs
 * get a plain Jackson mapper rather than the application's snake_case one.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder vendorWebClientBuilder(@Value("${ai.http.max-in-memory-size:16MB}") DataSize maxInMemorySize) {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
                .codecs(configurer -> {
                    configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder());
                    configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder());
                    configurer.defaultCodecs().maxInMemorySize((int) maxInMemorySize.toBytes());
                }).build();

        return WebClient.builder()
                .exchangeStrategies(exchangeStrategies);
    }
}
