package com.madisonmentions.backend.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

    /**
     * Shared HTTP client for the provider adapters. A timeout surfaces as a
     * {@link org.springframework.web.client.ResourceAccessException} and is treated as "no data".
     */
    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ResolutionProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getProviderTimeoutSeconds());
        return builder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
