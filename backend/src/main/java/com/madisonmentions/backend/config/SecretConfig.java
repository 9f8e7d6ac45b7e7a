package com.madisonmentions.backend.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream credentials. The Perigon key is mandatory so a missing key stops the
 * application at startup instead of failing every request.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "secret")
public class SecretConfig {
    @NotBlank(message = "secret.perigon-api-key must be set (PERIGON_API_KEY)")
    private String perigonApiKey;

    // Optional: the NewsAPI.ai provider is only registered when this is present
    private String newsapiApiKey;

    public boolean hasNewsapiKey() {
        return newsapiApiKey != null && !newsapiApiKey.isBlank();
    }
}
