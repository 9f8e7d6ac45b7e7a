package com.madisonmentions.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Base URLs and lookup order of the article-metadata providers.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.providers")
public class ProvidersProperties {
    private String perigonBaseUrl = "https://api.goperigon.com/v1";
    private String newsapiBaseUrl = "https://eventregistry.org/api/v1";

    // Identity resolution tries providers in this order
    private List<String> order = new ArrayList<>(List.of("perigon", "newsapi"));

    // Page size for a single article fetch
    private int pageSize = 100;
}
