package com.madisonmentions.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.resolution")
@Data
public class ResolutionProperties {

    // Stored reporter records younger than this are served without upstream calls
    private int freshnessDays = 7;

    // Cold-start look-back when no lower bound is known
    private int historyWindowDays = 365;

    // Uncached articles sent to the model per resolution; the rest use their headline
    private int maxSummaries = 20;

    private int queryCacheTtlHours = 24;
    private int providerTimeoutSeconds = 30;

    // Boundary between "recent" and "older" buckets for outlet-change detection
    private int recentWindowDays = 180;
}
