package com.madisonmentions.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Outlet display names and syndication priorities loaded from {@code outlets.yml}.
 * <p>
 * Kept as data so new outlets can be added without code changes. Domains that are
 * not listed are named by the fallback transformation in
 * {@link com.madisonmentions.backend.analysis.OutletDirectory}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "outlets")
public class OutletProperties {

    private List<DomainEntry> domains = new ArrayList<>();

    // Higher score wins when syndicated copies of one headline are collapsed
    private List<PriorityEntry> priorities = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DomainEntry {
        private String domain;
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriorityEntry {
        private String name;
        private int score;
    }
}
