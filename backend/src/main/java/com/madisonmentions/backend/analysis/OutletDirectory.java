package com.madisonmentions.backend.analysis;

import com.madisonmentions.backend.config.OutletProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps source domains to outlet display names and outlet names to syndication priority.
 */
@Slf4j
@Component
public class OutletDirectory {

    public static final String UNKNOWN_OUTLET = "Unknown";

    private static final Set<String> NOISE_LABELS = Set.of(
            "www", "news", "api", "m", "mobile", "amp", "cdn", "static",
            "en", "es", "fr", "de", "uk", "us"
    );

    private static final Set<String> TLD_LABELS = Set.of(
            "com", "org", "net", "edu", "gov", "co", "uk", "io", "ai",
            "au", "ca", "de", "fr", "jp", "nz", "in"
    );

    private final Map<String, String> domainNames = new HashMap<>();
    private final Map<String, Integer> priorities = new HashMap<>();

    public OutletDirectory(OutletProperties properties) {
        for (OutletProperties.DomainEntry entry : properties.getDomains()) {
            if (entry.getDomain() == null || entry.getName() == null) {
                continue;
            }
            domainNames.put(normalizeDomain(entry.getDomain()), entry.getName());
        }
        for (OutletProperties.PriorityEntry entry : properties.getPriorities()) {
            if (entry.getName() != null) {
                priorities.merge(entry.getName(), entry.getScore(), Math::max);
            }
        }
        log.info("Outlet directory loaded: {} domains, {} ranked outlets", domainNames.size(), priorities.size());
    }

    /**
     * Resolve a source domain to a display name.
     * Exact match first, then the longest known domain the input is a subdomain of,
     * then a name derived from the domain itself.
     */
    public String displayName(String domain) {
        if (domain == null || domain.isBlank()) {
            return UNKNOWN_OUTLET;
        }
        String normalized = normalizeDomain(domain);

        String exact = domainNames.get(normalized);
        if (exact != null) {
            return exact;
        }

        String bestMatch = null;
        for (String known : domainNames.keySet()) {
            if (normalized.endsWith("." + known) && (bestMatch == null || known.length() > bestMatch.length())) {
                bestMatch = known;
            }
        }
        if (bestMatch != null) {
            return domainNames.get(bestMatch);
        }

        return deriveName(domain.trim().replaceFirst("(?i)^https?://", "").replaceAll("/.*", ""));
    }

    /**
     * Syndication priority of an outlet; unranked outlets score 0.
     */
    public int priorityOf(String outlet) {
        if (outlet == null) {
            return 0;
        }
        return priorities.getOrDefault(outlet, 0);
    }

    private String normalizeDomain(String domain) {
        String d = domain.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^https?://", "")
                .replaceAll("/.*", "");
        return d.startsWith("www.") ? d.substring(4) : d;
    }

    private String deriveName(String rawDomain) {
        String[] labels = rawDomain.split("\\.");
        List<String> parts = new ArrayList<>();
        for (String label : labels) {
            if (!label.isEmpty() && !NOISE_LABELS.contains(label.toLowerCase(Locale.ROOT))) {
                parts.add(label);
            }
        }
        if (parts.isEmpty()) {
            parts.addAll(Arrays.asList(labels));
        }
        while (parts.size() > 1 && TLD_LABELS.contains(parts.get(parts.size() - 1).toLowerCase(Locale.ROOT))) {
            parts.remove(parts.size() - 1);
        }
        String base = parts.isEmpty() ? "" : parts.get(0);
        if (base.isBlank()) {
            return UNKNOWN_OUTLET;
        }

        String spaced = base
                .replaceAll("([a-z])([A-Z])", "$1 $2")
                .replace('-', ' ')
                .replace('_', ' ')
                .trim();
        return titleCase(spaced);
    }

    private String titleCase(String text) {
        StringBuilder sb = new StringBuilder();
        for (String word : text.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.length() == 0 ? UNKNOWN_OUTLET : sb.toString();
    }
}
