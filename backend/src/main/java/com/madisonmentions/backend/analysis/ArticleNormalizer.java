package com.madisonmentions.backend.analysis;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.provider.RawArticle;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * Turns provider items into {@link CanonicalArticle}s. Items without a URL, a title or a
 * parseable publication date are dropped; malformed upstream data is expected at volume.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArticleNormalizer {

    static final int MAX_TOPICS = 5;

    // ISO_DATE_TIME covers both offset ("2026-01-03T07:02:07+00:00", "...Z") and local timestamps
    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            DateTimeFormatter.ISO_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private final OutletDirectory outletDirectory;

    public List<CanonicalArticle> normalize(List<RawArticle> rawArticles) {
        if (rawArticles == null || rawArticles.isEmpty()) {
            return new ArrayList<>();
        }

        List<CanonicalArticle> articles = new ArrayList<>();
        int dropped = 0;
        for (RawArticle raw : rawArticles) {
            CanonicalArticle article = normalizeOne(raw);
            if (article == null) {
                dropped++;
            } else {
                articles.add(article);
            }
        }

        if (dropped > 0) {
            log.debug("Dropped {} of {} provider items during normalization", dropped, rawArticles.size());
        }
        return articles;
    }

    CanonicalArticle normalizeOne(RawArticle raw) {
        if (raw == null) {
            return null;
        }
        String url = raw.getUrl() != null ? raw.getUrl().trim() : "";
        String headline = cleanHeadline(raw.getTitle());
        if (url.isEmpty() || headline.isEmpty()) {
            return null;
        }

        LocalDate date = parseDate(raw.getPublishedAt());
        if (date == null) {
            return null;
        }

        return CanonicalArticle.builder()
                .headline(headline)
                .outlet(outletDirectory.displayName(raw.getSourceDomain()))
                .publishedDate(date)
                .url(url)
                .topics(cleanTopics(raw.getTopics()))
                .build();
    }

    /**
     * Parse the date part of a provider timestamp; returns null when no format matches.
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        DateTimeParseException lastError = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return formatter.parse(text, LocalDate::from);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("Unparseable publication date '{}': {}", text, lastError != null ? lastError.getMessage() : "");
        return null;
    }

    private String cleanHeadline(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        // Providers occasionally ship markup or HTML entities in titles
        return Jsoup.parse(title).text().replaceAll("\\s+", " ").trim();
    }

    private List<String> cleanTopics(List<String> topics) {
        if (topics == null || topics.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String topic : topics) {
            if (topic != null && !topic.isBlank()) {
                unique.add(topic.trim());
            }
            if (unique.size() >= MAX_TOPICS) {
                break;
            }
        }
        return new ArrayList<>(unique);
    }
}
