package com.madisonmentions.backend.analysis;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Collapses syndicated copies of the same story into one representative.
 * <p>
 * Articles are grouped by a normalized headline key. Each group keeps the copy from the
 * highest-priority outlet, then the most recent one, then the smallest URL, so the result
 * does not depend on input order. Output is newest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyndicationDeduplicator {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_TAG = Pattern.compile("^(live updates?|breaking|update)\\s*:?\\s*");

    private static final Comparator<CanonicalArticle> NEWEST_FIRST = Comparator
            .comparing(CanonicalArticle::getPublishedDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CanonicalArticle::getUrl, Comparator.nullsLast(Comparator.naturalOrder()));

    private final OutletDirectory outletDirectory;

    public List<CanonicalArticle> dedupBySyndication(List<CanonicalArticle> articles) {
        if (articles == null || articles.isEmpty()) {
            return new ArrayList<>();
        }

        Comparator<CanonicalArticle> preferred = Comparator
                .comparingInt((CanonicalArticle a) -> outletDirectory.priorityOf(a.getOutlet()))
                .reversed()
                .thenComparing(NEWEST_FIRST);

        Map<String, CanonicalArticle> representatives = new HashMap<>();
        for (CanonicalArticle article : articles) {
            String key = headlineKey(article.getHeadline());
            if (key.isEmpty()) {
                continue;
            }
            representatives.merge(key, article,
                    (current, candidate) -> preferred.compare(candidate, current) < 0 ? candidate : current);
        }

        List<CanonicalArticle> unique = new ArrayList<>(representatives.values());
        unique.sort(NEWEST_FIRST);

        if (unique.size() < articles.size()) {
            log.debug("Syndication dedup collapsed {} articles into {}", articles.size(), unique.size());
        }
        return unique;
    }

    /**
     * Lower-case, strip punctuation, collapse whitespace and drop a leading
     * "breaking" / "live update(s)" / "update" tag.
     */
    public static String headlineKey(String headline) {
        if (headline == null) {
            return "";
        }
        String key = headline.toLowerCase(Locale.ROOT);
        key = PUNCTUATION.matcher(key).replaceAll("");
        key = WHITESPACE.matcher(key).replaceAll(" ").trim();
        key = LEADING_TAG.matcher(key).replaceFirst("");
        return key.trim();
    }
}
