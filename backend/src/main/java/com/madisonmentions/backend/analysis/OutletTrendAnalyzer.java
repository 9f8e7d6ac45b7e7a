package com.madisonmentions.backend.analysis;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.analysis.dto.OutletChange;
import com.madisonmentions.backend.analysis.dto.OutletCount;
import com.madisonmentions.backend.config.ResolutionProperties;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Outlet history aggregates and outlet-change detection over a reporter's timeline.
 */
@Component
public class OutletTrendAnalyzer {

    static final int MIN_ARTICLES = 5;
    static final int MIN_PER_BUCKET = 2;
    static final double MIN_DOMINANCE = 0.40;

    private final int recentWindowDays;

    @Autowired
    public OutletTrendAnalyzer(ResolutionProperties properties) {
        this(properties.getRecentWindowDays());
    }

    public OutletTrendAnalyzer(int recentWindowDays) {
        this.recentWindowDays = recentWindowDays;
    }

    /**
     * Compare the plurality outlet of the recent window against the older articles.
     * A change is reported only when the two differ and each holds at least 40% of its
     * own bucket, so fragmented bylines do not produce false positives.
     */
    public OutletChange outletChange(List<CanonicalArticle> articles, LocalDate today) {
        if (articles == null || articles.size() < MIN_ARTICLES) {
            return OutletChange.none();
        }

        LocalDate boundary = today.minusDays(recentWindowDays);
        List<CanonicalArticle> recent = new ArrayList<>();
        List<CanonicalArticle> older = new ArrayList<>();
        for (CanonicalArticle article : articles) {
            if (article.getPublishedDate() == null) {
                continue;
            }
            if (!article.getPublishedDate().isBefore(boundary)) {
                recent.add(article);
            } else {
                older.add(article);
            }
        }

        if (recent.size() < MIN_PER_BUCKET || older.size() < MIN_PER_BUCKET) {
            return OutletChange.none();
        }

        Map<String, Long> recentCounts = countByOutlet(recent);
        Map<String, Long> olderCounts = countByOutlet(older);
        Optional<String> recentPrimary = plurality(recentCounts);
        Optional<String> olderPrimary = plurality(olderCounts);
        if (recentPrimary.isEmpty() || olderPrimary.isEmpty() || recentPrimary.get().equals(olderPrimary.get())) {
            return OutletChange.none();
        }

        double recentShare = (double) recentCounts.get(recentPrimary.get()) / recent.size();
        double olderShare = (double) olderCounts.get(olderPrimary.get()) / older.size();
        if (recentShare >= MIN_DOMINANCE && olderShare >= MIN_DOMINANCE) {
            return OutletChange.detected(olderPrimary.get(), recentPrimary.get());
        }
        return OutletChange.none();
    }

    /**
     * Article counts per outlet, largest first, ties alphabetical.
     */
    public List<OutletCount> outletHistory(List<CanonicalArticle> articles) {
        if (articles == null || articles.isEmpty()) {
            return new ArrayList<>();
        }
        return countByOutlet(articles).entrySet().stream()
                .map(e -> new OutletCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(OutletCount::getCount).reversed()
                        .thenComparing(OutletCount::getOutlet))
                .toList();
    }

    public Optional<String> mostCommonOutlet(List<CanonicalArticle> articles) {
        if (articles == null || articles.isEmpty()) {
            return Optional.empty();
        }
        return plurality(countByOutlet(articles));
    }

    private Map<String, Long> countByOutlet(List<CanonicalArticle> articles) {
        // TreeMap keeps plurality ties deterministic (alphabetical)
        Map<String, Long> counts = new TreeMap<>();
        for (CanonicalArticle article : articles) {
            String outlet = article.getOutlet();
            if (outlet != null && !outlet.isBlank()) {
                counts.merge(outlet, 1L, Long::sum);
            }
        }
        return counts;
    }

    private Optional<String> plurality(Map<String, Long> counts) {
        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }
}
