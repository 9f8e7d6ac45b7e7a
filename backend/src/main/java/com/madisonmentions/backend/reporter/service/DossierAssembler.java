package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.analysis.OutletTrendAnalyzer;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.analysis.dto.OutletChange;
import com.madisonmentions.backend.reporter.dto.DossierArticle;
import com.madisonmentions.backend.reporter.dto.ReporterDossier;
import com.madisonmentions.backend.reporter.dto.SocialLinksDTO;
import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DossierAssembler {

    private final OutletTrendAnalyzer outletTrendAnalyzer;
    private final Clock clock;

    /**
     * Dossier for a stored reporter; {@code articles} must be the complete stored set.
     */
    public ReporterDossier fromStored(Reporter reporter, List<CanonicalArticle> articles, ResolutionTier tier) {
        LocalDate today = LocalDate.now(clock);
        OutletChange change = outletTrendAnalyzer.outletChange(articles, today);

        return ReporterDossier.builder()
                .reporterName(displayName(reporter.getName()))
                .queryDate(today)
                .articles(articles.stream().map(DossierAssembler::toDossierArticle).toList())
                .outletHistory(outletTrendAnalyzer.outletHistory(articles))
                .currentOutlet(reporter.getCurrentOutlet())
                .reporterBio(reporter.getBio())
                .socialLinks(SocialLinksDTO.from(reporter.getSocialLinks()))
                .outletChangeDetected(change.isChanged())
                .outletChangeNote(change.getNote())
                .lastUpdated(reporter.getLastUpdated())
                .proServicesRelevant(toFlag(reporter.getRelevance()))
                .relevanceRationale(reporter.getRelevanceRationale())
                .resolutionTier(tier)
                .build();
    }

    /**
     * Dossier with no coverage, used when nothing could be fetched. Carries the name as requested.
     */
    public ReporterDossier empty(String requestedName, SocialLinksDTO socialLinks, ResolutionTier tier) {
        return ReporterDossier.builder()
                .reporterName(requestedName.trim())
                .queryDate(LocalDate.now(clock))
                .socialLinks(socialLinks)
                .outletChangeDetected(false)
                .resolutionTier(tier)
                .build();
    }

    private static DossierArticle toDossierArticle(CanonicalArticle article) {
        return DossierArticle.builder()
                .headline(article.getHeadline())
                .outlet(article.getOutlet())
                .date(article.getPublishedDate())
                .url(article.getUrl())
                .summary(article.getSummary())
                .topics(article.getTopics() != null ? new ArrayList<>(article.getTopics()) : new ArrayList<>())
                .build();
    }

    private static Boolean toFlag(RelevanceVerdict verdict) {
        if (verdict == null || !verdict.isDecided()) {
            return null;
        }
        return verdict == RelevanceVerdict.RELEVANT;
    }

    /**
     * "jane o'neil-smith" becomes "Jane O'Neil-Smith".
     */
    static String displayName(String canonicalName) {
        StringBuilder result = new StringBuilder(canonicalName.length());
        boolean startOfWord = true;
        for (char c : canonicalName.toCharArray()) {
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }
}
