package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.config.ResolutionProperties;
import com.madisonmentions.backend.reporter.entity.Article;
import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import com.madisonmentions.backend.reporter.entity.SocialLinks;
import com.madisonmentions.backend.reporter.repository.ArticleRepository;
import com.madisonmentions.backend.reporter.repository.ReporterRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reporter and article persistence with the merge rules resolution relies on:
 * reporters are upserted with non-null values winning, article inserts ignore known URLs,
 * and the relevance verdict is written at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReporterStore {

    private final ReporterRepository reporterRepository;
    private final ArticleRepository articleRepository;
    private final ResolutionProperties resolutionProperties;
    private final Clock clock;

    public static String canonicalName(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    @Transactional(readOnly = true)
    public Optional<Reporter> find(String name) {
        return reporterRepository.findByName(canonicalName(name));
    }

    @Transactional(readOnly = true)
    public Optional<Reporter> findById(Long id) {
        return reporterRepository.findById(id);
    }

    public boolean isFresh(Reporter reporter) {
        if (reporter.getLastUpdated() == null) {
            return false;
        }
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(resolutionProperties.getFreshnessDays());
        return reporter.getLastUpdated().isAfter(threshold);
    }

    /**
     * Stored articles, newest first.
     */
    @Transactional(readOnly = true)
    public List<CanonicalArticle> articles(Long reporterId) {
        return articleRepository.findByReporterIdOrderByPublishedDateDescUrlAsc(reporterId).stream()
                .map(ReporterStore::toCanonical)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countArticles(Long reporterId) {
        return articleRepository.countByReporterId(reporterId);
    }

    @Transactional(readOnly = true)
    public Optional<LocalDate> latestArticleDate(Long reporterId) {
        return Optional.ofNullable(articleRepository.findLatestPublishedDate(reporterId));
    }

    /**
     * Creates the reporter or merges into the existing record: every non-null incoming
     * value replaces the stored one, null values leave it alone. {@code touch} stamps
     * {@code lastUpdated}.
     */
    public Reporter upsert(Reporter incoming, boolean touch) {
        String name = canonicalName(incoming.getName());
        Optional<Reporter> existing = reporterRepository.findByName(name);

        Reporter target;
        if (existing.isPresent()) {
            target = existing.get();
            merge(target, incoming);
        } else {
            target = Reporter.builder()
                    .name(name)
                    .externalId(incoming.getExternalId())
                    .externalSource(incoming.getExternalSource())
                    .currentOutlet(incoming.getCurrentOutlet())
                    .bio(incoming.getBio())
                    .socialLinks(incoming.getSocialLinks())
                    .source(incoming.getSource())
                    .build();
        }
        if (touch) {
            target.setLastUpdated(LocalDateTime.now(clock));
        }

        try {
            return reporterRepository.saveAndFlush(target);
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race on the unique name; merge into the winner instead
            log.debug("Concurrent insert for reporter '{}', merging", name);
            Reporter winner = reporterRepository.findByName(name).orElseThrow(() -> e);
            merge(winner, incoming);
            if (touch) {
                winner.setLastUpdated(LocalDateTime.now(clock));
            }
            return reporterRepository.saveAndFlush(winner);
        }
    }

    /**
     * The articles whose URL is not stored yet, in input order.
     */
    @Transactional(readOnly = true)
    public List<CanonicalArticle> unstored(List<CanonicalArticle> articles) {
        if (articles.isEmpty()) {
            return articles;
        }
        Set<String> stored = new HashSet<>(articleRepository.findExistingUrls(
                articles.stream().map(CanonicalArticle::getUrl).toList()));
        return articles.stream().filter(a -> !stored.contains(a.getUrl())).toList();
    }

    /**
     * Inserts articles whose URL is not stored yet. Returns the number inserted.
     */
    public int insertArticles(Long reporterId, List<CanonicalArticle> articles) {
        if (articles.isEmpty()) {
            return 0;
        }
        List<String> urls = articles.stream().map(CanonicalArticle::getUrl).toList();
        Set<String> seen = new HashSet<>(articleRepository.findExistingUrls(urls));
        Reporter reporter = reporterRepository.findById(reporterId)
                .orElseThrow(() -> new IllegalStateException("Reporter " + reporterId + " not found"));

        int inserted = 0;
        List<Article> batch = new ArrayList<>();
        for (CanonicalArticle article : articles) {
            if (!seen.add(article.getUrl())) {
                log.debug("Skipping already stored URL {}", article.getUrl());
                continue;
            }
            batch.add(Article.builder()
                    .reporter(reporter)
                    .headline(article.getHeadline())
                    .outlet(article.getOutlet())
                    .publishedDate(article.getPublishedDate())
                    .url(article.getUrl())
                    .summary(article.getSummary())
                    .topics(new ArrayList<>(article.getTopics()))
                    .build());
        }

        for (Article entity : batch) {
            try {
                articleRepository.saveAndFlush(entity);
                inserted++;
            } catch (DataIntegrityViolationException e) {
                log.debug("URL {} was stored concurrently, ignoring", entity.getUrl());
            }
        }
        log.info("Stored {} new articles for reporter {} ({} already known)", inserted, reporterId,
                articles.size() - inserted);
        return inserted;
    }

    /**
     * Writes regenerated profile fields and marks the record fresh.
     */
    @Transactional
    public void updateProfile(Long reporterId, String currentOutlet, String bio) {
        int changed = reporterRepository.updateProfile(reporterId, currentOutlet, bio, LocalDateTime.now(clock));
        if (changed == 0) {
            throw new IllegalStateException("Reporter " + reporterId + " not found");
        }
    }

    /**
     * Records the verdict unless one is already stored. Returns whether this call wrote it.
     */
    @Transactional
    public boolean updateRelevance(Long reporterId, RelevanceVerdict verdict, String rationale) {
        if (!verdict.isDecided()) {
            throw new IllegalArgumentException("Cannot store an UNKNOWN verdict");
        }
        boolean written = reporterRepository.updateRelevanceIfUnknown(reporterId, verdict, rationale) > 0;
        if (!written) {
            log.debug("Relevance for reporter {} already decided, keeping stored verdict", reporterId);
        }
        return written;
    }

    private static void merge(Reporter target, Reporter incoming) {
        if (incoming.getExternalId() != null) {
            target.setExternalId(incoming.getExternalId());
        }
        if (incoming.getExternalSource() != null) {
            target.setExternalSource(incoming.getExternalSource());
        }
        if (incoming.getCurrentOutlet() != null) {
            target.setCurrentOutlet(incoming.getCurrentOutlet());
        }
        if (incoming.getBio() != null) {
            target.setBio(incoming.getBio());
        }
        if (incoming.getSource() != null) {
            target.setSource(incoming.getSource());
        }
        target.setSocialLinks(mergeLinks(target.getSocialLinks(), incoming.getSocialLinks()));
    }

    private static SocialLinks mergeLinks(SocialLinks stored, SocialLinks incoming) {
        if (incoming == null) {
            return stored;
        }
        if (stored == null) {
            return incoming;
        }
        return SocialLinks.builder()
                .twitterHandle(incoming.getTwitterHandle() != null ? incoming.getTwitterHandle() : stored.getTwitterHandle())
                .twitterUrl(incoming.getTwitterUrl() != null ? incoming.getTwitterUrl() : stored.getTwitterUrl())
                .linkedinUrl(incoming.getLinkedinUrl() != null ? incoming.getLinkedinUrl() : stored.getLinkedinUrl())
                .websiteUrl(incoming.getWebsiteUrl() != null ? incoming.getWebsiteUrl() : stored.getWebsiteUrl())
                .title(incoming.getTitle() != null ? incoming.getTitle() : stored.getTitle())
                .build();
    }

    static CanonicalArticle toCanonical(Article article) {
        return CanonicalArticle.builder()
                .headline(article.getHeadline())
                .outlet(article.getOutlet())
                .publishedDate(article.getPublishedDate())
                .url(article.getUrl())
                .summary(article.getSummary())
                .topics(article.getTopics() != null ? new ArrayList<>(article.getTopics()) : new ArrayList<>())
                .build();
    }
}
