package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.ai.service.ProfileService;
import com.madisonmentions.backend.ai.service.SummarizationService;
import com.madisonmentions.backend.analysis.ArticleNormalizer;
import com.madisonmentions.backend.analysis.SyndicationDeduplicator;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.common.InvalidInputException;
import com.madisonmentions.backend.provider.ArticleProvider;
import com.madisonmentions.backend.provider.IdentityLookup;
import com.madisonmentions.backend.provider.ProviderIdentity;
import com.madisonmentions.backend.provider.ProviderRateLimitedException;
import com.madisonmentions.backend.provider.ProviderRegistry;
import com.madisonmentions.backend.provider.RawArticle;
import com.madisonmentions.backend.provider.SocialProfile;
import com.madisonmentions.backend.reporter.dto.ReporterDossier;
import com.madisonmentions.backend.reporter.dto.SocialLinksDTO;
import com.madisonmentions.backend.reporter.entity.Reporter;
import com.madisonmentions.backend.reporter.entity.ReporterSource;
import com.madisonmentions.backend.reporter.entity.SocialLinks;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cache-first dossier resolution.
 * <p>
 * A stored, fresh reporter with coverage is served without upstream calls. A stale or forced
 * reporter with a known identity is topped up with articles newer than the latest stored one
 * and gets its profile regenerated from the full stored history. Anything else resolves the
 * identity and fetches the whole history window. Rate limiting never produces a stored negative
 * result, so the next request retries upstream.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReporterResolutionService {

    static final int MIN_NAME_LENGTH = 2;

    private final ReporterStore reporterStore;
    private final ProviderRegistry providerRegistry;
    private final ArticleNormalizer articleNormalizer;
    private final SyndicationDeduplicator syndicationDeduplicator;
    private final SummarizationService summarizationService;
    private final ProfileService profileService;
    private final RelevanceGate relevanceGate;
    private final DossierAssembler dossierAssembler;

    public ReporterDossier resolve(String name, boolean forceRefresh) {
        if (name == null || name.trim().length() < MIN_NAME_LENGTH) {
            throw new InvalidInputException("Reporter name must be at least " + MIN_NAME_LENGTH + " characters");
        }
        String requested = name.trim().replaceAll("\\s+", " ");

        Optional<Reporter> stored = reporterStore.find(requested);
        ResolutionTier tier = stored
                .map(r -> TierSelector.select(true, reporterStore.isFresh(r), forceRefresh,
                        reporterStore.countArticles(r.getId()) > 0, r.hasIdentity()))
                .orElse(ResolutionTier.COLD_START);
        log.info("Resolving '{}' via {}{}", requested, tier, forceRefresh ? " (forced)" : "");

        return switch (tier) {
            case FRESH_HIT -> freshHit(stored.get());
            case INCREMENTAL -> incremental(stored.get());
            case COLD_START -> coldStart(requested, stored.orElse(null));
        };
    }

    private ReporterDossier freshHit(Reporter reporter) {
        List<CanonicalArticle> articles = reporterStore.articles(reporter.getId());
        return classifyAndBuild(reporter, articles, ResolutionTier.FRESH_HIT);
    }

    private ReporterDossier incremental(Reporter reporter) {
        Long reporterId = reporter.getId();
        LocalDate since = reporterStore.latestArticleDate(reporterId)
                .map(latest -> latest.plusDays(1))
                .orElse(null);

        List<RawArticle> raw;
        try {
            raw = fetch(reporter.getExternalSource(), reporter.getExternalId(), since);
        } catch (ProviderRateLimitedException e) {
            // Leave lastUpdated alone so the next request tries again
            log.warn("⚠️ Incremental fetch for {} rate limited by {}, serving stored data",
                    reporter.getName(), e.getProvider());
            return classifyAndBuild(reporter, reporterStore.articles(reporterId), ResolutionTier.INCREMENTAL);
        }

        List<CanonicalArticle> fresh = reporterStore.unstored(prepare(raw));
        if (!fresh.isEmpty()) {
            reporterStore.insertArticles(reporterId, summarizationService.summarize(fresh));
        }
        log.info("Incremental update for {} since {}: {} new articles", reporter.getName(), since, fresh.size());

        // Outlet inference needs the full history, not just the delta
        List<CanonicalArticle> all = reporterStore.articles(reporterId);
        ProfileResult profile = profileService.generateProfile(
                DossierAssembler.displayName(reporter.getName()), all, titleOf(reporter.getSocialLinks()));
        reporterStore.updateProfile(reporterId, profile.getCurrentOutlet(), profile.getReporterBio());

        Reporter updated = reporterStore.findById(reporterId).orElse(reporter);
        return classifyAndBuild(updated, all, ResolutionTier.INCREMENTAL);
    }

    private ReporterDossier coldStart(String requested, Reporter existing) {
        IdentityLookup lookup = providerRegistry.resolveIdentity(requested);
        if (!lookup.isFound()) {
            log.info("No identity for '{}'{}, nothing stored", requested, lookup.isRateLimited() ? " (rate limited)" : "");
            if (existing != null) {
                return dossierAssembler.fromStored(existing, reporterStore.articles(existing.getId()), ResolutionTier.COLD_START);
            }
            return dossierAssembler.empty(requested, null, ResolutionTier.COLD_START);
        }

        ProviderIdentity identity = lookup.identity().orElseThrow();
        SocialLinks socialLinks = toSocialLinks(identity.getSocialProfile());

        List<RawArticle> raw;
        boolean rateLimited = false;
        try {
            raw = fetch(identity.getProvider(), identity.getId(), null);
        } catch (ProviderRateLimitedException e) {
            log.warn("⚠️ History fetch for '{}' rate limited by {}", requested, e.getProvider());
            raw = List.of();
            rateLimited = true;
        }

        List<CanonicalArticle> articles = prepare(raw);
        if (articles.isEmpty()) {
            if (rateLimited) {
                return dossierAssembler.empty(requested, SocialLinksDTO.from(identity.getSocialProfile()),
                        ResolutionTier.COLD_START);
            }
            // Keep the identity so later requests skip resolution
            Reporter saved = reporterStore.upsert(identityRecord(requested, identity, socialLinks).build(), true);
            log.info("Stored '{}' with identity {} and no coverage", requested, identity.getId());
            return dossierAssembler.fromStored(saved, List.of(), ResolutionTier.COLD_START);
        }

        List<CanonicalArticle> summarized = summarizationService.summarize(articles);
        ProfileResult profile = profileService.generateProfile(
                DossierAssembler.displayName(ReporterStore.canonicalName(requested)), summarized, titleOf(socialLinks));

        Reporter saved = reporterStore.upsert(identityRecord(requested, identity, socialLinks)
                .currentOutlet(profile.getCurrentOutlet())
                .bio(profile.getReporterBio())
                .build(), true);
        reporterStore.insertArticles(saved.getId(), summarized);
        log.info("✅ Cold start for '{}' stored {} articles", requested, summarized.size());

        return classifyAndBuild(saved, reporterStore.articles(saved.getId()), ResolutionTier.COLD_START);
    }

    private ReporterDossier classifyAndBuild(Reporter reporter, List<CanonicalArticle> articles, ResolutionTier tier) {
        Reporter current = reporter;
        if (relevanceGate.classifyIfUnknown(reporter, articles)) {
            current = reporterStore.findById(reporter.getId()).orElse(reporter);
        }
        return dossierAssembler.fromStored(current, articles, tier);
    }

    private List<RawArticle> fetch(String providerKey, String identityId, LocalDate since) {
        Optional<ArticleProvider> provider = providerRegistry.provider(providerKey);
        if (provider.isEmpty()) {
            log.warn("Provider '{}' is not available, treating as no data", providerKey);
            return List.of();
        }
        return provider.get().fetchItemsSince(identityId, since);
    }

    private List<CanonicalArticle> prepare(List<RawArticle> raw) {
        return syndicationDeduplicator.dedupBySyndication(articleNormalizer.normalize(raw));
    }

    private static Reporter.ReporterBuilder identityRecord(String name, ProviderIdentity identity, SocialLinks socialLinks) {
        return Reporter.builder()
                .name(name)
                .externalId(identity.getId())
                .externalSource(identity.getProvider())
                .socialLinks(socialLinks)
                .source(ReporterSource.PROVIDER);
    }

    private static SocialLinks toSocialLinks(SocialProfile profile) {
        if (profile == null) {
            return null;
        }
        SocialLinks links = SocialLinks.builder()
                .twitterHandle(profile.getTwitterHandle())
                .twitterUrl(profile.getTwitterUrl())
                .linkedinUrl(profile.getLinkedinUrl())
                .websiteUrl(profile.getWebsiteUrl())
                .title(profile.getTitle())
                .build();
        return links.isEmpty() ? null : links;
    }

    private static String titleOf(SocialLinks links) {
        return links != null ? links.getTitle() : null;
    }
}
