package com.madisonmentions.backend.search.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.madisonmentions.backend.analysis.OutletDirectory;
import com.madisonmentions.backend.cache.service.QueryCacheService;
import com.madisonmentions.backend.common.InvalidInputException;
import com.madisonmentions.backend.provider.ArticleProvider;
import com.madisonmentions.backend.provider.IdentitySummary;
import com.madisonmentions.backend.provider.ProviderRateLimitedException;
import com.madisonmentions.backend.provider.ProviderRegistry;
import com.madisonmentions.backend.search.dto.ReporterSearchResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Finds reporters covering a topic across every enabled provider.
 */
@Slf4j
@Service
public class TopicSearchService {

    static final int MIN_TOPIC_LENGTH = 2;
    static final int MAX_LIMIT = 50;

    private static final TypeReference<List<ReporterSearchResult>> RESULTS_TYPE = new TypeReference<>() {
    };

    private final ProviderRegistry providerRegistry;
    private final QueryCacheService queryCacheService;
    private final OutletDirectory outletDirectory;
    private final Executor providerTaskExecutor;

    public TopicSearchService(ProviderRegistry providerRegistry,
                              QueryCacheService queryCacheService,
                              OutletDirectory outletDirectory,
                              @Qualifier("providerTaskExecutor") Executor providerTaskExecutor) {
        this.providerRegistry = providerRegistry;
        this.queryCacheService = queryCacheService;
        this.outletDirectory = outletDirectory;
        this.providerTaskExecutor = providerTaskExecutor;
    }

    public List<ReporterSearchResult> search(String topic, int limit) {
        if (topic == null || topic.trim().length() < MIN_TOPIC_LENGTH) {
            throw new InvalidInputException("Topic must be at least " + MIN_TOPIC_LENGTH + " characters");
        }
        String trimmed = topic.trim();
        int clamped = Math.max(1, Math.min(MAX_LIMIT, limit));
        String cacheKey = "topic:" + trimmed.toLowerCase(Locale.ROOT) + ":" + clamped;

        Optional<List<ReporterSearchResult>> cached = queryCacheService.get(cacheKey, RESULTS_TYPE);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<ArticleProvider> providers = providerRegistry.enabledProviders();
        List<CompletableFuture<ProviderResult>> futures = providers.stream()
                .map(provider -> CompletableFuture.supplyAsync(() -> query(provider, trimmed, clamped), providerTaskExecutor))
                .toList();

        // Merge in provider order; the first provider to report a name wins
        Map<String, ReporterSearchResult> merged = new LinkedHashMap<>();
        boolean rateLimited = false;
        for (CompletableFuture<ProviderResult> future : futures) {
            ProviderResult result = future.join();
            rateLimited |= result.rateLimited();
            for (IdentitySummary summary : result.summaries()) {
                if (summary.getName() == null || summary.getName().isBlank()) {
                    continue;
                }
                merged.putIfAbsent(summary.getName().trim().toLowerCase(Locale.ROOT), toResult(summary));
            }
        }

        List<ReporterSearchResult> results = merged.values().stream().limit(clamped).toList();
        if (!results.isEmpty() && !rateLimited) {
            queryCacheService.put(cacheKey, results);
        }
        log.info("Topic search '{}' found {} reporters across {} providers{}", trimmed, results.size(),
                providers.size(), rateLimited ? " (partial, rate limited)" : "");
        return results;
    }

    private ProviderResult query(ArticleProvider provider, String topic, int limit) {
        try {
            return new ProviderResult(provider.fetchByTopic(topic, limit), false);
        } catch (ProviderRateLimitedException e) {
            log.warn("⚠️ {} rate limited during topic search for '{}'", provider.key(), topic);
            return new ProviderResult(List.of(), true);
        } catch (RuntimeException e) {
            log.warn("{} topic search failed: {}", provider.key(), e.getMessage());
            return new ProviderResult(List.of(), false);
        }
    }

    private ReporterSearchResult toResult(IdentitySummary summary) {
        LinkedHashSet<String> outlets = new LinkedHashSet<>();
        for (String outlet : summary.getOutlets()) {
            outlets.add(outletDirectory.displayName(outlet));
        }
        return ReporterSearchResult.builder()
                .name(summary.getName().trim())
                .title(summary.getTitle())
                .outlets(new ArrayList<>(outlets))
                .topics(new ArrayList<>(summary.getTopics()))
                .provider(summary.getProvider())
                .externalId(summary.getId())
                .build();
    }

    private record ProviderResult(List<IdentitySummary> summaries, boolean rateLimited) {
    }
}
