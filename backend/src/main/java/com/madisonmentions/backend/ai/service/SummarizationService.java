package com.madisonmentions.backend.ai.service;

import com.madisonmentions.backend.ai.TextIntelligence;
import com.madisonmentions.backend.ai.dto.HeadlineRequest;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.cache.service.SummaryCacheService;
import com.madisonmentions.backend.config.ResolutionProperties;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Attaches summaries to articles. Cached summaries are reused; at most
 * {@code app.resolution.max-summaries} uncached articles go to the model per call and the
 * remainder use their headline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummarizationService {

    private final TextIntelligence textIntelligence;
    private final SummaryCacheService summaryCacheService;
    private final ResolutionProperties resolutionProperties;

    public List<CanonicalArticle> summarize(List<CanonicalArticle> articles) {
        if (articles.isEmpty()) {
            return articles;
        }

        List<String> urls = articles.stream().map(CanonicalArticle::getUrl).toList();
        Map<String, String> cached = summaryCacheService.getBulk(urls);

        List<CanonicalArticle> uncached = articles.stream()
                .filter(a -> !cached.containsKey(a.getUrl()))
                .toList();
        int cap = Math.max(0, resolutionProperties.getMaxSummaries());
        List<CanonicalArticle> toModel = uncached.subList(0, Math.min(cap, uncached.size()));

        Map<String, String> generated = new HashMap<>();
        if (!toModel.isEmpty()) {
            List<HeadlineRequest> requests = toModel.stream()
                    .map(a -> new HeadlineRequest(a.getHeadline(), a.getOutlet()))
                    .toList();
            List<String> summaries = textIntelligence.summarizeBatch(requests);

            Map<String, String> toCache = new LinkedHashMap<>();
            for (int i = 0; i < toModel.size(); i++) {
                CanonicalArticle article = toModel.get(i);
                String summary = i < summaries.size() ? summaries.get(i) : null;
                if (summary == null || summary.isBlank()) {
                    continue;
                }
                generated.put(article.getUrl(), summary);
                // Headline fallbacks are not cached so a later call can still get a real summary
                if (!article.getHeadline().startsWith(summary)) {
                    toCache.put(article.getUrl(), summary);
                }
            }
            summaryCacheService.putAll(toCache);
        }

        log.info("Summaries: {} cached, {} generated, {} using headline",
                articles.size() - uncached.size(), generated.size(),
                uncached.size() - generated.size());

        List<CanonicalArticle> result = new ArrayList<>(articles.size());
        for (CanonicalArticle article : articles) {
            String summary = cached.get(article.getUrl());
            if (summary == null) {
                summary = generated.getOrDefault(article.getUrl(), article.getHeadline());
            }
            result.add(article.toBuilder().summary(summary).build());
        }
        return result;
    }
}
