package com.madisonmentions.backend.cache.service;

import com.madisonmentions.backend.cache.entity.CachedSummary;
import com.madisonmentions.backend.cache.repository.CachedSummaryRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Immutable text cache: article summaries keyed by URL and generated profiles keyed by content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryCacheService {

    private final CachedSummaryRepository cachedSummaryRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<String> get(String cacheKey) {
        return cachedSummaryRepository.findByCacheKey(cacheKey).map(CachedSummary::getSummary);
    }

    @Transactional(readOnly = true)
    public Map<String, String> getBulk(Collection<String> cacheKeys) {
        Map<String, String> found = new HashMap<>();
        if (cacheKeys.isEmpty()) {
            return found;
        }
        for (CachedSummary cached : cachedSummaryRepository.findByCacheKeys(cacheKeys)) {
            found.put(cached.getCacheKey(), cached.getSummary());
        }
        return found;
    }

    public void put(String cacheKey, String summary) {
        putAll(Map.of(cacheKey, summary));
    }

    /**
     * Writes entries whose key is not cached yet. Existing entries are never overwritten.
     */
    public void putAll(Map<String, String> summaries) {
        if (summaries.isEmpty()) {
            return;
        }
        Set<String> existing = new HashSet<>(cachedSummaryRepository.findExistingKeys(summaries.keySet()));
        LocalDateTime now = LocalDateTime.now(clock);

        List<CachedSummary> toSave = summaries.entrySet().stream()
                .filter(e -> !existing.contains(e.getKey()))
                .filter(e -> e.getValue() != null && !e.getValue().isBlank())
                .map(e -> CachedSummary.builder()
                        .cacheKey(e.getKey())
                        .summary(e.getValue())
                        .createdAt(now)
                        .build())
                .toList();
        if (toSave.isEmpty()) {
            return;
        }

        try {
            cachedSummaryRepository.saveAllAndFlush(toSave);
            log.debug("Cached {} summaries", toSave.size());
        } catch (DataIntegrityViolationException e) {
            log.debug("Summary cache write raced with another request: {}", e.getMessage());
        }
    }
}
