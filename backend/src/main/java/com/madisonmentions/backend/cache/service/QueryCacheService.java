package com.madisonmentions.backend.cache.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.madisonmentions.backend.cache.entity.CachedQuery;
import com.madisonmentions.backend.cache.repository.CachedQueryRepository;
import com.madisonmentions.backend.config.ResolutionProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Short-lived cache of provider responses (identity lookups, topic searches).
 * Entries older than {@code app.resolution.query-cache-ttl-hours} are ignored but never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    private final CachedQueryRepository cachedQueryRepository;
    private final ObjectMapper objectMapper;
    private final ResolutionProperties resolutionProperties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public <T> Optional<T> get(String cacheKey, TypeReference<T> type) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(resolutionProperties.getQueryCacheTtlHours());
        Optional<CachedQuery> cached = cachedQueryRepository.findLatestSince(cacheKey, since);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            log.debug("Query cache hit for {}", cacheKey);
            return Optional.ofNullable(objectMapper.readValue(cached.get().getPayload(), type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached payload for {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores the value under today's bucket, replacing any entry already written today.
     */
    public void put(String cacheKey, Object value) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize cache entry {}: {}", cacheKey, e.getMessage());
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate bucket = now.toLocalDate();
        CachedQuery entry = cachedQueryRepository.findByCacheKeyAndBucketDate(cacheKey, bucket)
                .orElseGet(() -> CachedQuery.builder().cacheKey(cacheKey).bucketDate(bucket).build());
        entry.setPayload(payload);
        entry.setCreatedAt(now);

        try {
            cachedQueryRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            // Another request wrote the same key and bucket first
            log.debug("Concurrent write for cache key {} ignored", cacheKey);
        }
    }
}
