package com.madisonmentions.backend.ai.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.madisonmentions.backend.ai.TextIntelligence;
import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.cache.service.SummaryCacheService;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

/**
 * Current outlet and bio for a reporter. Results are cached per name and article set, so
 * the same input never reaches the model twice while any new article forces regeneration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final TextIntelligence textIntelligence;
    private final SummaryCacheService summaryCacheService;
    private final ObjectMapper objectMapper;

    public ProfileResult generateProfile(String reporterName, List<CanonicalArticle> articles, String titleHint) {
        if (articles.isEmpty()) {
            return ProfileResult.empty();
        }

        String cacheKey = cacheKey(reporterName, articles);
        Optional<ProfileResult> cached = summaryCacheService.get(cacheKey).flatMap(this::readProfile);
        if (cached.isPresent()) {
            log.debug("Profile cache hit for {}", reporterName);
            return cached.get();
        }

        ProfileResult result = textIntelligence.generateProfile(reporterName, articles, titleHint);

        // A missing bio means the fallback produced it; leave it uncached
        if (result.getReporterBio() != null) {
            try {
                summaryCacheService.put(cacheKey, objectMapper.writeValueAsString(result));
            } catch (JsonProcessingException e) {
                log.warn("Could not cache profile for {}: {}", reporterName, e.getMessage());
            }
        }
        return result;
    }

    static String cacheKey(String reporterName, List<CanonicalArticle> articles) {
        String urls = String.join("\n", articles.stream().map(CanonicalArticle::getUrl).sorted().toList());
        String digest = DigestUtils.md5DigestAsHex(urls.getBytes(StandardCharsets.UTF_8));
        return "profile:" + reporterName.trim().toLowerCase(Locale.ROOT) + ":" + digest;
    }

    private Optional<ProfileResult> readProfile(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, ProfileResult.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cached profile: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
