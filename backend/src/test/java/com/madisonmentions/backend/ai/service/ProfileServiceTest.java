package com.madisonmentions.backend.ai.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.madisonmentions.backend.ai.TextIntelligence;
import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.cache.service.SummaryCacheService;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    @Mock
    TextIntelligence textIntelligence;
    @Mock
    SummaryCacheService summaryCacheService;

    ProfileService service;

    final List<CanonicalArticle> articles = List.of(
            article("https://reuters.com/b"),
            article("https://reuters.com/a"));

    @BeforeEach
    void setUp() {
        service = new ProfileService(textIntelligence, summaryCacheService, new ObjectMapper());
    }

    @Test
    void cacheKeyIgnoresArticleOrderAndNameCase() {
        String key = ProfileService.cacheKey("Jane Doe", articles);

        assertThat(key).startsWith("profile:jane doe:");
        assertThat(ProfileService.cacheKey(" JANE DOE", List.of(articles.get(1), articles.get(0)))).isEqualTo(key);
        assertThat(ProfileService.cacheKey("Jane Doe", articles.subList(0, 1))).isNotEqualTo(key);
    }

    @Test
    void cachedProfileSkipsTheModel() {
        when(summaryCacheService.get(ProfileService.cacheKey("Jane Doe", articles)))
                .thenReturn(Optional.of("{\"current_outlet\":\"Reuters\",\"reporter_bio\":\"Covers markets.\"}"));

        ProfileResult result = service.generateProfile("Jane Doe", articles, null);

        assertThat(result.getCurrentOutlet()).isEqualTo("Reuters");
        verifyNoInteractions(textIntelligence);
    }

    @Test
    void generatedProfileIsCached() {
        String key = ProfileService.cacheKey("Jane Doe", articles);
        when(summaryCacheService.get(key)).thenReturn(Optional.empty());
        when(textIntelligence.generateProfile("Jane Doe", articles, null))
                .thenReturn(new ProfileResult("Reuters", "Covers markets."));

        service.generateProfile("Jane Doe", articles, null);

        verify(summaryCacheService).put(eq(key), anyString());
    }

    @Test
    void fallbackProfileWithoutBioIsNotCached() {
        String key = ProfileService.cacheKey("Jane Doe", articles);
        when(summaryCacheService.get(key)).thenReturn(Optional.empty());
        when(textIntelligence.generateProfile("Jane Doe", articles, null))
                .thenReturn(new ProfileResult("Reuters", null));

        ProfileResult result = service.generateProfile("Jane Doe", articles, null);

        assertThat(result.getCurrentOutlet()).isEqualTo("Reuters");
        verify(summaryCacheService, never()).put(anyString(), anyString());
    }

    private static CanonicalArticle article(String url) {
        return CanonicalArticle.builder()
                .headline("Headline")
                .outlet("Reuters")
                .publishedDate(LocalDate.of(2026, 10, 1))
                .url(url)
                .build();
    }
}
