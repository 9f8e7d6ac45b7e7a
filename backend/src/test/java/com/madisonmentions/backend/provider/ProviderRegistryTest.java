package com.madisonmentions.backend.provider;

import com.madisonmentions.backend.cache.service.QueryCacheService;
import com.madisonmentions.backend.config.ProvidersProperties;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {

    @Mock
    ArticleProvider perigon;
    @Mock
    ArticleProvider newsapi;
    @Mock
    QueryCacheService queryCacheService;

    ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        lenient().when(perigon.key()).thenReturn("perigon");
        lenient().when(newsapi.key()).thenReturn("newsapi");
        lenient().when(perigon.isEnabled()).thenReturn(true);
        lenient().when(newsapi.isEnabled()).thenReturn(true);
        // Registered out of order on purpose
        registry = new ProviderRegistry(List.of(newsapi, perigon), new ProvidersProperties(), queryCacheService);
    }

    @Test
    void enabledProvidersFollowConfiguredOrder() {
        assertThat(registry.enabledProviders()).containsExactly(perigon, newsapi);
    }

    @Test
    void disabledProviderIsSkipped() {
        when(newsapi.isEnabled()).thenReturn(false);

        assertThat(registry.enabledProviders()).containsExactly(perigon);
        assertThat(registry.provider("newsapi")).isEmpty();
    }

    @Test
    void nullKeyFallsBackToPrimaryProvider() {
        assertThat(registry.provider(null)).contains(perigon);
        assertThat(registry.provider("newsapi")).contains(newsapi);
    }

    @Test
    void rateLimitedProviderFallsThroughToNext() {
        when(queryCacheService.get(anyString(), any())).thenReturn(Optional.empty());
        when(perigon.findIdentity("Jane Doe")).thenThrow(new ProviderRateLimitedException("perigon", "429"));
        ProviderIdentity identity = ProviderIdentity.builder().id("er-7").build();
        when(newsapi.findIdentity("Jane Doe")).thenReturn(Optional.of(identity));

        IdentityLookup lookup = registry.resolveIdentity("Jane Doe");

        assertThat(lookup.isFound()).isTrue();
        assertThat(lookup.identity()).get().extracting(ProviderIdentity::getProvider).isEqualTo("newsapi");
        verify(queryCacheService).put(eq("identity:newsapi:jane doe"), eq(identity));
    }

    @Test
    void cachedIdentityAvoidsProviderCall() {
        ProviderIdentity cached = ProviderIdentity.builder().provider("perigon").id("j-42").build();
        when(queryCacheService.get(eq("identity:perigon:jane doe"), any())).thenReturn(Optional.of(cached));

        IdentityLookup lookup = registry.resolveIdentity("  Jane Doe ");

        assertThat(lookup.identity()).contains(cached);
        verify(perigon, never()).findIdentity(anyString());
        verify(newsapi, never()).findIdentity(anyString());
    }

    @Test
    void missIsNotCached() {
        when(queryCacheService.get(anyString(), any())).thenReturn(Optional.empty());
        when(perigon.findIdentity("Nobody")).thenReturn(Optional.empty());
        when(newsapi.findIdentity("Nobody")).thenReturn(Optional.empty());

        IdentityLookup lookup = registry.resolveIdentity("Nobody");

        assertThat(lookup.isFound()).isFalse();
        assertThat(lookup.isRateLimited()).isFalse();
        verify(queryCacheService, never()).put(anyString(), any());
    }

    @Test
    void missWhileRateLimitedIsReportedAsSuch() {
        when(queryCacheService.get(anyString(), any())).thenReturn(Optional.empty());
        when(perigon.findIdentity("Nobody")).thenThrow(new ProviderRateLimitedException("perigon", "429"));
        when(newsapi.findIdentity("Nobody")).thenReturn(Optional.empty());

        IdentityLookup lookup = registry.resolveIdentity("Nobody");

        assertThat(lookup.isFound()).isFalse();
        assertThat(lookup.isRateLimited()).isTrue();
    }
}
