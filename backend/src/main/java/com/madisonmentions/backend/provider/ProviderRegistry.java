package com.madisonmentions.backend.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.madisonmentions.backend.cache.service.QueryCacheService;
import com.madisonmentions.backend.config.ProvidersProperties;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enabled providers in configured order, plus identity resolution across them.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private static final TypeReference<ProviderIdentity> IDENTITY_TYPE = new TypeReference<>() {
    };

    private final List<ArticleProvider> providers;
    private final ProvidersProperties providersProperties;
    private final QueryCacheService queryCacheService;

    public ProviderRegistry(List<ArticleProvider> providers,
                            ProvidersProperties providersProperties,
                            QueryCacheService queryCacheService) {
        this.providers = providers;
        this.providersProperties = providersProperties;
        this.queryCacheService = queryCacheService;
    }

    public List<ArticleProvider> enabledProviders() {
        return providers.stream()
                .filter(ArticleProvider::isEnabled)
                .sorted(Comparator.comparingInt(this::rank))
                .toList();
    }

    /**
     * The enabled provider with the given key. A null key (records issued before the
     * source was tracked) falls back to the primary provider.
     */
    public Optional<ArticleProvider> provider(String key) {
        List<ArticleProvider> enabled = enabledProviders();
        if (key == null) {
            return enabled.stream().findFirst();
        }
        return enabled.stream().filter(p -> p.key().equals(key)).findFirst();
    }

    /**
     * Tries each provider in order until one knows the name. Only positive results are cached.
     */
    public IdentityLookup resolveIdentity(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        boolean rateLimited = false;

        for (ArticleProvider provider : enabledProviders()) {
            String cacheKey = "identity:" + provider.key() + ":" + normalized;
            Optional<ProviderIdentity> cached = queryCacheService.get(cacheKey, IDENTITY_TYPE);
            if (cached.isPresent()) {
                return IdentityLookup.found(cached.get());
            }

            try {
                Optional<ProviderIdentity> identity = provider.findIdentity(name);
                if (identity.isPresent()) {
                    ProviderIdentity resolved = identity.get();
                    if (resolved.getProvider() == null) {
                        resolved.setProvider(provider.key());
                    }
                    queryCacheService.put(cacheKey, resolved);
                    log.info("Resolved '{}' via {} as {}", name, provider.key(), resolved.getId());
                    return IdentityLookup.found(resolved);
                }
            } catch (ProviderRateLimitedException e) {
                log.warn("⚠️ {} rate limited while resolving '{}', trying next provider", provider.key(), name);
                rateLimited = true;
            }
        }

        log.info("No identity found for '{}'{}", name, rateLimited ? " (rate limited)" : "");
        return rateLimited ? IdentityLookup.rateLimited() : IdentityLookup.notFound();
    }

    private int rank(ArticleProvider provider) {
        int index = providersProperties.getOrder().indexOf(provider.key());
        return index < 0 ? Integer.MAX_VALUE : index;
    }
}
