package com.madisonmentions.backend.provider;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Upstream article-metadata source.
 * <p>
 * Implementations raise {@link ProviderRateLimitedException} when the upstream reports
 * rate limiting; every other failure collapses to an empty result.
 */
public interface ArticleProvider {

    /**
     * Whether the provider is configured (e.g. has credentials) and may be called.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Stable provider key, stored with the identity it issued (e.g. "perigon").
     */
    String key();

    Optional<ProviderIdentity> findIdentity(String name);

    /**
     * Articles by the identity published on or after {@code since}; a null bound means
     * the provider's full history window.
     */
    List<RawArticle> fetchItemsSince(String identityId, LocalDate since);

    List<IdentitySummary> fetchByTopic(String topic, int limit);
}
