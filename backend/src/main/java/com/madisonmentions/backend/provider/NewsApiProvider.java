package com.madisonmentions.backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.madisonmentions.backend.config.ProvidersProperties;
import com.madisonmentions.backend.config.ResolutionProperties;
import com.madisonmentions.backend.config.SecretConfig;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * NewsAPI.ai (Event Registry). Author metadata is inconsistent across sources, so this is
 * the secondary provider and is only enabled when a key is configured.
 */
@Slf4j
@Component
public class NewsApiProvider extends AbstractHttpProvider {

    public static final String KEY = "newsapi";

    private final SecretConfig secretConfig;
    private final ProvidersProperties providersProperties;
    private final ResolutionProperties resolutionProperties;
    private final Clock clock;

    public NewsApiProvider(RestTemplate providerRestTemplate,
                           ApiUsageMonitoringService monitoringService,
                           SecretConfig secretConfig,
                           ProvidersProperties providersProperties,
                           ResolutionProperties resolutionProperties,
                           Clock clock) {
        super(providerRestTemplate, monitoringService);
        this.secretConfig = secretConfig;
        this.providersProperties = providersProperties;
        this.resolutionProperties = resolutionProperties;
        this.clock = clock;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public boolean isEnabled() {
        return secretConfig.hasNewsapiKey();
    }

    @Override
    protected String getBaseUrl() {
        return providersProperties.getNewsapiBaseUrl();
    }

    @Override
    public Optional<ProviderIdentity> findIdentity(String name) {
        Map<String, Object> body = new HashMap<>();
        body.put("prefix", name);
        body.put("apiKey", secretConfig.getNewsapiApiKey());

        return call(OP_FIND_IDENTITY, () -> {
            JsonNode authors = restTemplate.postForObject(uri("/suggestAuthors"), body, JsonNode.class);
            if (authors == null || !authors.isArray() || authors.isEmpty()) {
                return Optional.<ProviderIdentity>empty();
            }

            // Prefer an exact name match over the first prefix suggestion
            String chosen = null;
            for (JsonNode author : authors) {
                String uri = textOrNull(author, "uri");
                if (uri == null) {
                    continue;
                }
                if (chosen == null) {
                    chosen = uri;
                }
                String authorName = textOrNull(author, "name");
                if (authorName != null && authorName.equalsIgnoreCase(name.trim())) {
                    chosen = uri;
                    break;
                }
            }
            if (chosen == null) {
                return Optional.<ProviderIdentity>empty();
            }
            return Optional.of(ProviderIdentity.builder().provider(KEY).id(chosen).build());
        }, Optional.empty());
    }

    @Override
    public List<RawArticle> fetchItemsSince(String identityId, LocalDate since) {
        LocalDate from = since != null
                ? since
                : LocalDate.now(clock).minusDays(resolutionProperties.getHistoryWindowDays());

        Map<String, Object> innerQuery = new LinkedHashMap<>();
        innerQuery.put("authorUri", identityId);
        innerQuery.put("dateStart", from.toString());

        Map<String, Object> body = articleQuery();
        body.put("query", Map.of("$query", innerQuery));

        return call(OP_FETCH_ARTICLES, () -> {
            JsonNode response = restTemplate.postForObject(uri("/article/getArticles"), body, JsonNode.class);
            List<RawArticle> articles = new ArrayList<>();
            if (response == null) {
                return articles;
            }
            for (JsonNode item : response.path("articles").path("results")) {
                articles.add(toRawArticle(item));
            }
            log.debug("NewsAPI.ai returned {} articles for author {} since {}", articles.size(), identityId, from);
            return articles;
        }, new ArrayList<>());
    }

    /**
     * Event Registry has no journalist search by topic, so the authors of recent articles
     * matching the topic keyword are ranked by article count.
     */
    @Override
    public List<IdentitySummary> fetchByTopic(String topic, int limit) {
        Map<String, Object> body = articleQuery();
        body.put("keyword", topic);
        body.put("lang", "eng");

        return call(OP_FETCH_BY_TOPIC, () -> {
            JsonNode response = restTemplate.postForObject(uri("/article/getArticles"), body, JsonNode.class);
            if (response == null) {
                return new ArrayList<IdentitySummary>();
            }

            Map<String, AuthorTally> tallies = new LinkedHashMap<>();
            for (JsonNode article : response.path("articles").path("results")) {
                String outlet = textOrNull(article.path("source"), "uri");
                for (JsonNode author : article.path("authors")) {
                    String uri = textOrNull(author, "uri");
                    String name = textOrNull(author, "name");
                    if (uri == null || name == null) {
                        continue;
                    }
                    AuthorTally tally = tallies.computeIfAbsent(uri, u -> new AuthorTally(u, name));
                    tally.count++;
                    if (outlet != null) {
                        tally.outlets.add(outlet);
                    }
                }
            }

            return tallies.values().stream()
                    .sorted((a, b) -> Integer.compare(b.count, a.count))
                    .limit(limit)
                    .map(t -> IdentitySummary.builder()
                            .provider(KEY)
                            .id(t.uri)
                            .name(t.name)
                            .outlets(new ArrayList<>(t.outlets))
                            .topics(List.of(topic.toLowerCase(Locale.ROOT)))
                            .build())
                    .toList();
        }, new ArrayList<>());
    }

    private Map<String, Object> articleQuery() {
        Map<String, Object> body = new HashMap<>();
        body.put("resultType", "articles");
        body.put("articlesSortBy", "date");
        body.put("articlesSortByAsc", false);
        body.put("articlesCount", providersProperties.getPageSize());
        body.put("includeArticleAuthors", true);
        body.put("includeArticleCategories", true);
        body.put("apiKey", secretConfig.getNewsapiApiKey());
        return body;
    }

    private URI uri(String path) {
        return UriComponentsBuilder.fromUriString(getBaseUrl()).path(path).build().toUri();
    }

    private RawArticle toRawArticle(JsonNode item) {
        String published = textOrNull(item, "dateTime");
        if (published == null) {
            published = textOrNull(item, "date");
        }

        List<String> topics = new ArrayList<>();
        for (JsonNode category : item.path("categories")) {
            String label = textOrNull(category, "label");
            if (label != null) {
                // Labels look like "news/Business"; keep the last segment
                topics.add(label.substring(label.lastIndexOf('/') + 1));
            }
        }

        return RawArticle.builder()
                .title(textOrNull(item, "title"))
                .url(textOrNull(item, "url"))
                .publishedAt(published)
                .sourceDomain(textOrNull(item.path("source"), "uri"))
                .topics(topics)
                .build();
    }

    private static final class AuthorTally {
        private final String uri;
        private final String name;
        private final Set<String> outlets = new LinkedHashSet<>();
        private int count;

        private AuthorTally(String uri, String name) {
            this.uri = uri;
            this.name = name;
        }
    }
}
