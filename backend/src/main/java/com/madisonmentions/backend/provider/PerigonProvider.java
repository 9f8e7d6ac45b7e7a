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
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Perigon journalist API: the primary byline source, with proper author attribution and
 * social profile data.
 */
@Slf4j
@Component
public class PerigonProvider extends AbstractHttpProvider {

    public static final String KEY = "perigon";

    private final SecretConfig secretConfig;
    private final ProvidersProperties providersProperties;
    private final ResolutionProperties resolutionProperties;
    private final Clock clock;

    public PerigonProvider(RestTemplate providerRestTemplate,
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
    protected String getBaseUrl() {
        return providersProperties.getPerigonBaseUrl();
    }

    @Override
    public Optional<ProviderIdentity> findIdentity(String name) {
        return call(OP_FIND_IDENTITY, () -> {
            JsonNode search = restTemplate.getForObject(uri("/journalists")
                    .queryParam("name", name)
                    .queryParam("apiKey", secretConfig.getPerigonApiKey())
                    .encode().build().toUri(), JsonNode.class);

            JsonNode results = search != null ? search.path("results") : null;
            if (results == null || !results.isArray() || results.isEmpty()) {
                return Optional.<ProviderIdentity>empty();
            }
            String journalistId = textOrNull(results.get(0), "id");
            if (journalistId == null) {
                return Optional.<ProviderIdentity>empty();
            }

            // Full journalist record carries the social links
            JsonNode details = restTemplate.getForObject(uri("/journalists/" + journalistId)
                    .queryParam("apiKey", secretConfig.getPerigonApiKey())
                    .encode().build().toUri(), JsonNode.class);

            return Optional.of(ProviderIdentity.builder()
                    .provider(KEY)
                    .id(journalistId)
                    .socialProfile(toSocialProfile(details))
                    .build());
        }, Optional.empty());
    }

    @Override
    public List<RawArticle> fetchItemsSince(String identityId, LocalDate since) {
        LocalDate from = since != null
                ? since
                : LocalDate.now(clock).minusDays(resolutionProperties.getHistoryWindowDays());

        URI request = uri("/all")
                .queryParam("journalistId", identityId)
                .queryParam("from", from.toString())
                .queryParam("sortBy", "date")
                .queryParam("size", providersProperties.getPageSize())
                .queryParam("language", "en")
                .queryParam("apiKey", secretConfig.getPerigonApiKey())
                .encode().build().toUri();

        return call(OP_FETCH_ARTICLES, () -> {
            JsonNode response = restTemplate.getForObject(request, JsonNode.class);
            List<RawArticle> articles = new ArrayList<>();
            if (response == null) {
                return articles;
            }
            for (JsonNode item : response.path("articles")) {
                articles.add(toRawArticle(item));
            }
            log.debug("Perigon returned {} articles for journalist {} since {}", articles.size(), identityId, from);
            return articles;
        }, new ArrayList<>());
    }

    @Override
    public List<IdentitySummary> fetchByTopic(String topic, int limit) {
        URI request = uri("/journalists")
                .queryParam("topic", topic)
                .queryParam("size", limit)
                .queryParam("apiKey", secretConfig.getPerigonApiKey())
                .encode().build().toUri();

        return call(OP_FETCH_BY_TOPIC, () -> {
            JsonNode response = restTemplate.getForObject(request, JsonNode.class);
            List<IdentitySummary> summaries = new ArrayList<>();
            if (response == null) {
                return summaries;
            }
            for (JsonNode journalist : response.path("results")) {
                String id = textOrNull(journalist, "id");
                String name = textOrNull(journalist, "name");
                if (id == null || name == null) {
                    continue;
                }
                summaries.add(IdentitySummary.builder()
                        .provider(KEY)
                        .id(id)
                        .name(name)
                        .title(textOrNull(journalist, "title"))
                        .outlets(names(journalist.path("topSources")))
                        .topics(names(journalist.path("topTopics")))
                        .build());
            }
            return summaries;
        }, new ArrayList<>());
    }

    private UriComponentsBuilder uri(String path) {
        return UriComponentsBuilder.fromUriString(getBaseUrl()).path(path);
    }

    private RawArticle toRawArticle(JsonNode item) {
        List<String> topics = new ArrayList<>();
        topics.addAll(names(item.path("topics")));
        topics.addAll(names(item.path("categories")));

        return RawArticle.builder()
                .title(textOrNull(item, "title"))
                .url(textOrNull(item, "url"))
                .publishedAt(textOrNull(item, "pubDate"))
                .sourceDomain(textOrNull(item.path("source"), "domain"))
                .topics(topics)
                .build();
    }

    private SocialProfile toSocialProfile(JsonNode details) {
        if (details == null) {
            return null;
        }
        String twitterHandle = textOrNull(details, "twitterHandle");
        return SocialProfile.builder()
                .twitterHandle(twitterHandle)
                .twitterUrl(twitterHandle != null ? "https://twitter.com/" + twitterHandle : null)
                .linkedinUrl(textOrNull(details, "linkedinUrl"))
                .websiteUrl(textOrNull(details, "websiteUrl"))
                .title(textOrNull(details, "title"))
                .build();
    }

    private List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return names;
        }
        for (JsonNode node : array) {
            String name = node.isTextual() ? node.asText() : textOrNull(node, "name");
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return names;
    }
}
