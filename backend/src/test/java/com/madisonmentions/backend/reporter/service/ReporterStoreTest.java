package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.config.ResolutionProperties;
import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import com.madisonmentions.backend.reporter.entity.ReporterSource;
import com.madisonmentions.backend.reporter.entity.SocialLinks;
import com.madisonmentions.backend.reporter.repository.ArticleRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({ReporterStore.class, ReporterStoreTest.StoreTestConfig.class})
class ReporterStoreTest {

    static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 17, 12, 0);

    @TestConfiguration
    static class StoreTestConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        }

        @Bean
        ResolutionProperties resolutionProperties() {
            return new ResolutionProperties();
        }
    }

    @Autowired
    ReporterStore store;
    @Autowired
    ArticleRepository articleRepository;

    @Test
    void namesAreStoredInCanonicalForm() {
        store.upsert(Reporter.builder().name("  Jane   DOE ").build(), true);

        assertThat(store.find("jane doe")).isPresent();
        assertThat(store.find("JANE  doe").get().getName()).isEqualTo("jane doe");
    }

    @Test
    void upsertKeepsStoredValuesWhereIncomingIsNull() {
        store.upsert(Reporter.builder()
                .name("Jane Doe")
                .externalId("j-1")
                .externalSource("perigon")
                .currentOutlet("Reuters")
                .bio("Covers markets.")
                .socialLinks(SocialLinks.builder().twitterHandle("janedoe").title("Reporter").build())
                .build(), true);

        Reporter merged = store.upsert(Reporter.builder()
                .name("jane doe")
                .currentOutlet("Bloomberg")
                .socialLinks(SocialLinks.builder().linkedinUrl("https://linkedin.com/in/janedoe").build())
                .source(ReporterSource.MANUAL_IMPORT)
                .build(), false);

        assertThat(merged.getExternalId()).isEqualTo("j-1");
        assertThat(merged.getCurrentOutlet()).isEqualTo("Bloomberg");
        assertThat(merged.getBio()).isEqualTo("Covers markets.");
        assertThat(merged.getSocialLinks().getTwitterHandle()).isEqualTo("janedoe");
        assertThat(merged.getSocialLinks().getLinkedinUrl()).isEqualTo("https://linkedin.com/in/janedoe");
        assertThat(merged.getSource()).isEqualTo(ReporterSource.MANUAL_IMPORT);
        assertThat(merged.getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    void duplicateUrlsAreStoredOnce() {
        Reporter reporter = store.upsert(Reporter.builder().name("Jane Doe").build(), true);
        CanonicalArticle article = article("https://reuters.com/1", "2026-09-01");

        int first = store.insertArticles(reporter.getId(), List.of(article, article));
        int second = store.insertArticles(reporter.getId(), List.of(article, article("https://reuters.com/2", "2026-09-02")));

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(1);
        assertThat(articleRepository.countByReporterId(reporter.getId())).isEqualTo(2);
        assertThat(store.latestArticleDate(reporter.getId())).contains(LocalDate.of(2026, 9, 2));
        assertThat(store.articles(reporter.getId())).extracting(CanonicalArticle::getUrl)
                .containsExactly("https://reuters.com/2", "https://reuters.com/1");
        assertThat(store.articles(reporter.getId()).get(0).getTopics()).containsExactly("Markets", "Banking");
    }

    @Test
    void unstoredFiltersKnownUrls() {
        Reporter reporter = store.upsert(Reporter.builder().name("Jane Doe").build(), true);
        store.insertArticles(reporter.getId(), List.of(article("https://reuters.com/1", "2026-09-01")));

        List<CanonicalArticle> fresh = store.unstored(List.of(
                article("https://reuters.com/1", "2026-09-01"),
                article("https://reuters.com/3", "2026-09-03")));

        assertThat(fresh).extracting(CanonicalArticle::getUrl).containsExactly("https://reuters.com/3");
    }

    @Test
    void relevanceIsWrittenOnlyOnce() {
        Reporter reporter = store.upsert(Reporter.builder().name("Jane Doe").build(), true);

        assertThat(store.updateRelevance(reporter.getId(), RelevanceVerdict.RELEVANT, "Covers deals")).isTrue();
        assertThat(store.updateRelevance(reporter.getId(), RelevanceVerdict.NOT_RELEVANT, "Sports")).isFalse();

        Reporter stored = store.findById(reporter.getId()).orElseThrow();
        assertThat(stored.getRelevance()).isEqualTo(RelevanceVerdict.RELEVANT);
        assertThat(stored.getRelevanceRationale()).isEqualTo("Covers deals");
        assertThatThrownBy(() -> store.updateRelevance(reporter.getId(), RelevanceVerdict.UNKNOWN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void freshnessFollowsConfiguredWindow() {
        assertThat(store.isFresh(Reporter.builder().lastUpdated(NOW.minusDays(6)).build())).isTrue();
        assertThat(store.isFresh(Reporter.builder().lastUpdated(NOW.minusDays(8)).build())).isFalse();
        assertThat(store.isFresh(Reporter.builder().build())).isFalse();
    }

    @Test
    void profileUpdateTouchesLastUpdated() {
        Reporter reporter = store.upsert(Reporter.builder().name("Jane Doe").currentOutlet("Reuters").build(), false);
        assertThat(reporter.getLastUpdated()).isNull();

        store.updateProfile(reporter.getId(), null, "Covers markets.");

        Reporter stored = store.findById(reporter.getId()).orElseThrow();
        assertThat(stored.getCurrentOutlet()).isEqualTo("Reuters");
        assertThat(stored.getBio()).isEqualTo("Covers markets.");
        assertThat(stored.getLastUpdated()).isEqualTo(NOW);
    }

    private static CanonicalArticle article(String url, String date) {
        return CanonicalArticle.builder()
                .headline("Headline for " + url)
                .outlet("Reuters")
                .publishedDate(LocalDate.parse(date))
                .url(url)
                .summary("Summary")
                .topics(List.of("Markets", "Banking"))
                .build();
    }
}
