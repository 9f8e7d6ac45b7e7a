package com.madisonmentions.backend.analysis;

import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.config.OutletProperties;
import com.madisonmentions.backend.provider.RawArticle;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleNormalizerTest {

    ArticleNormalizer normalizer;

    @BeforeEach
    void setUp() {
        OutletProperties properties = new OutletProperties();
        properties.setDomains(List.of(new OutletProperties.DomainEntry("reuters.com", "Reuters")));
        normalizer = new ArticleNormalizer(new OutletDirectory(properties));
    }

    @Test
    void mapsProviderFieldsAndCleansHeadline() {
        RawArticle raw = RawArticle.builder()
                .title("Banks &amp; <b>regulators</b>   clash")
                .url(" https://www.reuters.com/markets/1 ")
                .publishedAt("2026-03-04T22:15:00+00:00")
                .sourceDomain("www.reuters.com")
                .topics(List.of("Finance", "Banking", "Finance", " ", "Regulation", "Policy", "Markets", "Extra"))
                .build();

        List<CanonicalArticle> result = normalizer.normalize(List.of(raw));

        assertThat(result).hasSize(1);
        CanonicalArticle article = result.get(0);
        assertThat(article.getHeadline()).isEqualTo("Banks & regulators clash");
        assertThat(article.getUrl()).isEqualTo("https://www.reuters.com/markets/1");
        assertThat(article.getOutlet()).isEqualTo("Reuters");
        assertThat(article.getPublishedDate()).isEqualTo(LocalDate.of(2026, 3, 4));
        assertThat(article.getTopics()).containsExactly("Finance", "Banking", "Regulation", "Policy", "Markets");
    }

    @Test
    void dropsItemsMissingRequiredFields() {
        List<CanonicalArticle> result = normalizer.normalize(List.of(
                RawArticle.builder().title("No url").publishedAt("2026-01-01").build(),
                RawArticle.builder().url("https://x/1").publishedAt("2026-01-01").build(),
                RawArticle.builder().title("Bad date").url("https://x/2").publishedAt("last Tuesday").build(),
                RawArticle.builder().title("Kept").url("https://x/3").publishedAt("2026-01-01").build()));

        assertThat(result).extracting(CanonicalArticle::getUrl).containsExactly("https://x/3");
    }

    @Test
    void parsesSupportedDateFormats() {
        assertThat(ArticleNormalizer.parseDate("2026-01-03T07:02:07Z")).isEqualTo(LocalDate.of(2026, 1, 3));
        assertThat(ArticleNormalizer.parseDate("2026-01-03T07:02:07")).isEqualTo(LocalDate.of(2026, 1, 3));
        assertThat(ArticleNormalizer.parseDate("2026-01-03 07:02:07")).isEqualTo(LocalDate.of(2026, 1, 3));
        assertThat(ArticleNormalizer.parseDate("2026-01-03")).isEqualTo(LocalDate.of(2026, 1, 3));
        assertThat(ArticleNormalizer.parseDate("03/01/2026")).isNull();
        assertThat(ArticleNormalizer.parseDate(null)).isNull();
    }
}
