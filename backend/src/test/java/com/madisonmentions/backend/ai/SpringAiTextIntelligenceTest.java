package com.madisonmentions.backend.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.madisonmentions.backend.ai.dto.HeadlineRequest;
import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.ai.dto.RelevanceResult;
import com.madisonmentions.backend.analysis.OutletTrendAnalyzer;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringAiTextIntelligenceTest {

    ChatClient chatClient;
    ApiUsageMonitoringService monitoring;
    SpringAiTextIntelligence intelligence;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);
        monitoring = mock(ApiUsageMonitoringService.class);
        intelligence = new SpringAiTextIntelligence(builder, new ObjectMapper(), new OutletTrendAnalyzer(180), monitoring);
    }

    private void modelAnswers(String first, String... rest) {
        when(chatClient.prompt().user(anyString()).call().content()).thenReturn(first, rest);
    }

    private void modelFails() {
        when(chatClient.prompt().user(anyString()).call().content()).thenThrow(new RuntimeException("model unavailable"));
    }

    @Test
    void summariesFollowHeadlineOrder() {
        modelAnswers("Here you go:\n1. Fed keeps rates steady.\n2) Two banks agree to merge.");

        List<String> summaries = intelligence.summarizeBatch(List.of(
                new HeadlineRequest("Fed holds", "Reuters"),
                new HeadlineRequest("Bank merger", "WSJ")));

        assertThat(summaries).containsExactly("Fed keeps rates steady.", "Two banks agree to merge.");
        verify(monitoring).recordSuccess(eq("chat-model"), eq("SUMMARIZE"), eq(1), anyLong());
    }

    @Test
    void missingSummaryFallsBackToTruncatedHeadline() {
        String longHeadline = "x".repeat(150);
        modelAnswers("1. Only one answer.");

        List<String> summaries = intelligence.summarizeBatch(List.of(
                new HeadlineRequest("First", "Reuters"),
                new HeadlineRequest(longHeadline, "WSJ")));

        assertThat(summaries).containsExactly("Only one answer.", "x".repeat(100));
    }

    @Test
    void largeBatchesAreSplitIntoChunksOfTen() {
        StringBuilder firstChunk = new StringBuilder();
        for (int i = 1; i <= 10; i++) {
            firstChunk.append(i).append(". summary ").append(i).append('\n');
        }
        modelAnswers(firstChunk.toString(), "1. summary 11\n2. summary 12");

        List<HeadlineRequest> requests = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            requests.add(new HeadlineRequest("headline " + i, "Reuters"));
        }

        List<String> summaries = intelligence.summarizeBatch(requests);

        assertThat(summaries).hasSize(12);
        assertThat(summaries.get(10)).isEqualTo("summary 11");
        assertThat(summaries.get(11)).isEqualTo("summary 12");
    }

    @Test
    void modelFailureLeavesHeadlines() {
        modelFails();

        List<String> summaries = intelligence.summarizeBatch(List.of(new HeadlineRequest("Fed holds", "Reuters")));

        assertThat(summaries).containsExactly("Fed holds");
        verify(monitoring).recordFailure(eq("chat-model"), eq("SUMMARIZE"), eq(false), anyLong(), eq("model unavailable"));
    }

    @Test
    void profileIsParsedFromFencedJson() {
        modelAnswers("```json\n{\"current_outlet\": \"Reuters\", \"reporter_bio\": \"Covers monetary policy.\"}\n```");

        ProfileResult profile = intelligence.generateProfile("Jane Doe", articles("Reuters", "Reuters", "WSJ"), null);

        assertThat(profile.getCurrentOutlet()).isEqualTo("Reuters");
        assertThat(profile.getReporterBio()).isEqualTo("Covers monetary policy.");
    }

    @Test
    void profileFailureUsesMostCommonOutletWithoutBio() {
        modelFails();

        ProfileResult profile = intelligence.generateProfile("Jane Doe", articles("WSJ", "Reuters", "WSJ"), "Reporter");

        assertThat(profile.getCurrentOutlet()).isEqualTo("WSJ");
        assertThat(profile.getReporterBio()).isNull();
    }

    @Test
    void noArticlesMeansEmptyProfileWithoutModelCall() {
        ProfileResult profile = intelligence.generateProfile("Jane Doe", List.of(), null);

        assertThat(profile.getCurrentOutlet()).isNull();
        assertThat(profile.getReporterBio()).isNull();
    }

    @Test
    void classificationIsParsedFromModelAnswer() {
        modelAnswers("{\"relevant\": false, \"rationale\": \"Covers college football.\"}");

        RelevanceResult result = intelligence.classify("Jane Doe", Set.of("ESPN"), List.of("Playoff preview"));

        assertThat(result.isRelevant()).isFalse();
        assertThat(result.getRationale()).isEqualTo("Covers college football.");
    }

    @Test
    void classificationFailureUsesKeywordHeuristic() {
        modelFails();

        RelevanceResult result = intelligence.classify("Jane Doe", Set.of("Reuters"),
                List.of("New tax rules for audit firms", "Compliance costs rise"));

        assertThat(result.isRelevant()).isTrue();
        assertThat(result.getRationale()).startsWith("Keyword-based classification");
    }

    @Test
    void keywordHeuristicNeedsThreeDistinctTerms() {
        assertThat(SpringAiTextIntelligence.keywordClassification(List.of("ESPN"), List.of("tax day traffic")).isRelevant())
                .isFalse();
        assertThat(SpringAiTextIntelligence.keywordClassification(List.of("Law360"),
                List.of("Litigation funding grows", "Private equity deal")).isRelevant())
                .isTrue();
    }

    private static List<CanonicalArticle> articles(String... outlets) {
        List<CanonicalArticle> articles = new ArrayList<>();
        for (int i = 0; i < outlets.length; i++) {
            articles.add(CanonicalArticle.builder()
                    .headline("Headline " + i)
                    .outlet(outlets[i])
                    .publishedDate(LocalDate.of(2026, 10, 1).minusDays(i))
                    .url("https://example.com/" + i)
                    .build());
        }
        return articles;
    }
}
