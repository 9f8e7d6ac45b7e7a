package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.ai.TextIntelligence;
import com.madisonmentions.backend.ai.dto.RelevanceResult;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelevanceGateTest {

    @Mock
    ReporterStore reporterStore;
    @Mock
    TextIntelligence textIntelligence;

    @InjectMocks
    RelevanceGate gate;

    @Test
    void decidedVerdictIsNeverRevisited() {
        Reporter reporter = Reporter.builder().id(1L).name("jane doe").relevance(RelevanceVerdict.NOT_RELEVANT).build();

        assertThat(gate.classifyIfUnknown(reporter, articles(3))).isFalse();
        verifyNoInteractions(textIntelligence, reporterStore);
    }

    @Test
    void classificationIsDeferredWithoutArticles() {
        Reporter reporter = Reporter.builder().id(1L).name("jane doe").build();

        assertThat(gate.classifyIfUnknown(reporter, List.of())).isFalse();
        verifyNoInteractions(textIntelligence, reporterStore);
    }

    @SuppressWarnings("unchecked")
    @Test
    void classifiesWithSortedOutletsAndAtMostTenSummaries() {
        Reporter reporter = Reporter.builder().id(7L).name("jane doe").build();
        List<CanonicalArticle> articles = articles(12);
        articles.set(0, articles.get(0).toBuilder().summary(null).build());
        when(textIntelligence.classify(eq("jane doe"), any(), anyList()))
                .thenReturn(new RelevanceResult(true, "Covers M&A"));
        when(reporterStore.updateRelevance(7L, RelevanceVerdict.RELEVANT, "Covers M&A")).thenReturn(true);

        assertThat(gate.classifyIfUnknown(reporter, articles)).isTrue();

        ArgumentCaptor<Collection<String>> outlets = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<List<String>> summaries = ArgumentCaptor.forClass(List.class);
        verify(textIntelligence).classify(eq("jane doe"), outlets.capture(), summaries.capture());
        assertThat(outlets.getValue()).containsExactly("Axios", "Reuters");
        assertThat(summaries.getValue()).hasSize(10);
        assertThat(summaries.getValue().get(0)).isEqualTo("Headline 0");
        assertThat(summaries.getValue().get(1)).isEqualTo("Summary 1");
    }

    @Test
    void lostRaceReportsNothingWritten() {
        Reporter reporter = Reporter.builder().id(7L).name("jane doe").build();
        when(textIntelligence.classify(any(), any(), anyList())).thenReturn(new RelevanceResult(false, "Sports"));
        when(reporterStore.updateRelevance(7L, RelevanceVerdict.NOT_RELEVANT, "Sports")).thenReturn(false);

        assertThat(gate.classifyIfUnknown(reporter, articles(2))).isFalse();
        verify(reporterStore, never()).findById(any());
    }

    static List<CanonicalArticle> articles(int count) {
        List<CanonicalArticle> articles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            articles.add(CanonicalArticle.builder()
                    .headline("Headline " + i)
                    .summary("Summary " + i)
                    .outlet(i % 2 == 0 ? "Reuters" : "Axios")
                    .publishedDate(LocalDate.of(2026, 9, 1).minusDays(i))
                    .url("https://example.com/" + i)
                    .build());
        }
        return articles;
    }
}
