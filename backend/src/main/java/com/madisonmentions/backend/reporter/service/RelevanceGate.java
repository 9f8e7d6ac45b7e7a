package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.ai.TextIntelligence;
import com.madisonmentions.backend.ai.dto.RelevanceResult;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.reporter.entity.RelevanceVerdict;
import com.madisonmentions.backend.reporter.entity.Reporter;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies a reporter the first time there is coverage to judge, then never again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelevanceGate {

    static final int MAX_SUMMARIES = 10;

    private final ReporterStore reporterStore;
    private final TextIntelligence textIntelligence;

    /**
     * Returns true when this call stored a verdict.
     */
    public boolean classifyIfUnknown(Reporter reporter, List<CanonicalArticle> articles) {
        if (reporter.getRelevance() != null && reporter.getRelevance().isDecided()) {
            return false;
        }
        if (articles.isEmpty()) {
            log.debug("No coverage yet for {}, deferring classification", reporter.getName());
            return false;
        }

        TreeSet<String> outlets = new TreeSet<>();
        articles.stream()
                .map(CanonicalArticle::getOutlet)
                .filter(Objects::nonNull)
                .forEach(outlets::add);
        List<String> summaries = articles.stream()
                .limit(MAX_SUMMARIES)
                .map(a -> a.getSummary() != null && !a.getSummary().isBlank() ? a.getSummary() : a.getHeadline())
                .toList();

        RelevanceResult result = textIntelligence.classify(reporter.getName(), outlets, summaries);
        boolean written = reporterStore.updateRelevance(reporter.getId(),
                RelevanceVerdict.of(result.isRelevant()), result.getRationale());
        if (written) {
            log.info("🏷️ Classified {} as {}", reporter.getName(), RelevanceVerdict.of(result.isRelevant()));
        }
        return written;
    }
}
