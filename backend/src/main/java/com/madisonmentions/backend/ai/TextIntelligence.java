package com.madisonmentions.backend.ai;

import com.madisonmentions.backend.ai.dto.HeadlineRequest;
import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.ai.dto.RelevanceResult;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import java.util.Collection;
import java.util.List;

/**
 * Language-model operations used by resolution. Every operation has a deterministic
 * fallback, so callers never see a model failure.
 */
public interface TextIntelligence {

    /**
     * One summary per request, in request order.
     */
    List<String> summarizeBatch(List<HeadlineRequest> requests);

    /**
     * Infers current outlet and bio from articles ordered newest first.
     */
    ProfileResult generateProfile(String reporterName, List<CanonicalArticle> articles, String titleHint);

    RelevanceResult classify(String reporterName, Collection<String> outlets, List<String> summaries);
}
