package com.madisonmentions.backend.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.madisonmentions.backend.ai.dto.HeadlineRequest;
import com.madisonmentions.backend.ai.dto.ProfileResult;
import com.madisonmentions.backend.ai.dto.RelevanceResult;
import com.madisonmentions.backend.analysis.OutletTrendAnalyzer;
import com.madisonmentions.backend.analysis.dto.CanonicalArticle;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

/**
 * {@link TextIntelligence} backed by the configured Spring AI chat model.
 */
@Service
@Slf4j
public class SpringAiTextIntelligence implements TextIntelligence {

    static final String USAGE_PROVIDER = "chat-model";
    static final int SUMMARY_BATCH_SIZE = 10;
    static final int FALLBACK_SUMMARY_LENGTH = 100;
    static final int PROFILE_ARTICLE_LIMIT = 30;
    static final int CLASSIFY_SUMMARY_LIMIT = 10;
    static final int KEYWORD_THRESHOLD = 3;

    static final List<String> RELEVANCE_KEYWORDS = List.of(
            "law", "accounting", "tax", "consulting", "m&a", "audit",
            "compliance", "advisory", "cfo", "legal", "regulation",
            "finance", "banking", "private equity", "venture capital",
            "restructuring", "litigation", "governance", "fiduciary");

    private static final String SUMMARIZE_PROMPT = """
            Summarize each of these news article headlines in one concise sentence each.
            Focus on what the article is about and what beat/topic it covers.
            Write for a PR professional researching the reporter.

            Headlines:
            %s

            Provide exactly %d summaries, numbered to match the headlines above.
            Keep each summary to one sentence, under 100 characters if possible.""";

    private static final String PROFILE_PROMPT = """
            You are analyzing a journalist's recent article history for a PR professional.

            Reporter: %s%s

            Recent articles:
            %s

            Based on this data, provide two things:

            1. CURRENT OUTLET: Determine the reporter's current primary outlet. Account for syndication: if the same articles appear across multiple papers in the same network (e.g., McClatchy, Gannett), identify the reporter's home paper, not every syndication partner. Give just the outlet name.

            2. BIO: Write a 2-3 sentence mini-bio describing what this reporter covers. Write it as prose suitable for a PR professional audience. Do not use bullet points or lists. Focus on their beat and coverage areas.

            Respond in this exact JSON format:
            {"current_outlet": "Outlet Name", "reporter_bio": "Two to three sentences about the reporter."}""";

    private static final String CLASSIFY_PROMPT = """
            You are classifying a journalist for a PR tool used by professional services firms (law, accounting, consulting, financial advisory).

            Reporter: %s
            Outlets: %s

            Recent article summaries:
            %s

            Question: Is this reporter relevant to professional services firms? A relevant reporter covers topics like: legal industry, accounting/audit, tax policy, M&A/deals, management consulting, financial regulation, corporate governance, bankruptcy/restructuring, or business topics where professional services firms are key players.

            Respond in this exact JSON format:
            {"relevant": true, "rationale": "One sentence explaining why."}

            If the reporter primarily covers sports, entertainment, lifestyle, weather, local crime, or other unrelated beats, mark them as not relevant.""";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final OutletTrendAnalyzer outletTrendAnalyzer;
    private final ApiUsageMonitoringService monitoringService;

    public SpringAiTextIntelligence(ChatClient.Builder builder,
                                    ObjectMapper objectMapper,
                                    OutletTrendAnalyzer outletTrendAnalyzer,
                                    ApiUsageMonitoringService monitoringService) {
        this.chatClient = builder.build();
        this.objectMapper = objectMapper;
        this.outletTrendAnalyzer = outletTrendAnalyzer;
        this.monitoringService = monitoringService;
    }

    @Override
    public List<String> summarizeBatch(List<HeadlineRequest> requests) {
        List<String> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i += SUMMARY_BATCH_SIZE) {
            List<HeadlineRequest> chunk = requests.subList(i, Math.min(i + SUMMARY_BATCH_SIZE, requests.size()));
            results.addAll(summarizeChunk(chunk));
        }
        return results;
    }

    private List<String> summarizeChunk(List<HeadlineRequest> chunk) {
        StringBuilder headlines = new StringBuilder();
        for (int i = 0; i < chunk.size(); i++) {
            HeadlineRequest request = chunk.get(i);
            headlines.append(String.format("%d. [%s] %s%n", i + 1, request.getOutlet(), request.getHeadline()));
        }

        List<String> summaries = new ArrayList<>();
        try {
            String response = prompt("SUMMARIZE", String.format(SUMMARIZE_PROMPT, headlines.toString().trim(), chunk.size()));
            summaries.addAll(parseNumberedLines(response, chunk.size()));
        } catch (Exception e) {
            log.error("Error in batch summarization: {}", e.getMessage());
        }

        // Unanswered positions fall back to the headline
        for (int i = summaries.size(); i < chunk.size(); i++) {
            summaries.add(fallbackSummary(chunk.get(i).getHeadline()));
        }
        return summaries;
    }

    @Override
    public ProfileResult generateProfile(String reporterName, List<CanonicalArticle> articles, String titleHint) {
        if (articles == null || articles.isEmpty()) {
            return ProfileResult.empty();
        }

        StringBuilder lines = new StringBuilder();
        for (CanonicalArticle article : articles.subList(0, Math.min(PROFILE_ARTICLE_LIMIT, articles.size()))) {
            lines.append(String.format("- \"%s\" | %s | %s", article.getHeadline(), article.getOutlet(), article.getPublishedDate()));
            if (article.getTopics() != null && !article.getTopics().isEmpty()) {
                lines.append(" | Topics: ").append(String.join(", ", article.getTopics()));
            }
            lines.append('\n');
        }
        String hint = titleHint != null && !titleHint.isBlank() ? "\nKnown title/role: " + titleHint : "";

        try {
            String response = prompt("GENERATE_PROFILE", String.format(PROFILE_PROMPT, reporterName, hint, lines.toString().trim()));
            ProfileResult result = objectMapper.readValue(extractJsonObject(response), ProfileResult.class);
            log.info("Generated profile for {}: outlet={}", reporterName, result.getCurrentOutlet());
            return result;
        } catch (Exception e) {
            log.error("Profile generation failed for {}, using most common outlet: {}", reporterName, e.getMessage());
            return new ProfileResult(outletTrendAnalyzer.mostCommonOutlet(articles).orElse(null), null);
        }
    }

    @Override
    public RelevanceResult classify(String reporterName, Collection<String> outlets, List<String> summaries) {
        List<String> limited = summaries.subList(0, Math.min(CLASSIFY_SUMMARY_LIMIT, summaries.size()));
        String outletsText = outlets.isEmpty() ? "Unknown" : String.join(", ", outlets);
        StringBuilder summaryLines = new StringBuilder();
        for (String summary : limited) {
            summaryLines.append("- ").append(summary).append('\n');
        }

        try {
            String response = prompt("CLASSIFY", String.format(CLASSIFY_PROMPT, reporterName, outletsText, summaryLines.toString().trim()));
            RelevanceResult result = objectMapper.readValue(extractJsonObject(response), RelevanceResult.class);
            log.info("Classified {} as {}", reporterName, result.isRelevant() ? "relevant" : "not relevant");
            return result;
        } catch (Exception e) {
            log.error("Classification failed for {}, using keyword heuristic: {}", reporterName, e.getMessage());
            return keywordClassification(outlets, summaries);
        }
    }

    static RelevanceResult keywordClassification(Collection<String> outlets, List<String> summaries) {
        String text = (String.join(" ", summaries) + " " + String.join(" ", outlets)).toLowerCase(Locale.ROOT);
        long matches = RELEVANCE_KEYWORDS.stream().filter(text::contains).count();
        if (matches >= KEYWORD_THRESHOLD) {
            return new RelevanceResult(true,
                    "Keyword-based classification: multiple professional services terms found in recent coverage.");
        }
        return new RelevanceResult(false,
                "Keyword-based classification: few professional services terms found in recent coverage.");
    }

    static String fallbackSummary(String headline) {
        if (headline == null) {
            return "";
        }
        return headline.length() <= FALLBACK_SUMMARY_LENGTH ? headline : headline.substring(0, FALLBACK_SUMMARY_LENGTH);
    }

    /**
     * Lines starting with a digit, with the "1." / "2)" prefix stripped, in order.
     */
    static List<String> parseNumberedLines(String response, int expected) {
        List<String> summaries = new ArrayList<>();
        if (response == null) {
            return summaries;
        }
        for (String raw : response.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || !Character.isDigit(line.charAt(0))) {
                continue;
            }
            String summary = line.replaceFirst("^[0-9.)\\-:\\s]+", "").trim();
            if (!summary.isEmpty() && summaries.size() < expected) {
                summaries.add(summary);
            }
        }
        return summaries;
    }

    /**
     * Strips markdown fences and surrounding prose around the first JSON object.
     */
    static String extractJsonObject(String response) {
        if (response == null) {
            return "{}";
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return response.substring(start, end + 1);
        }
        return response.trim();
    }

    private String prompt(String operation, String text) {
        long started = System.currentTimeMillis();
        try {
            String content = chatClient
                    .prompt()
                    .user(text)
                    .call()
                    .content();
            monitoringService.recordSuccess(USAGE_PROVIDER, operation, content != null ? 1 : 0,
                    System.currentTimeMillis() - started);
            return content;
        } catch (RuntimeException e) {
            monitoringService.recordFailure(USAGE_PROVIDER, operation, false,
                    System.currentTimeMillis() - started, e.getMessage());
            throw e;
        }
    }
}
