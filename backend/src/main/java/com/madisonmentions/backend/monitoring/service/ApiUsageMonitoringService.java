package com.madisonmentions.backend.monitoring.service;

import com.madisonmentions.backend.monitoring.entity.ApiUsageLog;
import com.madisonmentions.backend.monitoring.repository.ApiUsageLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Ledger of upstream calls (providers and the chat model). Recording never fails the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiUsageMonitoringService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ApiUsageLogRepository apiUsageLogRepository;
    private final Clock clock;

    public void recordSuccess(String provider, String operation, int itemCount, long durationMs) {
        record(provider, operation, true, false, itemCount, durationMs, null);
    }

    public void recordFailure(String provider, String operation, boolean rateLimited, long durationMs, String errorMessage) {
        record(provider, operation, false, rateLimited, 0, durationMs, errorMessage);
    }

    private void record(String provider, String operation, boolean success, boolean rateLimited,
                        int itemCount, long durationMs, String errorMessage) {
        try {
            ApiUsageLog entry = ApiUsageLog.builder()
                    .provider(provider)
                    .operation(operation)
                    .success(success)
                    .rateLimited(rateLimited)
                    .itemCount(itemCount)
                    .durationMs(durationMs)
                    .errorMessage(truncate(errorMessage))
                    .build();
            apiUsageLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to log API usage for {} {}: {}", provider, operation, e.getMessage());
        }
    }

    /**
     * Per-provider call counts for the last hour and day plus the most recent failures.
     */
    public Map<String, Object> getUsageStats() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime oneHourAgo = now.minusHours(1);
        LocalDateTime oneDayAgo = now.minusDays(1);

        Map<String, Map<String, Object>> providerStats = new LinkedHashMap<>();
        for (String provider : apiUsageLogRepository.findDistinctProviders()) {
            Double avgDuration = apiUsageLogRepository.averageDurationByProviderSince(provider, oneDayAgo);
            providerStats.put(provider, Map.of(
                    "hourlyCalls", orZero(apiUsageLogRepository.countCallsByProviderSince(provider, oneHourAgo)),
                    "dailyCalls", orZero(apiUsageLogRepository.countCallsByProviderSince(provider, oneDayAgo)),
                    "dailyFailures", orZero(apiUsageLogRepository.countFailuresByProviderSince(provider, oneDayAgo)),
                    "dailyRateLimited", orZero(apiUsageLogRepository.countRateLimitedByProviderSince(provider, oneDayAgo)),
                    "averageDurationMs", avgDuration != null ? Math.round(avgDuration) : 0L
            ));
        }

        List<ApiUsageLog> recentFailures = apiUsageLogRepository.findFailedOperations(PageRequest.of(0, 10));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("providers", providerStats);
        stats.put("recentFailures", recentFailures);
        stats.put("timestamp", now);
        return stats;
    }

    public List<ApiUsageLog> getLogs(String provider, String operation, Boolean success, int limit) {
        return apiUsageLogRepository.findFiltered(provider, operation, success, PageRequest.of(0, Math.max(1, limit)));
    }

    private long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
