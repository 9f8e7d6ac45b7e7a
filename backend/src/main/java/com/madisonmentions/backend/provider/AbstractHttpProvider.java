package com.madisonmentions.backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Shared call handling for HTTP providers: timing, usage logging, and the failure policy
 * (429 becomes {@link ProviderRateLimitedException}, anything else becomes "no data").
 */
@Slf4j
public abstract class AbstractHttpProvider implements ArticleProvider {

    protected static final String OP_FIND_IDENTITY = "FIND_IDENTITY";
    protected static final String OP_FETCH_ARTICLES = "FETCH_ARTICLES";
    protected static final String OP_FETCH_BY_TOPIC = "FETCH_BY_TOPIC";

    protected final RestTemplate restTemplate;
    protected final ApiUsageMonitoringService monitoringService;

    protected AbstractHttpProvider(RestTemplate restTemplate, ApiUsageMonitoringService monitoringService) {
        this.restTemplate = restTemplate;
        this.monitoringService = monitoringService;
    }

    protected abstract String getBaseUrl();

    protected <T> T call(String operation, Supplier<T> request, T emptyValue) {
        long started = System.currentTimeMillis();
        try {
            T result = request.get();
            monitoringService.recordSuccess(key(), operation, sizeOf(result), System.currentTimeMillis() - started);
            return result != null ? result : emptyValue;
        } catch (RestClientResponseException e) {
            long elapsed = System.currentTimeMillis() - started;
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("⚠️ {} rate limited during {}", key(), operation);
                monitoringService.recordFailure(key(), operation, true, elapsed, e.getMessage());
                throw new ProviderRateLimitedException(key(), key() + " rate limited during " + operation);
            }
            log.warn("{} {} failed with HTTP {}: {}", key(), operation, e.getStatusCode().value(), e.getMessage());
            monitoringService.recordFailure(key(), operation, false, elapsed, e.getMessage());
            return emptyValue;
        } catch (ProviderRateLimitedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} {} failed: {}", key(), operation, e.getMessage());
            monitoringService.recordFailure(key(), operation, false, System.currentTimeMillis() - started, e.getMessage());
            return emptyValue;
        }
    }

    protected static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private int sizeOf(Object result) {
        if (result instanceof Collection<?> collection) {
            return collection.size();
        }
        if (result instanceof Optional<?> optional) {
            return optional.isPresent() ? 1 : 0;
        }
        return result != null ? 1 : 0;
    }
}
