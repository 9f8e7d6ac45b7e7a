package com.madisonmentions.backend.monitoring.controller;

import com.madisonmentions.backend.monitoring.entity.ApiUsageLog;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class ApiMonitoringController {

    private final ApiUsageMonitoringService monitoringService;

    /**
     * Get upstream call statistics per provider
     */
    @GetMapping("/api-usage")
    public ResponseEntity<Map<String, Object>> getApiUsage() {
        return ResponseEntity.ok(monitoringService.getUsageStats());
    }

    /**
     * Get upstream call logs with filtering
     */
    @GetMapping("/api-usage/logs")
    public ResponseEntity<List<ApiUsageLog>> getApiUsageLogs(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String operation,
            @RequestParam(required = false) Boolean success) {

        int clamped = Math.max(1, Math.min(limit, 1000));
        return ResponseEntity.ok(monitoringService.getLogs(provider, operation, success, clamped));
    }
}
