package com.madisonmentions.backend.reporter.controller;

import com.madisonmentions.backend.reporter.dto.ReporterImportRequest;
import com.madisonmentions.backend.reporter.dto.ReporterImportResult;
import com.madisonmentions.backend.reporter.service.ReporterImportService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/import")
@RequiredArgsConstructor
@Slf4j
public class ReporterImportController {

    private final ReporterImportService importService;

    /**
     * Import reporters from an uploaded list. Rows with an existing name are skipped unless
     * {@code skip_duplicates} is false, in which case the provided fields are merged in.
     */
    @PostMapping("/reporters")
    public ResponseEntity<?> importReporters(@Valid @RequestBody ReporterImportRequest request) {
        try {
            if (request.getReporters().isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "No reporters provided"));
            }
            ReporterImportResult result = importService.importReporters(request.getReporters(), request.isSkipDuplicates());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("Error importing reporters: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to import reporters: " + e.getMessage()));
        }
    }
}
