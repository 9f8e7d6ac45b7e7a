package com.madisonmentions.backend.reporter.controller;

import com.madisonmentions.backend.common.InvalidInputException;
import com.madisonmentions.backend.reporter.dto.ReporterDossier;
import com.madisonmentions.backend.reporter.service.ReporterResolutionService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ReporterController {

    private final ReporterResolutionService resolutionService;

    /**
     * Dossier for a reporter. Served from storage when fresh; {@code refresh=true} forces an upstream update.
     */
    @GetMapping("/reporter/{name}")
    public ResponseEntity<?> getReporterDossier(@PathVariable String name,
                                                @RequestParam(defaultValue = "false") boolean refresh) {
        try {
            ReporterDossier dossier = resolutionService.resolve(name, refresh);
            return ResponseEntity.ok(dossier);
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error resolving reporter '{}': {}", name, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to resolve reporter: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
