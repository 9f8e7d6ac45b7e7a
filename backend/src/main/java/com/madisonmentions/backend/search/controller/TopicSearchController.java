package com.madisonmentions.backend.search.controller;

import com.madisonmentions.backend.common.InvalidInputException;
import com.madisonmentions.backend.search.dto.ReporterSearchResult;
import com.madisonmentions.backend.search.service.TopicSearchService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reporters")
@RequiredArgsConstructor
@Slf4j
public class TopicSearchController {

    private final TopicSearchService topicSearchService;

    /**
     * Reporters covering a topic, e.g. {@code /api/reporters/search?topic=antitrust&limit=10}
     */
    @GetMapping("/search")
    public ResponseEntity<?> searchByTopic(@RequestParam String topic,
                                           @RequestParam(defaultValue = "10") int limit) {
        try {
            List<ReporterSearchResult> results = topicSearchService.search(topic, limit);
            return ResponseEntity.ok(results);
        } catch (InvalidInputException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error searching topic '{}': {}", topic, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Topic search failed: " + e.getMessage()));
        }
    }
}
