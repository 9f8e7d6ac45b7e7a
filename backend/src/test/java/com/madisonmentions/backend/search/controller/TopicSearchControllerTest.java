package com.madisonmentions.backend.search.controller;

import com.madisonmentions.backend.common.InvalidInputException;
import com.madisonmentions.backend.search.dto.ReporterSearchResult;
import com.madisonmentions.backend.search.service.TopicSearchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TopicSearchController.class)
class TopicSearchControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    TopicSearchService topicSearchService;

    @Test
    void defaultLimitIsTen() throws Exception {
        when(topicSearchService.search("antitrust", 10)).thenReturn(List.of(ReporterSearchResult.builder()
                .name("Jane Doe")
                .outlets(List.of("Reuters"))
                .provider("perigon")
                .externalId("j-42")
                .build()));

        mockMvc.perform(get("/api/reporters/search").param("topic", "antitrust"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Jane Doe"))
                .andExpect(jsonPath("$[0].external_id").value("j-42"));
    }

    @Test
    void shortTopicIsBadRequest() throws Exception {
        when(topicSearchService.search("a", 10)).thenThrow(new InvalidInputException("Topic must be at least 2 characters"));

        mockMvc.perform(get("/api/reporters/search").param("topic", "a"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Topic must be at least 2 characters"));
    }

    @Test
    void internalArgumentErrorIsServerError() throws Exception {
        when(topicSearchService.search("antitrust", 10)).thenThrow(new IllegalArgumentException("Illegal page size"));

        mockMvc.perform(get("/api/reporters/search").param("topic", "antitrust"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Topic search failed: Illegal page size"));
    }
}
