package com.madisonmentions.backend.monitoring.controller;

import com.madisonmentions.backend.monitoring.entity.ApiUsageLog;
import com.madisonmentions.backend.monitoring.service.ApiUsageMonitoringService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApiMonitoringController.class)
class ApiMonitoringControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ApiUsageMonitoringService monitoringService;

    @Test
    void filtersAreHandedToTheQuery() throws Exception {
        when(monitoringService.getLogs("newsapi", "FIND_IDENTITY", false, 1)).thenReturn(List.of(ApiUsageLog.builder()
                .provider("newsapi")
                .operation("FIND_IDENTITY")
                .success(false)
                .rateLimited(false)
                .build()));

        mockMvc.perform(get("/api/monitoring/api-usage/logs")
                        .param("limit", "1")
                        .param("provider", "newsapi")
                        .param("operation", "FIND_IDENTITY")
                        .param("success", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].provider").value("newsapi"));
    }

    @Test
    void limitIsClamped() throws Exception {
        when(monitoringService.getLogs(null, null, null, 1000)).thenReturn(List.of());

        mockMvc.perform(get("/api/monitoring/api-usage/logs").param("limit", "50000"))
                .andExpect(status().isOk());

        verify(monitoringService).getLogs(null, null, null, 1000);
    }
}
