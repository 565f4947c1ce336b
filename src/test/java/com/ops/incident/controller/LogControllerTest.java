package com.ops.incident.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ops.incident.model.IngestLogsRequest;
import com.ops.incident.model.LogEntry;
import com.ops.incident.service.LogIngestionService;
import com.ops.incident.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LogController.class)
class LogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LogIngestionService ingestionService;

    @Test
    void ingestLogs_accepted() throws Exception {
        List<LogEntry> stored = TestDataFactory.createLogEntries(2, "error");
        when(ingestionService.ingest(anyList())).thenReturn(stored);

        String body = "{\"logs\": ["
                + "{\"timestamp\": \"2026-10-19T10:00:00Z\", \"service\": \"api\", \"level\": \"error\", \"message\": \"boom\"},"
                + "{\"service\": \"api\", \"level\": \"info\", \"message\": \"ok\", \"metadata\": {\"host\": \"web-1\"}}"
                + "]}";

        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void ingestLogs_emptyList_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new IngestLogsRequest(List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("no logs provided"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestLogs_missingLogsField_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("no logs provided"));
    }

    @Test
    void getRecentLogs_defaultLimit() throws Exception {
        when(ingestionService.getRecentLogs(100)).thenReturn(TestDataFactory.createLogEntries(3, "info"));

        mockMvc.perform(get("/api/v1/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].service").value("api"))
                .andExpect(jsonPath("$[0].timestamp").value("2026-10-19T10:00:00Z"));
    }

    @Test
    void getRecentLogs_customLimit() throws Exception {
        when(ingestionService.getRecentLogs(5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/logs").param("limit", "5"))
                .andExpect(status().isOk());

        verify(ingestionService).getRecentLogs(5);
    }

    @Test
    void getRecentLogs_negativeLimit_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/logs").param("limit", "-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ingestionService);
    }
}
