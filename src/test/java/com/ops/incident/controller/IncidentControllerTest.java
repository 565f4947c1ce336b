package com.ops.incident.controller;

import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.Incident;
import com.ops.incident.model.IncidentStatus;
import com.ops.incident.service.IncidentService;
import com.ops.incident.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IncidentController.class)
class IncidentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IncidentService incidentService;

    @Test
    void getIncidents_newestFirst() throws Exception {
        when(incidentService.getRecentIncidents(100)).thenReturn(List.of(
                TestDataFactory.createIncident(2L, AnomalySeverity.MEDIUM, "High error rate in checkout"),
                TestDataFactory.createIncident(1L, AnomalySeverity.HIGH, "Error rate spike detected")));

        mockMvc.perform(get("/api/v1/incidents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(2))
                .andExpect(jsonPath("$[0].status").value("open"))
                .andExpect(jsonPath("$[0].severity").value("medium"))
                .andExpect(jsonPath("$[1].severity").value("high"));
    }

    @Test
    void getIncidents_negativeLimit_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/incidents").param("limit", "-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(incidentService);
    }

    @Test
    void getIncident_found() throws Exception {
        when(incidentService.getIncident(5L))
                .thenReturn(TestDataFactory.createIncident(5L, AnomalySeverity.HIGH, "spike"));

        mockMvc.perform(get("/api/v1/incidents/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.description").value("spike"))
                .andExpect(jsonPath("$.createdAt").value("2026-10-19T10:00:00Z"));
    }

    @Test
    void getIncident_notFound() throws Exception {
        when(incidentService.getIncident(404L)).thenReturn(null);

        mockMvc.perform(get("/api/v1/incidents/404"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getIncidentSummary_returnsAnalysis() throws Exception {
        Incident incident = TestDataFactory.createIncident(5L, AnomalySeverity.HIGH, "spike");
        incident.setSummary("Checkout errors surged");
        incident.setRootCause("Gateway timeouts");
        when(incidentService.getIncidentWithSummary(5L)).thenReturn(incident);

        mockMvc.perform(get("/api/v1/incidents/5/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Checkout errors surged"))
                .andExpect(jsonPath("$.rootCause").value("Gateway timeouts"));
    }

    @Test
    void getIncidentSummary_notFound() throws Exception {
        when(incidentService.getIncidentWithSummary(9L)).thenReturn(null);

        mockMvc.perform(get("/api/v1/incidents/9/summary"))
                .andExpect(status().isNotFound());
    }

    @Test
    void resolveIncident_resolved() throws Exception {
        Incident incident = TestDataFactory.createIncident(5L, AnomalySeverity.HIGH, "spike");
        incident.setStatus(IncidentStatus.RESOLVED);
        incident.setResolvedAt(Instant.parse("2026-10-19T11:00:00Z"));
        when(incidentService.resolve(5L)).thenReturn(incident);

        mockMvc.perform(patch("/api/v1/incidents/5/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"))
                .andExpect(jsonPath("$.resolvedAt").value("2026-10-19T11:00:00Z"));
    }

    @Test
    void resolveIncident_notFound() throws Exception {
        when(incidentService.resolve(8L)).thenReturn(null);

        mockMvc.perform(patch("/api/v1/incidents/8/resolve"))
                .andExpect(status().isNotFound());
    }
}
