package com.ops.incident.controller;

import com.ops.incident.model.Incident;
import com.ops.incident.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Browse incidents, request LLM analysis, resolve")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @Operation(summary = "List recent incidents", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<Incident>> getIncidents(
            @Parameter(description = "Max number of incidents to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 0) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(incidentService.getRecentIncidents(limit));
    }

    @Operation(summary = "Get an incident by ID")
    @GetMapping("/{incidentId}")
    public ResponseEntity<Incident> getIncident(
            @Parameter(description = "Incident ID", example = "17")
            @PathVariable long incidentId) {
        Incident incident = incidentService.getIncident(incidentId);
        if (incident == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(incident);
    }

    @Operation(summary = "Get an incident with its AI analysis",
            description = "Generates a summary and likely root cause from the incident description and " +
                    "the last hour of logs on first request, stores it, and returns the incident. " +
                    "Without an LLM API key a fixed explanatory pair is returned instead.")
    @GetMapping("/{incidentId}/summary")
    public ResponseEntity<Incident> getIncidentSummary(
            @Parameter(description = "Incident ID", example = "17")
            @PathVariable long incidentId) {
        Incident incident = incidentService.getIncidentWithSummary(incidentId);
        if (incident == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(incident);
    }

    @Operation(summary = "Resolve an incident")
    @PatchMapping("/{incidentId}/resolve")
    public ResponseEntity<Incident> resolveIncident(
            @Parameter(description = "Incident ID", example = "17")
            @PathVariable long incidentId) {
        Incident incident = incidentService.resolve(incidentId);
        if (incident == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(incident);
    }
}
