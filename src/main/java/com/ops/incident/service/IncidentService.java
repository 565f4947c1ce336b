package com.ops.incident.service;

import com.ops.incident.config.LlmConfig;
import com.ops.incident.config.MetricsConfig;
import com.ops.incident.model.Incident;
import com.ops.incident.model.IncidentStatus;
import com.ops.incident.model.IncidentSummary;
import com.ops.incident.model.LogEntry;
import com.ops.incident.repository.IncidentRepository;
import com.ops.incident.repository.LogRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class IncidentService {

    private static final Logger log = LoggerFactory.getLogger(IncidentService.class);

    private final IncidentRepository incidentRepository;
    private final LogRepository logRepository;
    private final LlmSummaryService summaryService;
    private final LlmConfig llmConfig;
    private final MetricsConfig metricsConfig;

    public IncidentService(IncidentRepository incidentRepository,
                           LogRepository logRepository,
                           LlmSummaryService summaryService,
                           LlmConfig llmConfig,
                           MetricsConfig metricsConfig) {
        this.incidentRepository = incidentRepository;
        this.logRepository = logRepository;
        this.summaryService = summaryService;
        this.llmConfig = llmConfig;
        this.metricsConfig = metricsConfig;
    }

    public List<Incident> getRecentIncidents(int limit) {
        return incidentRepository.findRecent(limit);
    }

    public Incident getIncident(long id) {
        return incidentRepository.findById(id);
    }

    /**
     * Return the incident with its summary and root cause, generating them on first request.
     * Fallback pairs (model unconfigured or failing) are returned but not stored, so a later
     * request can still produce a real analysis.
     *
     * @return the incident, or null if it does not exist
     */
    @Observed(name = "incident.summary", contextualName = "get-incident-summary")
    public Incident getIncidentWithSummary(long id) {
        Incident incident = incidentRepository.findById(id);
        if (incident == null) {
            return null;
        }
        if (incident.hasSummary()) {
            return incident;
        }

        Instant since = Instant.now().minus(llmConfig.getContextWindow());
        List<LogEntry> recentLogs = logRepository.findSince(since, llmConfig.getContextFetchLimit());
        IncidentSummary analysis = summaryService.summarize(incident.getDescription(), recentLogs);

        if (analysis.generated()) {
            incidentRepository.updateSummary(id, analysis.summary(), analysis.rootCause());
            log.info("Stored LLM analysis for incident={}", id);
        }

        incident.setSummary(analysis.summary());
        incident.setRootCause(analysis.rootCause());
        return incident;
    }

    /**
     * @return the resolved incident, or null if it does not exist
     */
    public Incident resolve(long id) {
        Incident incident = incidentRepository.findById(id);
        if (incident == null) {
            return null;
        }
        if (incident.getStatus() != IncidentStatus.RESOLVED) {
            Instant now = Instant.now();
            incidentRepository.markResolved(id, now);
            incident.setStatus(IncidentStatus.RESOLVED);
            incident.setResolvedAt(now);
            metricsConfig.updateOpenIncidentCount(incidentRepository.countOpen());
            log.info("Incident {} resolved", id);
        }
        return incident;
    }
}
