package com.ops.incident.service;

import com.ops.incident.config.DetectionConfig;
import com.ops.incident.config.MetricsConfig;
import com.ops.incident.engine.AnomalyEngine;
import com.ops.incident.model.AnomalyRecord;
import com.ops.incident.model.DetectionReport;
import com.ops.incident.model.DetectionRun;
import com.ops.incident.model.Incident;
import com.ops.incident.model.IncidentStatus;
import com.ops.incident.model.LogEntry;
import com.ops.incident.repository.IncidentRepository;
import com.ops.incident.repository.LogRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Main orchestrator for detection runs over stored logs.
 *
 * Flow:
 * 1. Load logs from the lookback window (newest first, capped at fetchLimit)
 * 2. Skip the run if fewer than minLogs were found
 * 3. Run the AnomalyEngine over the batch
 * 4. Open one incident per anomaly
 * 5. Alert on each incident (failures are logged, never abort the run)
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String NOT_ENOUGH_LOGS = "Not enough logs for anomaly detection";
    static final String NO_ANOMALIES = "No anomalies detected";

    private final LogRepository logRepository;
    private final IncidentRepository incidentRepository;
    private final AnomalyEngine anomalyEngine;
    private final DetectionConfig config;
    private final WebhookNotificationService webhookNotificationService;
    private final TwilioNotificationService twilioNotificationService;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(LogRepository logRepository,
                                   IncidentRepository incidentRepository,
                                   AnomalyEngine anomalyEngine,
                                   DetectionConfig config,
                                   WebhookNotificationService webhookNotificationService,
                                   TwilioNotificationService twilioNotificationService,
                                   MetricsConfig metricsConfig) {
        this.logRepository = logRepository;
        this.incidentRepository = incidentRepository;
        this.anomalyEngine = anomalyEngine;
        this.config = config;
        this.webhookNotificationService = webhookNotificationService;
        this.twilioNotificationService = twilioNotificationService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Detect anomalies in recently stored logs and open incidents for them.
     * A storage failure while opening incidents propagates; incidents already opened stay.
     */
    @Observed(name = "detection.run", contextualName = "run-detection")
    public DetectionRun runDetection() {
        Instant since = Instant.now().minus(config.getLookback());
        List<LogEntry> logs = logRepository.findSince(since, config.getFetchLimit());

        if (logs.size() < config.getMinLogs()) {
            log.debug("Skipping detection: {} logs since {}, need {}", logs.size(), since, config.getMinLogs());
            metricsConfig.recordDetectionRun("insufficient_logs", logs.size());
            return DetectionRun.builder()
                    .anomaliesDetected(0)
                    .message(NOT_ENOUGH_LOGS)
                    .build();
        }

        List<Map<String, Object>> batch = logs.stream().map(LogEntry::toRawRecord).toList();
        DetectionReport report = anomalyEngine.analyze(batch);
        metricsConfig.recordRecordsDropped(report.getRecordsDropped());

        List<AnomalyRecord> anomalies = report.getAnomalies();
        if (anomalies.isEmpty()) {
            metricsConfig.recordDetectionRun("clean", logs.size());
            return DetectionRun.builder()
                    .anomaliesDetected(0)
                    .message(NO_ANOMALIES)
                    .build();
        }

        List<Long> createdIncidents = new ArrayList<>();
        for (AnomalyRecord anomaly : anomalies) {
            metricsConfig.recordAnomaly(anomaly.getType().name(), anomaly.getSeverity().wireName());

            Incident incident = Incident.builder()
                    .status(IncidentStatus.OPEN)
                    .severity(anomaly.getSeverity())
                    .description(anomaly.getDescription())
                    .build();
            long incidentId = incidentRepository.create(incident);
            createdIncidents.add(incidentId);
            metricsConfig.recordIncidentCreated(anomaly.getSeverity().wireName());

            sendAlerts(incident);
        }

        metricsConfig.recordDetectionRun("anomalies", logs.size());
        metricsConfig.updateOpenIncidentCount(incidentRepository.countOpen());
        log.warn("Detection run over {} logs found {} anomalies, opened incidents {}",
                logs.size(), anomalies.size(), createdIncidents);

        return DetectionRun.builder()
                .anomaliesDetected(anomalies.size())
                .incidentsCreated(createdIncidents)
                .anomalies(anomalies)
                .build();
    }

    /**
     * Run the engine over a caller-supplied batch. Nothing is stored and no alerts are sent.
     */
    public DetectionReport analyze(List<Map<String, Object>> batch) {
        DetectionReport report = anomalyEngine.analyze(batch);
        metricsConfig.recordRecordsDropped(report.getRecordsDropped());
        return report;
    }

    @Scheduled(fixedRateString = "${detection.schedule.interval-minutes:5}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "1")
    public void runScheduledDetection() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            DetectionRun run = runDetection();
            log.info("Scheduled detection complete: anomalies={}", run.getAnomaliesDetected());
        } catch (Exception e) {
            log.error("Scheduled detection run failed: {}", e.getMessage(), e);
        }
    }

    private void sendAlerts(Incident incident) {
        try {
            webhookNotificationService.notifyIncident(incident);
        } catch (Exception e) {
            log.error("Failed to dispatch webhook alert for incident={}: {}", incident.getId(), e.getMessage(), e);
        }
        try {
            twilioNotificationService.notifyIncident(incident);
        } catch (Exception e) {
            log.error("Failed to dispatch Twilio alert for incident={}: {}", incident.getId(), e.getMessage(), e);
        }
    }
}
