package com.ops.incident.service;

import com.ops.incident.config.MetricsConfig;
import com.ops.incident.model.IngestLogsRequest;
import com.ops.incident.model.LogEntry;
import com.ops.incident.repository.LogRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class LogIngestionService {

    private static final Logger log = LoggerFactory.getLogger(LogIngestionService.class);

    private final LogRepository logRepository;
    private final MetricsConfig metricsConfig;

    public LogIngestionService(LogRepository logRepository, MetricsConfig metricsConfig) {
        this.logRepository = logRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Store a batch of log lines. Lines without a timestamp are stamped with the ingestion time.
     *
     * @return the stored entries with their assigned ids
     */
    @Observed(name = "logs.ingest", contextualName = "ingest-logs")
    public List<LogEntry> ingest(List<IngestLogsRequest.Line> lines) {
        Instant now = Instant.now();
        List<LogEntry> entries = new ArrayList<>(lines.size());
        for (IngestLogsRequest.Line line : lines) {
            entries.add(LogEntry.builder()
                    .timestamp(line.getTimestamp() != null ? line.getTimestamp() : now)
                    .service(line.getService())
                    .level(line.getLevel())
                    .message(line.getMessage())
                    .metadata(line.getMetadata())
                    .build());
        }

        logRepository.insertAll(entries);
        metricsConfig.recordLogsIngested(entries.size());
        log.debug("Ingested {} log lines", entries.size());
        return entries;
    }

    public List<LogEntry> getRecentLogs(int limit) {
        return logRepository.findLatest(limit);
    }
}
