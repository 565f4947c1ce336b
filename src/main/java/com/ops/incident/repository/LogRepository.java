package com.ops.incident.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ops.incident.config.AerospikeConfig;
import com.ops.incident.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Repository
public class LogRepository {

    private static final Logger log = LoggerFactory.getLogger(LogRepository.class);

    static final String LOG_SEQUENCE = "log_id";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final SequenceRepository sequenceRepository;
    private final ObjectMapper objectMapper;

    public LogRepository(AerospikeClient client,
                         @Qualifier("aerospikeNamespace") String namespace,
                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                         SequenceRepository sequenceRepository) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.sequenceRepository = sequenceRepository;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Store a batch of logs, assigning consecutive ids.
     */
    public void insertAll(List<LogEntry> entries) {
        if (entries.isEmpty()) return;

        long nextId = sequenceRepository.reserve(LOG_SEQUENCE, entries.size());
        for (LogEntry entry : entries) {
            entry.setId(nextId++);
            Key key = new Key(namespace, AerospikeConfig.SET_LOGS, entry.getId());
            client.put(writePolicy, key,
                    new Bin("id", entry.getId()),
                    new Bin("timestamp", entry.getTimestamp().toEpochMilli()),
                    new Bin("service", entry.getService()),
                    new Bin("level", entry.getLevel()),
                    new Bin("message", entry.getMessage()),
                    new Bin("metadata", serializeMetadata(entry.getMetadata())));
        }
    }

    /**
     * Logs with timestamp at or after {@code since}, newest first, at most {@code limit}.
     */
    public List<LogEntry> findSince(Instant since, int limit) {
        long sinceMillis = since.toEpochMilli();
        return scan(record -> record.getLong("timestamp") >= sinceMillis, limit);
    }

    /**
     * Most recent logs regardless of age, newest first.
     */
    public List<LogEntry> findLatest(int limit) {
        return scan(record -> true, limit);
    }

    private List<LogEntry> scan(Predicate<Record> filter, int limit) {
        List<LogEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_LOGS,
                (key, record) -> {
                    if (filter.test(record)) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });

        results.sort(Comparator.comparing(LogEntry::getTimestamp)
                .thenComparingLong(LogEntry::getId)
                .reversed());
        int max = Math.max(limit, 0);
        if (results.size() > max) {
            return new ArrayList<>(results.subList(0, max));
        }
        return results;
    }

    private LogEntry mapRecord(Record record) {
        return LogEntry.builder()
                .id(record.getLong("id"))
                .timestamp(Instant.ofEpochMilli(record.getLong("timestamp")))
                .service(record.getString("service"))
                .level(record.getString("level"))
                .message(record.getString("message"))
                .metadata(deserializeMetadata(record.getString("metadata")))
                .build();
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return "{}";
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (Exception e) {
            log.error("Failed to serialize log metadata", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize log metadata", e);
            return Collections.emptyMap();
        }
    }
}
